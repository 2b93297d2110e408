package org.projectkessel.sdk.rbac.v2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An RBAC workspace as returned by the workspaces API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Workspace(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description) {
}
