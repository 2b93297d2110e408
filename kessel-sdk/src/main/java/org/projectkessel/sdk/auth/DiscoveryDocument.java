package org.projectkessel.sdk.auth;

/**
 * The parts of an OpenID Connect metadata document the SDK uses.
 */
public record DiscoveryDocument(String tokenEndpoint, String issuer) {
}
