package org.projectkessel.sdk.rbac.v2;

import org.projectkessel.api.inventory.v1beta2.SubjectReference;
import org.projectkessel.sdk.inventory.v1beta2.ListObjectsPager;
import org.projectkessel.sdk.inventory.v1beta2.PagedStream;
import org.projectkessel.sdk.inventory.v1beta2.StreamedListObjectsCall;

/**
 * Workspace listings through the inventory service.
 */
public final class Workspaces {

    private Workspaces() {
    }

    /**
     * Every workspace on which {@code subject} has {@code relation}, across all pages.
     *
     * <pre>{@code
     * try (PagedStream workspaces = Workspaces.listWorkspaces(
     *         stub::streamedListObjects, RbacTypes.principalSubject("12345", "redhat"), "view_document", null)) {
     *     workspaces.forEachRemaining(result -> System.out.println(result.getOrThrow().getObject().getResourceId()));
     * }
     * }</pre>
     */
    public static PagedStream listWorkspaces(StreamedListObjectsCall call,
                                             SubjectReference subject,
                                             String relation,
                                             String continuationToken) {
        return listWorkspaces(ListObjectsPager.create(), call, subject, relation, continuationToken);
    }

    public static PagedStream listWorkspaces(ListObjectsPager pager,
                                             StreamedListObjectsCall call,
                                             SubjectReference subject,
                                             String relation,
                                             String continuationToken) {
        return pager.page(call, RbacTypes.workspaceType(), relation, subject, continuationToken);
    }
}
