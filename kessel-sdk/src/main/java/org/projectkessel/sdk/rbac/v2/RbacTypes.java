package org.projectkessel.sdk.rbac.v2;

import org.projectkessel.api.inventory.v1beta2.ReporterReference;
import org.projectkessel.api.inventory.v1beta2.RepresentationType;
import org.projectkessel.api.inventory.v1beta2.ResourceReference;
import org.projectkessel.api.inventory.v1beta2.SubjectReference;

/**
 * Inventory references for resources reported by RBAC.
 */
public final class RbacTypes {

    public static final String REPORTER = "rbac";

    private RbacTypes() {
    }

    public static RepresentationType workspaceType() {
        return rbacType("workspace");
    }

    public static RepresentationType roleType() {
        return rbacType("role");
    }

    /**
     * A principal, identified as {@code domain/id} (e.g. {@code redhat/12345}).
     */
    public static ResourceReference principalResource(String id, String domain) {
        return rbacResource("principal", domain + "/" + id);
    }

    public static ResourceReference roleResource(String resourceId) {
        return rbacResource("role", resourceId);
    }

    public static ResourceReference workspaceResource(String resourceId) {
        return rbacResource("workspace", resourceId);
    }

    public static SubjectReference principalSubject(String id, String domain) {
        return SubjectReference.newBuilder()
                .setResource(principalResource(id, domain))
                .build();
    }

    /**
     * A subject for {@code resource}, optionally narrowed to a relation (e.g. group {@code member}).
     */
    public static SubjectReference subject(ResourceReference resource, String relation) {
        SubjectReference.Builder subject = SubjectReference.newBuilder().setResource(resource);
        if (relation != null && !relation.isEmpty()) {
            subject.setRelation(relation);
        }
        return subject.build();
    }

    private static RepresentationType rbacType(String resourceType) {
        return RepresentationType.newBuilder()
                .setResourceType(resourceType)
                .setReporterType(REPORTER)
                .build();
    }

    private static ResourceReference rbacResource(String resourceType, String resourceId) {
        return ResourceReference.newBuilder()
                .setResourceType(resourceType)
                .setResourceId(resourceId)
                .setReporter(ReporterReference.newBuilder().setType(REPORTER))
                .build();
    }
}
