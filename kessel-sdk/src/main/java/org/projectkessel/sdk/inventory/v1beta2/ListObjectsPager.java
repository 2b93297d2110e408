package org.projectkessel.sdk.inventory.v1beta2;

import io.grpc.Context;
import org.projectkessel.api.inventory.v1beta2.Consistency;
import org.projectkessel.api.inventory.v1beta2.RepresentationType;
import org.projectkessel.api.inventory.v1beta2.SubjectReference;

import java.util.Objects;

/**
 * Presents the pages of {@code StreamedListObjects} as one sequence.
 *
 * <pre>{@code
 * try (PagedStream objects = ListObjectsPager.create()
 *         .page(stub::streamedListObjects, RbacTypes.workspaceType(), "view", subject, null)) {
 *     while (objects.hasNext()) {
 *         StreamedListObjectsResponse response = objects.next().getOrThrow();
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <p>Each page is a server stream; when it ends with a non-empty continuation token the next page
 * is requested with that token. Nothing is sent until the consumer asks for the first item.</p>
 */
public final class ListObjectsPager {

    public static final int DEFAULT_LIMIT = 1000;

    private final int limit;
    private final Consistency consistency;

    private ListObjectsPager(int limit, Consistency consistency) {
        this.limit = limit;
        this.consistency = consistency;
    }

    public static ListObjectsPager create() {
        return new ListObjectsPager(DEFAULT_LIMIT, null);
    }

    /**
     * Items requested per page (default 1000).
     */
    public ListObjectsPager withLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return new ListObjectsPager(limit, consistency);
    }

    public ListObjectsPager withConsistency(Consistency consistency) {
        return new ListObjectsPager(limit, consistency);
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Start a lazy listing. Cancelling the current gRPC {@link Context} cancels the listing too.
     *
     * @param continuationToken where to resume, or {@code null}/empty to start from the beginning
     */
    public PagedStream page(StreamedListObjectsCall call,
                            RepresentationType objectType,
                            String relation,
                            SubjectReference subject,
                            String continuationToken) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(objectType, "objectType");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(subject, "subject");
        return new PagedStream(Context.current(), call, objectType, relation, subject,
                continuationToken == null ? "" : continuationToken, limit, consistency);
    }
}
