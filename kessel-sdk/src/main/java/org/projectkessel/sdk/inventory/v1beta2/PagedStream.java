package org.projectkessel.sdk.inventory.v1beta2;

import io.grpc.Context;
import io.grpc.Status;
import org.projectkessel.api.inventory.v1beta2.Consistency;
import org.projectkessel.api.inventory.v1beta2.RepresentationType;
import org.projectkessel.api.inventory.v1beta2.RequestPagination;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsRequest;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsResponse;
import org.projectkessel.api.inventory.v1beta2.SubjectReference;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.exception.KesselException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based iteration over every page of a listing, created by {@link ListObjectsPager}.
 *
 * <p>Responses are delivered in the order received and page N+1 is only requested after page N's
 * stream has ended. A failure to start or read a page is delivered as a final
 * {@link PageResult#isError() error} item. Closing cancels the RPC in flight, and cancelling the
 * caller's context ends the listing with a {@code CANCELLED} error item on the next pull.</p>
 *
 * <p>Not thread-safe; meant to be consumed by one thread.</p>
 */
public class PagedStream implements Iterator<PageResult<StreamedListObjectsResponse>>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PagedStream.class);

    private final Context parentContext;
    private final StreamedListObjectsCall call;
    private final RepresentationType objectType;
    private final String relation;
    private final SubjectReference subject;
    private final int limit;
    private final Consistency consistency;

    private String nextToken;
    private String lastToken = "";
    private Iterator<StreamedListObjectsResponse> current;
    private Context.CancellableContext currentContext;
    private PageResult<StreamedListObjectsResponse> pending;
    private boolean finished;
    private int pagesRequested;

    PagedStream(Context parentContext,
                StreamedListObjectsCall call,
                RepresentationType objectType,
                String relation,
                SubjectReference subject,
                String continuationToken,
                int limit,
                Consistency consistency) {
        this.parentContext = parentContext;
        this.call = call;
        this.objectType = objectType;
        this.relation = relation;
        this.subject = subject;
        this.nextToken = continuationToken;
        this.limit = limit;
        this.consistency = consistency;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        pending = advance();
        return pending != null;
    }

    @Override
    public PageResult<StreamedListObjectsResponse> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        PageResult<StreamedListObjectsResponse> result = pending;
        pending = null;
        return result;
    }

    /**
     * Number of list RPCs started so far.
     */
    public int getPagesRequested() {
        return pagesRequested;
    }

    /**
     * Continuation token of the last response seen on the current page, empty if none.
     */
    public String getLastContinuationToken() {
        return lastToken;
    }

    /**
     * The remaining items as a sequential stream; closing the stream closes this listing.
     */
    public Stream<PageResult<StreamedListObjectsResponse>> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    @Override
    public void close() {
        if (!finished) {
            log.debug("Listing closed after {} page(s)", pagesRequested);
        }
        finished = true;
        pending = null;
        releaseCurrent();
    }

    private PageResult<StreamedListObjectsResponse> advance() {
        while (true) {
            if (parentContext.isCancelled()) {
                String where = current == null
                        ? "before page " + (pagesRequested + 1)
                        : "during page " + pagesRequested;
                return fail(new KesselException(ErrorKind.CONNECTION_FAILED,
                        "listing cancelled " + where, Status.Code.CANCELLED));
            }
            if (current == null) {
                PageResult<StreamedListObjectsResponse> startFailure = startPage();
                if (startFailure != null) {
                    return startFailure;
                }
            }

            try {
                if (current.hasNext()) {
                    StreamedListObjectsResponse response = current.next();
                    if (response.hasPagination()) {
                        lastToken = response.getPagination().getContinuationToken();
                    }
                    return PageResult.of(response);
                }
            } catch (RuntimeException e) {
                return fail(new KesselException(ErrorKind.CONNECTION_FAILED,
                        "error receiving from stream", e));
            }

            releaseCurrent();
            if (lastToken.isEmpty()) {
                log.debug("Listing finished after {} page(s)", pagesRequested);
                finished = true;
                return null;
            }
            nextToken = lastToken;
        }
    }

    private PageResult<StreamedListObjectsResponse> startPage() {
        StreamedListObjectsRequest request = buildRequest(nextToken);
        Context.CancellableContext pageContext = parentContext.withCancellation();
        Context previous = pageContext.attach();
        try {
            pagesRequested++;
            log.debug("Requesting page {} of {} objects (token present: {})",
                    pagesRequested, objectType.getResourceType(), !nextToken.isEmpty());
            current = call.start(request);
            currentContext = pageContext;
            lastToken = "";
            return null;
        } catch (RuntimeException e) {
            pageContext.cancel(e);
            return fail(new KesselException(ErrorKind.CONNECTION_FAILED, "failed to start stream", e));
        } finally {
            pageContext.detach(previous);
        }
    }

    private StreamedListObjectsRequest buildRequest(String token) {
        RequestPagination.Builder pagination = RequestPagination.newBuilder().setLimit(limit);
        if (!token.isEmpty()) {
            pagination.setContinuationToken(token);
        }
        StreamedListObjectsRequest.Builder request = StreamedListObjectsRequest.newBuilder()
                .setObjectType(objectType)
                .setRelation(relation)
                .setSubject(subject)
                .setPagination(pagination);
        if (consistency != null) {
            request.setConsistency(consistency);
        }
        return request.build();
    }

    private PageResult<StreamedListObjectsResponse> fail(KesselException error) {
        finished = true;
        releaseCurrent();
        return PageResult.failed(error);
    }

    private void releaseCurrent() {
        current = null;
        if (currentContext != null) {
            currentContext.cancel(null);
            currentContext = null;
        }
    }
}
