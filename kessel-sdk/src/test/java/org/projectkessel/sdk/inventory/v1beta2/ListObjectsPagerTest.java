package org.projectkessel.sdk.inventory.v1beta2;

import io.grpc.Context;
import io.grpc.Status;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.projectkessel.api.inventory.v1beta2.Consistency;
import org.projectkessel.api.inventory.v1beta2.ResourceReference;
import org.projectkessel.api.inventory.v1beta2.ResponsePagination;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsRequest;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsResponse;
import org.projectkessel.api.inventory.v1beta2.SubjectReference;
import org.projectkessel.sdk.exception.ErrorKind;
import org.projectkessel.sdk.rbac.v2.RbacTypes;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ListObjectsPagerTest {

    private static final SubjectReference SUBJECT = RbacTypes.principalSubject("12345", "redhat");

    private static StreamedListObjectsResponse response(String id, String continuationToken) {
        return StreamedListObjectsResponse.newBuilder()
                .setObject(ResourceReference.newBuilder().setResourceType("workspace").setResourceId(id))
                .setPagination(ResponsePagination.newBuilder().setContinuationToken(continuationToken))
                .build();
    }

    private static Iterator<StreamedListObjectsResponse> page(StreamedListObjectsResponse... responses) {
        return List.of(responses).iterator();
    }

    private static PagedStream list(StreamedListObjectsCall call, String token) {
        return ListObjectsPager.create().page(call, RbacTypes.workspaceType(), "view", SUBJECT, token);
    }

    private static List<String> ids(PagedStream stream) {
        return stream.stream()
                .map(result -> result.getOrThrow().getObject().getResourceId())
                .collect(Collectors.toList());
    }

    @Test
    void singlePageWithEmptyTokenIssuesOneCall() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page(response("ws-1", ""), response("ws-2", "")));

        List<String> ids = ids(list(call, null));

        assertEquals(List.of("ws-1", "ws-2"), ids);
        verify(call, times(1)).start(any());
    }

    @Test
    void continuationTokenStartsNextPage() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(
                page(response("ws-1", "next-page-token")),
                page(response("ws-2", "")));

        List<String> ids = ids(list(call, null));

        assertEquals(List.of("ws-1", "ws-2"), ids);
        ArgumentCaptor<StreamedListObjectsRequest> captor = ArgumentCaptor.forClass(StreamedListObjectsRequest.class);
        verify(call, times(2)).start(captor.capture());
        StreamedListObjectsRequest first = captor.getAllValues().get(0);
        StreamedListObjectsRequest second = captor.getAllValues().get(1);
        assertFalse(first.getPagination().hasContinuationToken());
        assertEquals("next-page-token", second.getPagination().getContinuationToken());
    }

    @Test
    void requestCarriesQueryAndPageLimit() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page());
        Consistency consistency = Consistency.newBuilder().setMinimizeLatency(true).build();

        try (PagedStream stream = ListObjectsPager.create()
                .withLimit(50)
                .withConsistency(consistency)
                .page(call, RbacTypes.workspaceType(), "view", SUBJECT, "resume-here")) {
            assertFalse(stream.hasNext());
        }

        ArgumentCaptor<StreamedListObjectsRequest> captor = ArgumentCaptor.forClass(StreamedListObjectsRequest.class);
        verify(call).start(captor.capture());
        StreamedListObjectsRequest request = captor.getValue();
        assertEquals("workspace", request.getObjectType().getResourceType());
        assertEquals("rbac", request.getObjectType().getReporterType());
        assertEquals("view", request.getRelation());
        assertEquals(SUBJECT, request.getSubject());
        assertEquals(50, request.getPagination().getLimit());
        assertEquals("resume-here", request.getPagination().getContinuationToken());
        assertTrue(request.getConsistency().getMinimizeLatency());
    }

    @Test
    void defaultLimitIsOneThousand() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page());

        list(call, "").hasNext();

        ArgumentCaptor<StreamedListObjectsRequest> captor = ArgumentCaptor.forClass(StreamedListObjectsRequest.class);
        verify(call).start(captor.capture());
        assertEquals(ListObjectsPager.DEFAULT_LIMIT, captor.getValue().getPagination().getLimit());
        assertFalse(captor.getValue().getPagination().hasContinuationToken());
    }

    @Test
    void tokenIsTakenFromLastResponseOfPage() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(
                page(response("ws-1", "stale"), response("ws-2", "latest")),
                page(response("ws-3", "")));

        ids(list(call, null));

        ArgumentCaptor<StreamedListObjectsRequest> captor = ArgumentCaptor.forClass(StreamedListObjectsRequest.class);
        verify(call, times(2)).start(captor.capture());
        assertEquals("latest", captor.getAllValues().get(1).getPagination().getContinuationToken());
    }

    @Test
    void emptyPageEndsListing() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page());

        PagedStream stream = list(call, null);

        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
        assertEquals(1, stream.getPagesRequested());
    }

    @Test
    void nothingIsSentUntilConsumerPulls() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);

        PagedStream stream = list(call, null);

        verifyNoInteractions(call);
        stream.close();
        assertFalse(stream.hasNext());
        verifyNoInteractions(call);
    }

    @Test
    void startFailureIsTerminalErrorItem() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenThrow(Status.UNAVAILABLE.withDescription("no backend").asRuntimeException());

        PagedStream stream = list(call, null);

        PageResult<StreamedListObjectsResponse> result = stream.next();
        assertTrue(result.isError());
        assertEquals(ErrorKind.CONNECTION_FAILED, result.error().getKind());
        assertEquals(Status.Code.UNAVAILABLE, result.error().getGrpcCode());
        assertTrue(result.error().getMessage().contains("failed to start stream"));
        assertFalse(stream.hasNext());
    }

    @Test
    void receiveFailureIsTerminalErrorItemAfterDeliveredResponses() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        @SuppressWarnings("unchecked")
        Iterator<StreamedListObjectsResponse> failing = mock(Iterator.class);
        when(failing.hasNext()).thenReturn(true).thenThrow(Status.INTERNAL.asRuntimeException());
        when(failing.next()).thenReturn(response("ws-1", "more"));
        when(call.start(any())).thenReturn(failing);

        PagedStream stream = list(call, null);

        assertEquals("ws-1", stream.next().getOrThrow().getObject().getResourceId());
        PageResult<StreamedListObjectsResponse> result = stream.next();
        assertTrue(result.isError());
        assertTrue(result.error().getMessage().contains("error receiving from stream"));
        assertEquals(Status.Code.INTERNAL, result.error().getGrpcCode());
        assertFalse(stream.hasNext());
        verify(call, times(1)).start(any());
    }

    @Test
    void cancelledContextStopsBeforeNextPage() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page(response("ws-1", "next-page-token")));

        Context.CancellableContext context = Context.current().withCancellation();
        PagedStream stream;
        Context previous = context.attach();
        try {
            stream = list(call, null);
        } finally {
            context.detach(previous);
        }

        assertFalse(stream.next().isError());
        context.cancel(null);

        PageResult<StreamedListObjectsResponse> result = stream.next();
        assertTrue(result.isError());
        assertEquals(Status.Code.CANCELLED, result.error().getGrpcCode());
        assertFalse(stream.hasNext());
        verify(call, times(1)).start(any());
    }

    @Test
    void cancelledContextStopsMidPage() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page(response("a", ""), response("b", ""), response("c", "")));

        Context.CancellableContext context = Context.current().withCancellation();
        PagedStream stream;
        Context previous = context.attach();
        try {
            stream = list(call, null);
        } finally {
            context.detach(previous);
        }

        assertEquals("a", stream.next().getOrThrow().getObject().getResourceId());
        context.cancel(null);

        PageResult<StreamedListObjectsResponse> result = stream.next();
        assertTrue(result.isError());
        assertEquals(Status.Code.CANCELLED, result.error().getGrpcCode());
        assertTrue(result.error().getMessage().contains("during page 1"));
        assertFalse(stream.hasNext());
    }

    @Test
    void closingStreamStopsIteration() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(page(response("ws-1", "next-page-token")));

        PagedStream stream = list(call, null);
        try (Stream<PageResult<StreamedListObjectsResponse>> items = stream.stream()) {
            assertEquals("ws-1", items.findFirst().orElseThrow().getOrThrow().getObject().getResourceId());
        }

        assertFalse(stream.hasNext());
        verify(call, times(1)).start(any());
    }

    @Test
    void pageResultRequiresExactlyOneSide() {
        assertThrows(IllegalArgumentException.class, () -> new PageResult<>(null, null));
        assertThrows(NullPointerException.class, () -> PageResult.of(null));
    }

    @Test
    void invalidLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ListObjectsPager.create().withLimit(0));
    }
}
