package org.projectkessel.sdk.rbac.v2;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.projectkessel.api.inventory.v1beta2.ResourceReference;
import org.projectkessel.api.inventory.v1beta2.ResponsePagination;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsRequest;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsResponse;
import org.projectkessel.api.inventory.v1beta2.SubjectReference;
import org.projectkessel.sdk.inventory.v1beta2.PagedStream;
import org.projectkessel.sdk.inventory.v1beta2.StreamedListObjectsCall;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkspacesTest {

    private static StreamedListObjectsResponse workspace(String id, String token) {
        return StreamedListObjectsResponse.newBuilder()
                .setObject(RbacTypes.workspaceResource(id))
                .setPagination(ResponsePagination.newBuilder().setContinuationToken(token))
                .build();
    }

    @Test
    void listsWorkspacesAcrossPages() {
        StreamedListObjectsCall call = mock(StreamedListObjectsCall.class);
        when(call.start(any())).thenReturn(
                List.of(workspace("ws-1", "tok-2")).iterator(),
                List.of(workspace("ws-2", "")).iterator());
        SubjectReference subject = RbacTypes.principalSubject("12345", "redhat");

        List<String> ids = new ArrayList<>();
        try (PagedStream workspaces = Workspaces.listWorkspaces(call, subject, "inventory_host_view", null)) {
            workspaces.forEachRemaining(result -> {
                ResourceReference object = result.getOrThrow().getObject();
                ids.add(object.getResourceId());
            });
        }

        assertEquals(List.of("ws-1", "ws-2"), ids);
        ArgumentCaptor<StreamedListObjectsRequest> captor = ArgumentCaptor.forClass(StreamedListObjectsRequest.class);
        verify(call, times(2)).start(captor.capture());
        StreamedListObjectsRequest first = captor.getAllValues().get(0);
        assertEquals(RbacTypes.workspaceType(), first.getObjectType());
        assertEquals("inventory_host_view", first.getRelation());
        assertEquals(subject, first.getSubject());
        assertEquals("tok-2", captor.getAllValues().get(1).getPagination().getContinuationToken());
    }
}
