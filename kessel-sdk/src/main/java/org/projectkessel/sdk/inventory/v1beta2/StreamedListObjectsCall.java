package org.projectkessel.sdk.inventory.v1beta2;

import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsRequest;
import org.projectkessel.api.inventory.v1beta2.StreamedListObjectsResponse;

import java.util.Iterator;

/**
 * Starts one server-streaming list call. {@code blockingStub::streamedListObjects} fits.
 */
@FunctionalInterface
public interface StreamedListObjectsCall {

    Iterator<StreamedListObjectsResponse> start(StreamedListObjectsRequest request);
}
