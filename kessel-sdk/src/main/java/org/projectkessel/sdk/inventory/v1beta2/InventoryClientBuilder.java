package org.projectkessel.sdk.inventory.v1beta2;

import org.projectkessel.api.inventory.v1beta2.KesselInventoryServiceGrpc;
import org.projectkessel.api.inventory.v1beta2.KesselInventoryServiceGrpc.KesselInventoryServiceBlockingStub;
import org.projectkessel.api.inventory.v1beta2.KesselInventoryServiceGrpc.KesselInventoryServiceStub;
import org.projectkessel.sdk.grpc.ClientBuilder;

/**
 * Entry points for gRPC clients of the inventory service.
 *
 * <pre>{@code
 * StubConnection<KesselInventoryServiceBlockingStub> connection = InventoryClientBuilder
 *     .forTarget("kessel-inventory.example.com:443")
 *     .oauth2ClientAuthenticated(credentials)
 *     .build();
 * }</pre>
 */
public final class InventoryClientBuilder {

    private InventoryClientBuilder() {
    }

    public static ClientBuilder<KesselInventoryServiceBlockingStub> forTarget(String target) {
        return ClientBuilder.forTarget(target, KesselInventoryServiceGrpc::newBlockingStub);
    }

    public static ClientBuilder<KesselInventoryServiceStub> forTargetAsync(String target) {
        return ClientBuilder.forTarget(target, KesselInventoryServiceGrpc::newStub);
    }
}
