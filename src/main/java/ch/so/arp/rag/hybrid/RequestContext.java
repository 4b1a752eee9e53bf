package ch.so.arp.rag.hybrid;

import java.util.Objects;
import java.util.UUID;

/**
 * Request scoped identifiers passed explicitly to every pipeline stage.
 */
public record RequestContext(String requestId, String traceId, String tenantId) {

    public RequestContext {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(tenantId, "tenantId");
    }

    public static RequestContext create(String requestId, String tenantId) {
        return new RequestContext(requestId, UUID.randomUUID().toString(), tenantId);
    }
}
