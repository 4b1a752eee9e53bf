package ch.so.arp.rag.hybrid;

import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the {@link RequestContext} from request headers. The tenant is the
 * {@code X-Tenant-Id} header, else {@code X-Session-Id}, else the client address.
 */
@Component
public class RequestContextResolver {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String SESSION_HEADER = "X-Session-Id";

    public RequestContext resolve(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        String tenantId = request.getHeader(TENANT_HEADER);
        if (!StringUtils.hasText(tenantId)) {
            tenantId = request.getHeader(SESSION_HEADER);
        }
        if (!StringUtils.hasText(tenantId)) {
            String forwarded = request.getHeader("X-Forwarded-For");
            tenantId = StringUtils.hasText(forwarded) ? forwarded.split(",")[0].trim() : request.getRemoteAddr();
        }
        return RequestContext.create(requestId, tenantId);
    }
}
