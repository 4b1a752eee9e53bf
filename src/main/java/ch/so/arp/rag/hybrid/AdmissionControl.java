package ch.so.arp.rag.hybrid;

import java.time.Duration;

/**
 * Per-key request rate gate applied before a request enters the pipeline.
 */
public interface AdmissionControl {

    /**
     * Record one request for the key and reject it when the key already used
     * {@code limit} requests within {@code window}.
     *
     * @throws RateLimitedException if the request is not admitted
     */
    void check(String scope, String key, int limit, Duration window);
}
