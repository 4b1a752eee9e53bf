package ch.so.arp.rag.hybrid;

/**
 * Raised by {@link AdmissionControl} when a key exceeded its request budget.
 */
public class RateLimitedException extends RuntimeException {

    private final String scope;

    public RateLimitedException(String scope) {
        super("Rate limit exceeded for " + scope + ". Try again later.");
        this.scope = scope;
    }

    public String getScope() {
        return scope;
    }
}
