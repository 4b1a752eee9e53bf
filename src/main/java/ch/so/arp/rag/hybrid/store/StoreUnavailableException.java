package ch.so.arp.rag.hybrid.store;

/**
 * Raised when the metadata store or the index snapshot cannot be read or
 * written and automatic rebuilding does not help.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
