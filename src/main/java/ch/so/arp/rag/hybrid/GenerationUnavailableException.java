package ch.so.arp.rag.hybrid;

/**
 * The completion backend could not produce an answer.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
