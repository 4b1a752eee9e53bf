package ch.so.arp.rag.hybrid;

/**
 * Generated text with optional token usage.
 */
public record Completion(String text, TokenUsage usage) {

    public Completion {
        text = text == null ? "" : text;
    }
}
