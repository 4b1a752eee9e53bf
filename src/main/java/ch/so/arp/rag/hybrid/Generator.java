package ch.so.arp.rag.hybrid;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke a real chat completion API or return predictable responses for testing.
 */
public interface Generator {

    /**
     * Complete the conversation.
     *
     * @param messages    system and user messages in order
     * @param maxTokens   upper bound for generated tokens
     * @param temperature sampling temperature
     * @param format      requested output format
     * @return the completion
     * @throws GenerationUnavailableException if the backend fails
     */
    Completion complete(List<ChatMessage> messages, int maxTokens, double temperature, ResponseFormat format);
}
