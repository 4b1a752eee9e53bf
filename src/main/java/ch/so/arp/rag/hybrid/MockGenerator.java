package ch.so.arp.rag.hybrid;

import java.util.List;

/**
 * Deterministic {@link Generator} used in tests and local development where the
 * completion API should not be contacted. Structured requests receive an empty
 * JSON object, so planning, routing and follow-ups fall back to their defaults.
 */
class MockGenerator implements Generator {

    private static final List<String> DEFAULT_LINES = List.of(
            "This is a mocked response.",
            "Provide an API key to reach the real completion service.");

    @Override
    public Completion complete(List<ChatMessage> messages, int maxTokens, double temperature, ResponseFormat format) {
        if (format == ResponseFormat.JSON_OBJECT) {
            return new Completion("{}", null);
        }
        StringBuilder answer = new StringBuilder("[mocked answer]");
        DEFAULT_LINES.forEach(line -> answer.append(' ').append(line));
        String lastUser = messages.stream()
                .filter(message -> "user".equals(message.role()))
                .reduce((first, second) -> second)
                .map(ChatMessage::content)
                .orElse("");
        answer.append(" Prompt length: ").append(lastUser.length());
        return new Completion(answer.toString(), new TokenUsage(0, 0, 0));
    }
}
