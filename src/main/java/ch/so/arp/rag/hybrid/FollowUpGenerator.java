package ch.so.arp.rag.hybrid;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Suggests up to three follow-up questions for an answer.
 */
class FollowUpGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FollowUpGenerator.class);

    private static final int MAX_FOLLOW_UPS = 3;
    private static final int CONTEXT_PREVIEW = 800;

    private final Generator generator;

    FollowUpGenerator(Generator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    List<String> generate(RequestContext context, String query, String answer, String contextText) {
        Completion completion = generator.complete(List.of(
                ChatMessage.system("Generate 2-3 concise follow-up questions based on the answer "
                        + "and missing context. Return JSON with key: follow_ups."),
                ChatMessage.user("Query: " + query + "\nAnswer: " + answer + "\nContext:\n"
                        + StructuredOutput.preview(contextText, CONTEXT_PREVIEW))),
                120, 0.3d, ResponseFormat.JSON_OBJECT);

        JsonNode data = StructuredOutput.parseObject(completion.text());
        List<String> followUps = StructuredOutput.strings(data, "follow_ups");
        if (followUps.isEmpty()) {
            LOGGER.debug("No follow-ups parsed for request {}", context.requestId());
        }
        return List.copyOf(followUps.subList(0, Math.min(MAX_FOLLOW_UPS, followUps.size())));
    }
}
