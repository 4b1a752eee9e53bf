package ch.so.arp.rag.hybrid;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Asks the generator to pick one {@link ToolAction} for the query. Answers that
 * are not valid JSON or name an action outside the allowed set resolve to
 * {@link ToolAction#NONE}.
 */
class ToolRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolRouter.class);

    private static final int CONTEXT_PREVIEW = 1200;

    private final Generator generator;

    ToolRouter(Generator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    ToolAction select(RequestContext context, String query, String contextText, boolean documentActions) {
        List<ToolAction> allowed = ToolAction.allowed(documentActions);
        String names = allowed.stream().map(ToolAction::wireName).collect(Collectors.joining(", "));
        String prompt = "Choose the best tool for the user query based on the context. "
                + "Return JSON with keys: tool, reason. "
                + "Allowed tools: " + names + ".\n\n"
                + "Query: " + query + "\n\n"
                + "Context (preview):\n" + StructuredOutput.preview(contextText, CONTEXT_PREVIEW);
        Completion completion = generator.complete(
                List.of(ChatMessage.system("You are a strict tool router."), ChatMessage.user(prompt)),
                120, 0.0d, ResponseFormat.JSON_OBJECT);

        JsonNode data = StructuredOutput.parseObject(completion.text());
        String tool = StructuredOutput.text(data, "tool");
        ToolAction action = ToolAction.fromWireName(tool).filter(allowed::contains).orElse(null);
        if (action == null) {
            if (tool != null) {
                LOGGER.warn("Router proposed unknown tool '{}' for request {}; using none", tool,
                        context.requestId());
            }
            return ToolAction.NONE;
        }
        return action;
    }
}
