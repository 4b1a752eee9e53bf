package ch.so.arp.rag.hybrid;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the selected {@link ToolAction}. Document actions never throw; their
 * failures are returned as text. Generator-backed tools propagate
 * {@link GenerationUnavailableException}.
 */
class ToolExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolExecutor.class);

    private static final int TOOL_MAX_TOKENS = 400;
    private static final double TOOL_TEMPERATURE = 0.2d;

    private final Generator generator;

    ToolExecutor(Generator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    String run(RequestContext context, ToolAction action, String query, String contextText,
            List<RetrievalCandidate> used) {
        return switch (action) {
            case FIND_TABLES, LIST_DEFINITIONS, CITATIONS_BY_SECTION ->
                    runDocumentAction(context, action, contextText, used);
            case SUMMARIZE, EXTRACT_FACTS, COMPARE, GENERATE_CHECKLIST, DRAFT_EMAIL ->
                    runGeneratorTool(action, query, contextText);
            case NONE -> "";
        };
    }

    private String runDocumentAction(RequestContext context, ToolAction action, String contextText,
            List<RetrievalCandidate> used) {
        try {
            return switch (action) {
                case FIND_TABLES -> DocumentActions.findTables(contextText);
                case LIST_DEFINITIONS -> DocumentActions.listDefinitions(contextText);
                case CITATIONS_BY_SECTION -> DocumentActions.citationsBySection(used);
                default -> throw new IllegalArgumentException(action.wireName() + " is not a document action");
            };
        } catch (RuntimeException ex) {
            LOGGER.warn("Document action {} failed for request {}", action.wireName(), context.requestId(), ex);
            return "Tool " + action.wireName() + " failed: " + ex.getMessage();
        }
    }

    private String runGeneratorTool(ToolAction action, String query, String contextText) {
        Completion completion = generator.complete(
                List.of(ChatMessage.system(action.instruction()),
                        ChatMessage.user("Context:\n" + contextText + "\n\nTask: " + query)),
                TOOL_MAX_TOKENS, TOOL_TEMPERATURE, ResponseFormat.TEXT);
        return completion.text();
    }
}
