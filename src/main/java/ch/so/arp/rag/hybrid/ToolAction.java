package ch.so.arp.rag.hybrid;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of actions the tool router may choose. Document actions run
 * locally on the context text; the others are delegated to the generator with
 * their instruction.
 */
public enum ToolAction {
    SUMMARIZE("summarize", false, "Summarize the context succinctly for the query. Keep citations."),
    EXTRACT_FACTS("extract_facts", false, "Extract factual statements from the context with citations."),
    COMPARE("compare", false, "Compare the key entities or options in the context. Use citations."),
    GENERATE_CHECKLIST("generate_checklist", false, "Generate a checklist based on the context. Use citations."),
    DRAFT_EMAIL("draft_email", false, "Draft a professional email using the context. Cite sources if relevant."),
    FIND_TABLES("find_tables", true, null),
    LIST_DEFINITIONS("list_definitions", true, null),
    CITATIONS_BY_SECTION("citations_by_section", true, null),
    NONE("none", false, null);

    private final String wireName;
    private final boolean documentAction;
    private final String instruction;

    ToolAction(String wireName, boolean documentAction, String instruction) {
        this.wireName = wireName;
        this.documentAction = documentAction;
        this.instruction = instruction;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isDocumentAction() {
        return documentAction;
    }

    String instruction() {
        return instruction;
    }

    public static Optional<ToolAction> fromWireName(String name) {
        return Arrays.stream(values()).filter(action -> action.wireName.equals(name)).findFirst();
    }

    /**
     * Actions the router may pick, in declaration order.
     */
    public static List<ToolAction> allowed(boolean includeDocumentActions) {
        return Arrays.stream(values())
                .filter(action -> includeDocumentActions || !action.documentAction)
                .toList();
    }
}
