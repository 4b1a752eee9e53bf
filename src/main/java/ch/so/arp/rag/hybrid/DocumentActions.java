package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic tools working on the packed context.
 */
final class DocumentActions {

    private static final Pattern DEFINITION_LINE = Pattern.compile("^\\s*([A-Za-z0-9][^:]{1,60}):\\s+(.+)$");
    private static final int SNIPPET_LENGTH = 160;

    private DocumentActions() {
    }

    /**
     * Groups of consecutive lines containing a pipe or a tab.
     */
    static String findTables(String contextText) {
        List<List<String>> tables = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : contextText.split("\\R", -1)) {
            if (line.contains("|") || line.contains("\t")) {
                current.add(line);
            } else if (!current.isEmpty()) {
                tables.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            tables.add(current);
        }
        if (tables.isEmpty()) {
            return "No tables found in the provided context.";
        }
        List<String> blocks = tables.stream().map(block -> String.join("\n", block)).toList();
        return String.join("\n\n", blocks);
    }

    static String listDefinitions(String contextText) {
        List<String> results = new ArrayList<>();
        for (String line : contextText.split("\\R")) {
            Matcher matcher = DEFINITION_LINE.matcher(line);
            if (matcher.matches()) {
                results.add("- " + matcher.group(1).strip() + ": " + matcher.group(2).strip());
            }
        }
        if (results.isEmpty()) {
            return "No definition-style lines found in the provided context.";
        }
        return String.join("\n", results);
    }

    static String citationsBySection(List<RetrievalCandidate> used) {
        if (used.isEmpty()) {
            return "No citations available.";
        }
        List<String> entries = new ArrayList<>(used.size());
        for (RetrievalCandidate candidate : used) {
            String content = candidate.content();
            String snippet = content.substring(0, Math.min(SNIPPET_LENGTH, content.length())).replace("\n", " ");
            entries.add("[" + candidate.citationKey() + "] " + snippet);
        }
        return String.join("\n", entries);
    }
}
