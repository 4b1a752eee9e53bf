package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs ranked candidates into a character budget. Each candidate is rendered as
 * {@code [source#chunkIndex] content} followed by a newline. Packing stops at
 * the first candidate that does not fit; later, smaller candidates are not
 * tried.
 */
class ContextWindowBuilder {

    ContextWindow build(List<RetrievalCandidate> ranked, int budget) {
        StringBuilder text = new StringBuilder();
        List<RetrievalCandidate> used = new ArrayList<>();
        for (RetrievalCandidate candidate : ranked) {
            String rendered = render(candidate);
            if (text.length() + rendered.length() > budget) {
                break;
            }
            text.append(rendered);
            used.add(candidate);
        }
        return new ContextWindow(text.toString(), List.copyOf(used));
    }

    static String render(RetrievalCandidate candidate) {
        return "[" + candidate.citationKey() + "] " + candidate.content() + "\n";
    }
}
