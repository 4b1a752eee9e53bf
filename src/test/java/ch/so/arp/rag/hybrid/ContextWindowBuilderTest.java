package ch.so.arp.rag.hybrid;

import static ch.so.arp.rag.hybrid.Candidates.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class ContextWindowBuilderTest {

    private final ContextWindowBuilder builder = new ContextWindowBuilder();

    @Test
    void packsWholeCandidatesUntilTheBudgetIsReached() {
        // each rendering is 21 characters
        List<RetrievalCandidate> ranked = List.of(
                candidate("a.txt", 0, "0123456789"),
                candidate("a.txt", 1, "abcdefghij"),
                candidate("a.txt", 2, "ABCDEFGHIJ"));

        ContextWindow window = builder.build(ranked, 60);

        assertThat(window.used()).hasSize(2);
        assertThat(window.text()).isEqualTo("[a.txt#0] 0123456789\n[a.txt#1] abcdefghij\n");
    }

    @Test
    void stopsAtFirstCandidateThatDoesNotFit() {
        List<RetrievalCandidate> ranked = List.of(
                candidate("a.txt", 0, "short"),
                candidate("a.txt", 1, "x".repeat(200)),
                candidate("a.txt", 2, "tiny"));

        ContextWindow window = builder.build(ranked, 100);

        assertThat(window.used()).extracting(RetrievalCandidate::citationKey).containsExactly("a.txt#0");
    }

    @Test
    void oversizedFirstCandidateLeavesContextEmpty() {
        ContextWindow window = builder.build(List.of(candidate("a.txt", 0, "x".repeat(500))), 200);

        assertThat(window.text()).isEmpty();
        assertThat(window.used()).isEmpty();
    }

    @Test
    void unknownSourceIsRenderedAsUnknown() {
        RetrievalCandidate candidate = candidate(null, 4, "text");

        assertThat(ContextWindowBuilder.render(candidate)).isEqualTo("[unknown#4] text\n");
    }
}
