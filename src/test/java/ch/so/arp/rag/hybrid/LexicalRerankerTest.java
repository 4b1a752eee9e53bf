package ch.so.arp.rag.hybrid;

import static ch.so.arp.rag.hybrid.Candidates.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class LexicalRerankerTest {

    private final LexicalReranker reranker = new LexicalReranker();

    @Test
    void ranksCandidatesSharingQueryTermsFirst() {
        List<RetrievalCandidate> candidates = List.of(
                candidate("a.txt", 0, "cherry tart recipe"),
                candidate("a.txt", 1, "apple banana pie"),
                candidate("a.txt", 2, "grape juice"));

        List<RetrievalCandidate> ranked = reranker.rerank("apple banana", candidates);

        assertThat(ranked).extracting(RetrievalCandidate::citationKey)
                .containsExactly("a.txt#1", "a.txt#0", "a.txt#2");
        assertThat(ranked.get(0).score()).isPositive();
        assertThat(ranked.get(0).stage()).isEqualTo(CandidateStage.LEXICAL);
    }

    @Test
    void matchingIsCaseSensitiveAndKeepsOrderOnTies() {
        List<RetrievalCandidate> candidates = List.of(
                candidate("a.txt", 0, "apple"),
                candidate("a.txt", 1, "pear"));

        List<RetrievalCandidate> ranked = reranker.rerank("Apple", candidates);

        assertThat(ranked).extracting(RetrievalCandidate::score).containsOnly(0.0d);
        assertThat(ranked).extracting(RetrievalCandidate::citationKey).containsExactly("a.txt#0", "a.txt#1");
    }

    @Test
    void termsInMostCandidatesStillScorePositively() {
        List<RetrievalCandidate> candidates = List.of(
                candidate("a.txt", 0, "zoning plan"),
                candidate("a.txt", 1, "zoning law"),
                candidate("a.txt", 2, "zoning map"),
                candidate("a.txt", 3, "river"));

        List<RetrievalCandidate> ranked = reranker.rerank("zoning", candidates);

        assertThat(ranked.subList(0, 3)).allSatisfy(scored -> assertThat(scored.score()).isPositive());
        assertThat(ranked.get(3).citationKey()).isEqualTo("a.txt#3");
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(reranker.rerank("anything", List.of())).isEmpty();
    }
}
