package ch.so.arp.rag.hybrid;

/**
 * Pipeline stage that produced a candidate's score.
 */
public enum CandidateStage {
    DENSE,
    LEXICAL,
    SEMANTIC
}
