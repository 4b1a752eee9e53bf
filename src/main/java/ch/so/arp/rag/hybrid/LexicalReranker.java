package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Okapi BM25 over the candidate set itself. Term statistics come from the
 * candidates only, so the reranker can reorder dense results but never recover
 * chunks that dense retrieval missed. Tokens are whitespace separated.
 */
class LexicalReranker implements Reranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(LexicalReranker.class);

    private static final double K1 = 1.5d;
    private static final double B = 0.75d;
    private static final double EPSILON = 0.25d;

    @Override
    public List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Map<String, Integer>> termFrequencies = new ArrayList<>(candidates.size());
        Map<String, Integer> documentFrequencies = new HashMap<>();
        int[] lengths = new int[candidates.size()];
        long totalLength = 0L;
        for (int i = 0; i < candidates.size(); i++) {
            List<String> tokens = tokenize(candidates.get(i).content());
            Map<String, Integer> frequencies = new HashMap<>();
            tokens.forEach(token -> frequencies.merge(token, 1, Integer::sum));
            frequencies.keySet().forEach(term -> documentFrequencies.merge(term, 1, Integer::sum));
            termFrequencies.add(frequencies);
            lengths[i] = tokens.size();
            totalLength += tokens.size();
        }
        Map<String, Double> idf = inverseDocumentFrequencies(documentFrequencies, candidates.size());
        double averageLength = (double) totalLength / candidates.size();

        List<String> queryTokens = tokenize(query);
        List<RetrievalCandidate> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            double score = 0.0d;
            if (averageLength > 0.0d) {
                for (String term : queryTokens) {
                    int frequency = termFrequencies.get(i).getOrDefault(term, 0);
                    double denominator = frequency + K1 * (1.0d - B + B * lengths[i] / averageLength);
                    score += idf.getOrDefault(term, 0.0d) * (frequency * (K1 + 1.0d) / denominator);
                }
            }
            scored.add(candidates.get(i).withScore(score, CandidateStage.LEXICAL));
        }
        scored.sort(Comparator.comparingDouble(RetrievalCandidate::score).reversed());
        LOGGER.debug("BM25 scored {} candidates for {} query terms", scored.size(), queryTokens.size());
        return scored;
    }

    /**
     * Negative values, produced by terms present in more than half of the
     * candidates, are replaced by a fraction of the average idf.
     */
    private Map<String, Double> inverseDocumentFrequencies(Map<String, Integer> documentFrequencies, int corpusSize) {
        Map<String, Double> idf = new HashMap<>();
        List<String> negative = new ArrayList<>();
        double sum = 0.0d;
        for (Map.Entry<String, Integer> entry : documentFrequencies.entrySet()) {
            double value = Math.log(corpusSize - entry.getValue() + 0.5d) - Math.log(entry.getValue() + 0.5d);
            idf.put(entry.getKey(), value);
            sum += value;
            if (value < 0.0d) {
                negative.add(entry.getKey());
            }
        }
        if (!idf.isEmpty()) {
            double floor = EPSILON * (sum / idf.size());
            negative.forEach(term -> idf.put(term, floor));
        }
        return idf;
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
