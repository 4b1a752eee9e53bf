package ch.so.arp.rag.hybrid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recursive character splitter. Text is split on paragraph breaks, then line
 * breaks, then spaces and finally single characters until every piece fits the
 * chunk size; neighbouring pieces are merged back into chunks that share up to
 * {@code overlap} characters.
 */
class TextChunker {

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final int chunkSize;
    private final int overlap;

    TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be between 0 and chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return splitRecursive(text, SEPARATORS);
    }

    private List<String> splitRecursive(String text, List<String> separators) {
        String separator = separators.get(separators.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty() || text.contains(candidate)) {
                separator = candidate;
                remaining = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> result = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : pieces(text, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                result.addAll(merge(fitting, separator));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                result.add(piece);
            } else {
                result.addAll(splitRecursive(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) {
            result.addAll(merge(fitting, separator));
        }
        return result;
    }

    private List<String> pieces(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(codePoint -> pieces.add(new String(Character.toChars(codePoint))));
            return pieces;
        }
        for (String piece : text.split(Pattern.quote(separator))) {
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces, String separator) {
        List<String> chunks = new ArrayList<>();
        Deque<String> current = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int joinCost = current.isEmpty() ? 0 : separator.length();
            if (total + piece.length() + joinCost > chunkSize && !current.isEmpty()) {
                addChunk(chunks, current, separator);
                while (total > overlap
                        || (total + piece.length() + (current.isEmpty() ? 0 : separator.length()) > chunkSize
                                && total > 0)) {
                    String dropped = current.removeFirst();
                    total -= dropped.length() + (current.isEmpty() ? 0 : separator.length());
                }
            }
            total += piece.length() + (current.isEmpty() ? 0 : separator.length());
            current.addLast(piece);
        }
        addChunk(chunks, current, separator);
        return chunks;
    }

    private void addChunk(List<String> chunks, Deque<String> current, String separator) {
        String chunk = String.join(separator, current).strip();
        if (!chunk.isEmpty()) {
            chunks.add(chunk);
        }
    }
}
