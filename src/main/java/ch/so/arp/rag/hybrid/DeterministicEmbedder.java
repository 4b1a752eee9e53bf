package ch.so.arp.rag.hybrid;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.SplittableRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.rag.hybrid.store.Vectors;

/**
 * Offline {@link Embedder}: every text maps to a fixed pseudo-random unit
 * vector seeded from its SHA-256 digest. Similar texts are not close to each
 * other, so rankings are only meaningful for exact repeats.
 */
class DeterministicEmbedder implements Embedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbedder.class);

    private final int dimensions;

    DeterministicEmbedder(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Embedding offline with {} dimensions; set rag.mock-openai=false to use the API", dimensions);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        return texts.stream().map(this::vectorFor).toList();
    }

    private float[] vectorFor(String text) {
        SplittableRandom random = new SplittableRandom(seed(text == null ? "" : text));
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) (random.nextDouble() * 2.0d - 1.0d);
        }
        return Vectors.normalize(vector);
    }

    private static long seed(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest).getLong();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
