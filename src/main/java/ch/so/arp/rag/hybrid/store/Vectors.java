package ch.so.arp.rag.hybrid.store;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Small helpers for float vectors. Raw bytes are little-endian float32.
 */
public final class Vectors {

    private Vectors() {
    }

    public static float[] normalize(float[] vector) {
        double norm = Math.sqrt(dot(vector, vector));
        float[] result = vector.clone();
        if (norm > 0.0d) {
            for (int i = 0; i < result.length; i++) {
                result[i] = (float) (result[i] / norm);
            }
        }
        return result;
    }

    public static double dot(float[] a, float[] b) {
        int length = Math.min(a.length, b.length);
        double sum = 0.0d;
        for (int i = 0; i < length; i++) {
            sum += (double) a[i] * (double) b[i];
        }
        return sum;
    }

    /**
     * Cosine similarity. A zero norm counts as norm 1.
     */
    public static double cosine(float[] a, float[] b) {
        double normA = Math.sqrt(dot(a, a));
        double normB = Math.sqrt(dot(b, b));
        if (normA == 0.0d) {
            normA = 1.0d;
        }
        if (normB == 0.0d) {
            normB = 1.0d;
        }
        return dot(a, b) / (normA * normB);
    }

    public static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return new float[0];
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }
}
