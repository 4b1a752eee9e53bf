package ch.so.arp.rag.hybrid.store;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.CheckedOutputStream;

/**
 * Flat inner-product index over L2-normalized vectors keyed by chunk id. Search
 * is a brute-force scan. The class is not thread-safe; {@link VectorStoreEngine}
 * guards it with its lock.
 */
final class VectorIndex {

    private static final int MAGIC = 0x52414749;
    private static final int FORMAT_VERSION = 1;
    private static final int INITIAL_CAPACITY = 64;
    private static final int HEADER_BYTES = 4 * Integer.BYTES;
    private static final long MAX_SLOTS = Integer.MAX_VALUE - 8;

    private final int dimension;
    private long[] ids;
    private float[] vectors;
    private int size;

    VectorIndex(int dimension) {
        this(dimension, INITIAL_CAPACITY);
    }

    private VectorIndex(int dimension, int capacity) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.ids = new long[capacity];
        this.vectors = new float[slots(capacity, dimension)];
    }

    int dimension() {
        return dimension;
    }

    int size() {
        return size;
    }

    void add(long id, float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                    "Vector of length " + vector.length + " does not fit index dimension " + dimension);
        }
        if (size == ids.length) {
            int capacity = Math.max(ids.length * 2, INITIAL_CAPACITY);
            vectors = Arrays.copyOf(vectors, slots(capacity, dimension));
            ids = Arrays.copyOf(ids, capacity);
        }
        ids[size] = id;
        System.arraycopy(vector, 0, vectors, size * dimension, dimension);
        size++;
    }

    /**
     * Return the {@code k} entries with the highest inner product. Equal scores
     * keep insertion order.
     */
    List<ScoredId> search(float[] query, int k) {
        int limit = Math.min(k, size);
        if (limit <= 0) {
            return List.of();
        }
        double[] scores = new double[size];
        Integer[] order = new Integer[size];
        for (int row = 0; row < size; row++) {
            double sum = 0.0d;
            int offset = row * dimension;
            for (int i = 0; i < dimension; i++) {
                sum += (double) vectors[offset + i] * (double) query[i];
            }
            scores[row] = sum;
            order[row] = row;
        }
        Arrays.sort(order, (a, b) -> Double.compare(scores[b], scores[a]));
        List<ScoredId> result = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            int row = order[i];
            result.add(new ScoredId(ids[row], scores[row]));
        }
        return result;
    }

    /**
     * Write the snapshot to a sibling temporary file and move it into place.
     */
    void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        CRC32 crc = new CRC32();
        try (OutputStream file = Files.newOutputStream(temp);
                CheckedOutputStream checked = new CheckedOutputStream(new BufferedOutputStream(file), crc);
                DataOutputStream out = new DataOutputStream(checked)) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            out.writeInt(dimension);
            out.writeInt(size);
            for (int row = 0; row < size; row++) {
                out.writeLong(ids[row]);
                int offset = row * dimension;
                for (int i = 0; i < dimension; i++) {
                    out.writeFloat(vectors[offset + i]);
                }
            }
            out.flush();
            // the checksum itself is not part of the checked payload
            new DataOutputStream(file).writeLong(crc.getValue());
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static VectorIndex readFrom(Path path) throws IOException {
        CRC32 crc = new CRC32();
        try (InputStream file = new BufferedInputStream(Files.newInputStream(path));
                CheckedInputStream checked = new CheckedInputStream(file, crc)) {
            DataInputStream in = new DataInputStream(checked);
            if (in.readInt() != MAGIC) {
                throw new IOException("Not a vector index snapshot: " + path);
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("Unsupported snapshot version " + version);
            }
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension <= 0 || count < 0 || !fitsFile(Files.size(path), dimension, count)) {
                throw new IOException("Corrupt snapshot header (dimension=" + dimension + ", count=" + count + ")");
            }
            VectorIndex index = new VectorIndex(dimension, count);
            float[] vector = new float[count == 0 ? 0 : dimension];
            for (int row = 0; row < count; row++) {
                long id = in.readLong();
                for (int i = 0; i < dimension; i++) {
                    vector[i] = in.readFloat();
                }
                index.add(id, vector);
            }
            long expected = crc.getValue();
            long stored = new DataInputStream(file).readLong();
            if (stored != expected) {
                throw new IOException("Snapshot checksum mismatch: " + path);
            }
            return index;
        }
    }

    /**
     * The header must describe exactly the rows the file holds, and they must
     * fit into one array.
     */
    private static boolean fitsFile(long fileSize, int dimension, int count) {
        long payload = fileSize - HEADER_BYTES - Long.BYTES;
        long rowBytes = Long.BYTES + (long) Float.BYTES * dimension;
        return payload >= 0 && payload % rowBytes == 0 && payload / rowBytes == count
                && (long) count * dimension <= MAX_SLOTS;
    }

    private static int slots(int rows, int dimension) {
        long slots = (long) rows * dimension;
        if (slots > MAX_SLOTS) {
            throw new IllegalStateException(rows + " vectors of dimension " + dimension + " exceed the index capacity");
        }
        return (int) slots;
    }

    record ScoredId(long id, double score) {
    }
}
