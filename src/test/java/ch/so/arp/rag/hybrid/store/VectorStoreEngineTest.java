package ch.so.arp.rag.hybrid.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.assertj.core.api.Assertions.tuple;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class VectorStoreEngineTest {

    @TempDir
    Path tempDir;

    private JdbcClient jdbcClient;
    private Path snapshot;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        jdbcClient = JdbcClient.create(dataSource);
        snapshot = tempDir.resolve("index").resolve("vector.index");
    }

    @Test
    void emptyStoreHasNoIndexAndReturnsNothing() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThat(engine.state()).isEqualTo(IndexState.ABSENT);
        assertThat(engine.search(new float[] { 1f, 0f }, 3, "t1", null)).isEmpty();
        assertThat(snapshot).doesNotExist();
    }

    @Test
    void returnsNearestChunkForTenant() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        List<Long> ids = engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "east"), chunk("t1", "d1", "a.txt", 1, "north")),
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f }));

        List<SearchHit> hits = engine.search(new float[] { 3f, 0f }, 1, "t1", null);

        assertThat(ids).hasSize(2);
        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).chunk().id()).isEqualTo(ids.get(0));
        assertThat(hits.get(0).chunk().content()).isEqualTo("east");
        assertThat(hits.get(0).score()).isCloseTo(1.0d, offset(1e-6));
        assertThat(engine.state()).isEqualTo(IndexState.LOADED);
        assertThat(snapshot).exists();
    }

    @Test
    void neverReturnsChunksOfAnotherTenant() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "mine"), chunk("t2", "d2", "b.txt", 0, "theirs"),
                        chunk("t2", "d2", "b.txt", 1, "theirs too")),
                List.of(new float[] { 1f, 0f }, new float[] { 1f, 0.01f }, new float[] { 0.9f, 0.1f }));

        List<SearchHit> hits = engine.search(new float[] { 1f, 0f }, 5, "t1", null);

        assertThat(hits).extracting(hit -> hit.chunk().tenantId()).containsOnly("t1");
        assertThat(hits).hasSize(1);
    }

    @Test
    void filtersByDocument() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "first"), chunk("t1", "d2", "b.txt", 0, "second")),
                List.of(new float[] { 1f, 0f }, new float[] { 1f, 0.1f }));

        List<SearchHit> hits = engine.search(new float[] { 1f, 0f }, 5, "t1", "d2");

        assertThat(hits).extracting(hit -> hit.chunk().docId()).containsExactly("d2");
    }

    @Test
    void blankFiltersAreIgnored() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "only")), List.of(new float[] { 1f, 0f }));

        assertThat(engine.search(new float[] { 1f, 0f }, 1, "t1", "")).hasSize(1);
        assertThat(engine.search(new float[] { 1f, 0f }, 1, " ", null)).hasSize(1);
    }

    @Test
    void reloadedSnapshotAnswersLikeTheOriginal() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "a"), chunk("t1", "d1", "a.txt", 1, "b"),
                        chunk("t1", "d1", "a.txt", 2, "c")),
                List.of(new float[] { 1f, 0f, 0f }, new float[] { 0.7f, 0.7f, 0f }, new float[] { 0f, 0f, 1f }));
        float[] query = { 0.9f, 0.4f, 0.1f };
        List<SearchHit> before = engine.search(query, 3, "t1", null);

        VectorStoreEngine reopened = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThat(reopened.state()).isEqualTo(IndexState.LOADED);
        assertThat(reopened.indexedCount()).isEqualTo(3);
        assertThat(reopened.search(query, 3, "t1", null))
                .extracting(hit -> hit.chunk().id(), SearchHit::score)
                .containsExactlyElementsOf(before.stream()
                        .map(hit -> tuple(hit.chunk().id(), hit.score()))
                        .toList());
    }

    @Test
    void rebuildsFromMetadataWhenSnapshotIsCorrupt() throws IOException {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "a"), chunk("t1", "d1", "a.txt", 1, "b")),
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f }));
        Files.write(snapshot, new byte[] { 1, 2, 3, 4, 5 });

        VectorStoreEngine reopened = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThat(reopened.state()).isEqualTo(IndexState.LOADED);
        assertThat(reopened.indexedCount()).isEqualTo(2);
        assertThat(reopened.search(new float[] { 0f, 1f }, 1, "t1", null))
                .extracting(hit -> hit.chunk().content()).containsExactly("b");
    }

    @Test
    void rebuildsWhenSnapshotHeaderIsDamaged() throws IOException {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "a"), chunk("t1", "d1", "a.txt", 1, "b")),
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f }));
        try (OutputStream file = Files.newOutputStream(snapshot);
                DataOutputStream out = new DataOutputStream(file)) {
            out.writeInt(0x52414749);
            out.writeInt(1);
            out.writeInt(0x02000001);
            out.writeInt(1);
            out.writeLong(1L);
            out.writeLong(0L);
        }

        VectorStoreEngine reopened = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThat(reopened.state()).isEqualTo(IndexState.LOADED);
        assertThat(reopened.indexedCount()).isEqualTo(2);
        assertThat(reopened.search(new float[] { 1f, 0f }, 1, "t1", null))
                .extracting(hit -> hit.chunk().content()).containsExactly("a");
    }

    @Test
    void rebuildsWhenSnapshotIsMissing() throws IOException {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "a")), List.of(new float[] { 1f, 0f }));
        Files.delete(snapshot);

        VectorStoreEngine reopened = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThat(reopened.indexedCount()).isEqualTo(1);
        assertThat(snapshot).exists();
    }

    @Test
    void dimensionChangeRebuildsIndexWithNewVectorsOnly() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "old.txt", 0, "old")), List.of(new float[] { 1f, 0f }));

        engine.addChunks(List.of(chunk("t1", "d2", "new.txt", 0, "new")), List.of(new float[] { 0f, 0f, 1f }));

        assertThat(engine.indexedCount()).isEqualTo(1);
        assertThat(engine.search(new float[] { 0f, 0f, 1f }, 5, "t1", null))
                .extracting(hit -> hit.chunk().content()).containsExactly("new");
        assertThat(engine.search(new float[] { 1f, 0f }, 5, "t1", null)).isEmpty();
    }

    @Test
    void keepsChunksStoredBeforeAFailedInsert() {
        MetadataStore flaky = new MetadataStore(jdbcClient) {
            private int inserts;

            @Override
            public long insert(NewChunk chunk, float[] embedding) {
                if (++inserts == 2) {
                    throw new DataAccessResourceFailureException("disk full");
                }
                return super.insert(chunk, embedding);
            }
        };
        VectorStoreEngine engine = new VectorStoreEngine(flaky, snapshot);

        assertThatThrownBy(() -> engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "kept"), chunk("t1", "d1", "a.txt", 1, "lost")),
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f })))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("1 chunks were stored");

        assertThat(engine.indexedCount()).isEqualTo(1);
        assertThat(engine.search(new float[] { 1f, 0f }, 5, "t1", null))
                .extracting(hit -> hit.chunk().content()).containsExactly("kept");
    }

    @Test
    void rejectsMismatchedBatches() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);

        assertThatThrownBy(() -> engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "a")), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.addChunks(
                List.of(chunk("t1", "d1", "a.txt", 0, "a"), chunk("t1", "d1", "a.txt", 1, "b")),
                List.of(new float[] { 1f, 0f }, new float[] { 1f, 0f, 0f })))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(engine.indexedCount()).isZero();
    }

    @Test
    void queryOfForeignDimensionFindsNothing() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 0, "a")), List.of(new float[] { 1f, 0f }));

        assertThat(engine.search(new float[] { 1f, 0f, 0f }, 1, "t1", null)).isEmpty();
        assertThatThrownBy(() -> engine.search(new float[] { 1f, 0f }, 0, "t1", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void findsChunkById() {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        long id = engine.addChunks(List.of(chunk("t1", "d1", "a.txt", 4, "text")), List.of(new float[] { 3f, 4f }))
                .get(0);

        assertThat(engine.findChunk(id)).hasValueSatisfying(chunk -> {
            assertThat(chunk.citationKey()).isEqualTo("a.txt#4");
            assertThat(chunk.embedding()).containsExactly(0.6f, 0.8f);
        });
        assertThat(engine.findChunk(id + 100)).isEmpty();
    }

    @Test
    void concurrentWritersFindTheirOwnChunks() throws Exception {
        VectorStoreEngine engine = new VectorStoreEngine(new MetadataStore(jdbcClient), snapshot);
        int writers = 8;
        int rounds = 5;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String tenant = "tenant-" + w;
                float[] direction = new float[writers];
                direction[w] = 1f;
                Callable<Integer> writer = () -> {
                    start.await();
                    int found = 0;
                    for (int round = 0; round < rounds; round++) {
                        long id = engine.addChunks(List.of(chunk(tenant, "d", "s.txt", round, tenant + "/" + round)),
                                List.of(direction)).get(0);
                        List<SearchHit> hits = engine.search(direction, rounds, tenant, null);
                        if (hits.stream().anyMatch(hit -> hit.chunk().id() == id)) {
                            found++;
                        }
                    }
                    return found;
                };
                results.add(executor.submit(writer));
            }
            start.countDown();

            for (Future<Integer> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(rounds);
            }
        } finally {
            executor.shutdownNow();
        }

        long rows = jdbcClient.sql("SELECT COUNT(*) FROM chunks").query(Long.class).single();
        assertThat(rows).isEqualTo((long) writers * rounds);
        assertThat(engine.indexedCount()).isEqualTo(writers * rounds);
        assertThat(VectorIndex.readFrom(snapshot).size()).isEqualTo(writers * rounds);
    }

    private static NewChunk chunk(String tenant, String doc, String source, int index, String content) {
        return new NewChunk(tenant, doc, source, index, content);
    }
}
