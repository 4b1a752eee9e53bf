package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.rag.hybrid.store.NewChunk;
import ch.so.arp.rag.hybrid.store.VectorDatabase;

/**
 * Splits a document into chunks, embeds them and adds them to the store.
 * Returns only after the chunks are durable and searchable.
 */
@Service
public class IngestService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestService.class);

    private final VectorDatabase vectorDatabase;
    private final Embedder embedder;
    private final TextChunker chunker;

    public IngestService(VectorDatabase vectorDatabase, Embedder embedder, RagProperties properties) {
        this.vectorDatabase = Objects.requireNonNull(vectorDatabase, "vectorDatabase");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        RagProperties.Ingest ingest = properties.getIngest();
        this.chunker = new TextChunker(ingest.getChunkSize(), ingest.getChunkOverlap());
    }

    public IngestResult ingest(IngestRequest request, RequestContext context) {
        String docId = request.docId() != null && !request.docId().isBlank() ? request.docId()
                : UUID.randomUUID().toString();
        List<String> pieces = chunker.split(request.text());
        if (pieces.isEmpty()) {
            throw new IllegalArgumentException("No text to ingest in " + request.source());
        }
        List<NewChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new NewChunk(context.tenantId(), docId, request.source(), i, pieces.get(i)));
        }
        List<float[]> embeddings = embedder.embed(pieces);
        List<Long> ids = vectorDatabase.addChunks(chunks, embeddings);
        LOGGER.info("Ingested {} ({} chunks, doc {}) for tenant {} request {}", request.source(), ids.size(), docId,
                context.tenantId(), context.requestId());
        return new IngestResult(docId, ids.size(), request.source());
    }
}
