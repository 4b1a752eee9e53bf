package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.rag.hybrid.store.SearchHit;
import ch.so.arp.rag.hybrid.store.StoreUnavailableException;
import ch.so.arp.rag.hybrid.store.VectorDatabase;

/**
 * Runs one query through planning, dense retrieval, lexical and semantic
 * reranking, context packing, tool use, generation and follow-up suggestions.
 * Stages run strictly in sequence on the calling thread and each reports a span
 * to the {@link Tracer}. A failing embedder, generator or store aborts the
 * request with a {@link PipelineStageException} naming the stage.
 */
@Service
public class QueryOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryOrchestrator.class);

    private static final String SYSTEM_PROMPT = "You are an enterprise RAG assistant.";

    private final VectorDatabase vectorDatabase;
    private final Embedder embedder;
    private final Generator generator;
    private final Tracer tracer;
    private final RagProperties.Features features;
    private final LexicalReranker lexicalReranker = new LexicalReranker();
    private final SemanticReranker semanticReranker;
    private final ContextWindowBuilder contextWindowBuilder = new ContextWindowBuilder();
    private final QueryPlanner queryPlanner;
    private final ToolRouter toolRouter;
    private final ToolExecutor toolExecutor;
    private final FollowUpGenerator followUpGenerator;

    public QueryOrchestrator(VectorDatabase vectorDatabase, Embedder embedder, Generator generator, Tracer tracer,
            RagProperties properties) {
        this.vectorDatabase = Objects.requireNonNull(vectorDatabase, "vectorDatabase");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.features = Objects.requireNonNull(properties, "properties").getFeatures();
        this.semanticReranker = new SemanticReranker(embedder);
        this.queryPlanner = new QueryPlanner(generator);
        this.toolRouter = new ToolRouter(generator);
        this.toolExecutor = new ToolExecutor(generator);
        this.followUpGenerator = new FollowUpGenerator(generator);
    }

    public QueryResponse answer(QueryRequest request, RequestContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context");
        PipelineFlags flags = PipelineFlags.resolve(request, features);
        String query = request.query();

        Map<String, Object> reception = new LinkedHashMap<>();
        reception.put("query", query);
        reception.put("tenant_id", context.tenantId());
        reception.put("doc_id", request.docId());
        tracer.startSpan(context, PipelineStage.QUERY_RECEPTION.spanName(), reception)
                .end(Map.of("latency_ms", 0.0d), null);

        try {
            QueryPlan plan = null;
            List<String> queries = List.of(query);
            if (flags.planning()) {
                plan = runStage(context, PipelineStage.PLANNING, Map.of("query", query),
                        () -> queryPlanner.plan(context, query, request.docId()), planned -> planned);
                queries = plan.queries();
                LOGGER.info("agentic_planning request={} tenant={} queries={}", context.requestId(),
                        context.tenantId(), queries);
            }

            List<String> plannedQueries = queries;
            List<RetrievalCandidate> dense = runStage(context, PipelineStage.DENSE_RETRIEVAL,
                    Map.of("k", request.k(), "queries", plannedQueries.size()),
                    () -> retrieve(context, plannedQueries, request),
                    candidates -> Map.of("chunk_ids", keys(candidates)));

            // lexical scores are reported only; the dense order is what moves on
            runStage(context, PipelineStage.LEXICAL_RERANK, Map.of("candidates", dense.size()),
                    () -> lexicalReranker.rerank(query, dense),
                    scored -> Map.of("chunk_ids", keys(scored), "scores", scores(scored)));

            List<RetrievalCandidate> reranked = runStage(context, PipelineStage.SEMANTIC_RERANK,
                    Map.of("enabled", flags.semanticRerank(), "candidates", dense.size()),
                    () -> flags.semanticRerank() ? semanticReranker.rerank(query, dense) : dense,
                    scored -> Map.of("scores", flags.semanticRerank() ? scores(scored) : List.of()));

            ContextWindow window = runStage(context, PipelineStage.CONTEXT_BUILDING,
                    Map.of("budget", request.maxContextChars()),
                    () -> contextWindowBuilder.build(reranked, request.maxContextChars()),
                    built -> Map.of("chunk_ids", keys(built.used()), "chars", built.text().length()));

            ToolResult tool = ToolResult.NONE;
            if (flags.tools() && !window.text().isEmpty()) {
                tool = runStage(context, PipelineStage.TOOL_ROUTING,
                        Map.of("doc_actions", flags.documentActions()),
                        () -> selectAndRunTool(context, query, window, flags.documentActions()),
                        result -> Map.of("tool", result.action().wireName(),
                                "output_chars", result.output() == null ? 0 : result.output().length()));
            }

            List<ChatMessage> messages = List.of(ChatMessage.system(SYSTEM_PROMPT),
                    ChatMessage.user(window.text() + toolBlock(tool) + "\n\nQuestion: " + query));
            Completion completion = runStage(context, PipelineStage.GENERATION,
                    Map.of("max_tokens", request.maxAnswerTokens()),
                    () -> generator.complete(messages, request.maxAnswerTokens(), request.temperature(),
                            ResponseFormat.TEXT),
                    generated -> generated.usage() == null ? Map.of() : generated.usage());
            LOGGER.info("query_completed request={} tenant={} query_length={} retrieved={} reranked={} used={} "
                    + "total_tokens={}", context.requestId(), context.tenantId(), query.length(), dense.size(),
                    reranked.size(), window.used().size(),
                    completion.usage() == null ? null : completion.usage().totalTokens());

            List<String> followUps = List.of();
            if (flags.followUps()) {
                followUps = runStage(context, PipelineStage.FOLLOW_UPS, Map.of("answer_chars",
                        completion.text().length()),
                        () -> followUpGenerator.generate(context, query, completion.text(), window.text()),
                        generated -> Map.of("follow_ups", generated));
            }

            return new QueryResponse(context.requestId(), query, completion.text(), window.text(),
                    flags.includeCitations() ? citations(window, reranked) : QueryResponse.Citations.empty(),
                    dense.stream().map(candidate -> QueryResponse.ChunkView.of(candidate.chunk())).toList(),
                    tool.action() == ToolAction.NONE ? null : tool.action().wireName(), tool.output(), followUps,
                    plan, completion.usage());
        } catch (PipelineStageException ex) {
            LOGGER.error("query_failed request={} tenant={} stage={}: {}", context.requestId(), context.tenantId(),
                    ex.getStage().spanName(), ex.getCause().getMessage(), ex);
            throw ex;
        }
    }

    /**
     * Dense search once per planned query, in plan order. The first occurrence
     * of a {@code source#chunkIndex} key wins.
     */
    private List<RetrievalCandidate> retrieve(RequestContext context, List<String> queries, QueryRequest request) {
        List<float[]> vectors = embedder.embed(queries);
        if (vectors.size() != queries.size()) {
            throw new EmbeddingUnavailableException(
                    "Expected " + queries.size() + " query embeddings but got " + vectors.size());
        }
        Map<String, RetrievalCandidate> merged = new LinkedHashMap<>();
        for (float[] vector : vectors) {
            List<SearchHit> hits = vectorDatabase.search(vector, request.k(), context.tenantId(), request.docId());
            for (SearchHit hit : hits) {
                RetrievalCandidate candidate = new RetrievalCandidate(hit.chunk(), hit.score(), CandidateStage.DENSE);
                merged.putIfAbsent(candidate.citationKey(), candidate);
            }
        }
        return List.copyOf(merged.values());
    }

    private ToolResult selectAndRunTool(RequestContext context, String query, ContextWindow window,
            boolean documentActions) {
        ToolAction action = toolRouter.select(context, query, window.text(), documentActions);
        if (action == ToolAction.NONE) {
            return ToolResult.NONE;
        }
        String output = toolExecutor.run(context, action, query, window.text(), window.used());
        LOGGER.info("agentic_tool_used request={} tenant={} tool={} output_chars={}", context.requestId(),
                context.tenantId(), action.wireName(), output.length());
        return new ToolResult(action, output);
    }

    private <T> T runStage(RequestContext context, PipelineStage stage, Map<String, Object> input, Supplier<T> work,
            Function<T, Object> summary) {
        SpanHandle span = tracer.startSpan(context, stage.spanName(), input);
        long started = System.nanoTime();
        T result;
        try {
            result = work.get();
        } catch (EmbeddingUnavailableException | GenerationUnavailableException | StoreUnavailableException ex) {
            span.end(Map.of("latency_ms", elapsedMillis(started), "error", ex.getClass().getSimpleName()), null);
            throw new PipelineStageException(stage, ex);
        }
        span.end(Map.of("latency_ms", elapsedMillis(started)), summary.apply(result));
        return result;
    }

    private static double elapsedMillis(long started) {
        return Math.round((System.nanoTime() - started) / 10_000.0d) / 100.0d;
    }

    private static String toolBlock(ToolResult tool) {
        if (tool.action() == ToolAction.NONE || tool.output() == null || tool.output().isEmpty()) {
            return "";
        }
        return "\n\nTool output (" + tool.action().wireName() + "):\n" + tool.output() + "\n";
    }

    private static QueryResponse.Citations citations(ContextWindow window, List<RetrievalCandidate> reranked) {
        Set<Long> usedIds = new HashSet<>();
        List<QueryResponse.CitationRef> used = new ArrayList<>();
        for (RetrievalCandidate candidate : window.used()) {
            usedIds.add(candidate.chunk().id());
            used.add(QueryResponse.CitationRef.of(candidate.chunk()));
        }
        List<QueryResponse.CitationRef> related = reranked.stream()
                .filter(candidate -> !usedIds.contains(candidate.chunk().id()))
                .map(candidate -> QueryResponse.CitationRef.of(candidate.chunk()))
                .toList();
        return new QueryResponse.Citations(List.copyOf(used), related);
    }

    private static List<String> keys(List<RetrievalCandidate> candidates) {
        return candidates.stream().map(RetrievalCandidate::citationKey).toList();
    }

    private static List<Map<String, Object>> scores(List<RetrievalCandidate> candidates) {
        return candidates.stream()
                .map(candidate -> Map.<String, Object>of("chunk_id", candidate.citationKey(), "score",
                        candidate.score()))
                .toList();
    }

    private record ToolResult(ToolAction action, String output) {

        static final ToolResult NONE = new ToolResult(ToolAction.NONE, null);
    }
}
