package ch.so.arp.rag.hybrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rewrites the query and proposes up to three retrieval sub-queries.
 */
class QueryPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryPlanner.class);

    private static final int MAX_SUBQUERIES = 3;

    private final Generator generator;

    QueryPlanner(Generator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    QueryPlan plan(RequestContext context, String query, String docId) {
        Completion completion = generator.complete(List.of(
                ChatMessage.system("Rewrite the query and propose up to 3 targeted retrieval queries. "
                        + "Return JSON with keys: rewritten_query, entities, subqueries."),
                ChatMessage.user("Query: " + query + "\nDoc ID: " + (docId == null ? "none" : docId))),
                200, 0.0d, ResponseFormat.JSON_OBJECT);

        JsonNode data = StructuredOutput.parseObject(completion.text());
        if (StructuredOutput.isEmpty(data)) {
            LOGGER.warn("Planner returned no usable plan for request {}; using the original query",
                    context.requestId());
            return QueryPlan.passthrough(query);
        }
        String rewritten = StructuredOutput.text(data, "rewritten_query");
        if (rewritten == null) {
            rewritten = query;
        }
        List<String> subqueries = StructuredOutput.strings(data, "subqueries");
        if (subqueries.size() > MAX_SUBQUERIES) {
            subqueries = subqueries.subList(0, MAX_SUBQUERIES);
        }
        List<String> queries = new ArrayList<>();
        queries.add(rewritten);
        for (String subquery : subqueries) {
            if (!subquery.equals(rewritten)) {
                queries.add(subquery);
            }
        }
        return new QueryPlan(rewritten, List.copyOf(StructuredOutput.strings(data, "entities")),
                List.copyOf(subqueries), List.copyOf(queries));
    }
}
