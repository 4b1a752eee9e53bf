package ch.so.arp.rag.hybrid;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Planner output. {@code queries} holds the rewritten query followed by the
 * distinct sub-queries and is never empty.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryPlan(String rewrittenQuery, List<String> entities, List<String> subqueries, List<String> queries) {

    static QueryPlan passthrough(String query) {
        return new QueryPlan(query, List.of(), List.of(), List.of(query));
    }
}
