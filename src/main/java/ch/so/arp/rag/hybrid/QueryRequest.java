package ch.so.arp.rag.hybrid;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import org.springframework.util.StringUtils;

/**
 * Incoming payload for queries. Absent numeric and boolean fields take their
 * defaults; absent stage toggles fall back to the configured features. A blank
 * {@code doc_id} means no document filter.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryRequest(
        @NotBlank String query,
        @Min(1) @Max(50) Integer k,
        String docId,
        @Min(200) @Max(6000) Integer maxContextChars,
        @Min(50) @Max(1000) Integer maxAnswerTokens,
        @DecimalMin("0.0") @DecimalMax("1.0") Double temperature,
        Boolean rerank,
        Boolean includeCitations,
        Boolean enableTools,
        Boolean enableFollowups,
        Boolean enablePlanning) {

    public QueryRequest {
        k = k == null ? 5 : k;
        docId = StringUtils.hasText(docId) ? docId : null;
        maxContextChars = maxContextChars == null ? 1500 : maxContextChars;
        maxAnswerTokens = maxAnswerTokens == null ? 300 : maxAnswerTokens;
        temperature = temperature == null ? 0.2d : temperature;
        rerank = rerank == null ? Boolean.TRUE : rerank;
        includeCitations = includeCitations == null ? Boolean.TRUE : includeCitations;
    }

    public static QueryRequest of(String query) {
        return new QueryRequest(query, null, null, null, null, null, null, null, null, null, null);
    }
}
