package ch.so.arp.rag.hybrid;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Token accounting reported by the generator. Any field may be {@code null}
 * when the backend does not report it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {
}
