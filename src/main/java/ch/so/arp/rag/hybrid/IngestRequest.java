package ch.so.arp.rag.hybrid;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.constraints.NotBlank;

/**
 * Plain text document to chunk, embed and store for the calling tenant.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestRequest(@NotBlank String source, String docId, @NotBlank String text) {
}
