package ch.so.arp.rag.hybrid;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link Embedder} calling the {@code /embeddings} endpoint of an OpenAI
 * compatible API in a single batch request.
 */
class OpenAiEmbedder implements Embedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbedder.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    OpenAiEmbedder(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.openai.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        LOGGER.debug("Embedding {} texts with model {}", texts.size(), properties.getEmbeddingModel());
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", properties.getEmbeddingModel(), "input", texts))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new EmbeddingUnavailableException("Embedding request failed: " + ex.getMessage(), ex);
        }
        JsonNode data = response == null ? null : response.path("data");
        if (data == null || !data.isArray() || data.size() != texts.size()) {
            throw new EmbeddingUnavailableException("Embedding response did not contain " + texts.size() + " vectors");
        }
        float[][] vectors = new float[texts.size()][];
        for (int position = 0; position < data.size(); position++) {
            JsonNode item = data.get(position);
            int index = item.path("index").asInt(position);
            if (index < 0 || index >= vectors.length) {
                throw new EmbeddingUnavailableException("Embedding response referenced unknown index " + index);
            }
            JsonNode values = item.path("embedding");
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) values.get(i).asDouble();
            }
            vectors[index] = vector;
        }
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i] == null) {
                throw new EmbeddingUnavailableException("Embedding response is missing index " + i);
            }
        }
        return List.of(vectors);
    }
}
