package ch.so.arp.rag.hybrid;

import java.util.LinkedHashMap;
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
 * {@link Generator} calling the {@code /chat/completions} endpoint of an OpenAI
 * compatible API.
 */
class OpenAiGenerator implements Generator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiGenerator.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    OpenAiGenerator(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
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
    public Completion complete(List<ChatMessage> messages, int maxTokens, double temperature, ResponseFormat format) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getChatModel());
        body.put("messages", messages.stream()
                .map(message -> Map.of("role", message.role(), "content", message.content()))
                .toList());
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        if (format == ResponseFormat.JSON_OBJECT) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        LOGGER.debug("Requesting completion from model {} via base URL {}", properties.getChatModel(),
                properties.getBaseUrl());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new GenerationUnavailableException("Chat completion request failed: " + ex.getMessage(), ex);
        }
        if (response == null || !response.path("choices").has(0)) {
            throw new GenerationUnavailableException("Chat completion response contained no choices");
        }
        String text = response.path("choices").path(0).path("message").path("content").asText("");
        return new Completion(text, usage(response.path("usage")));
    }

    private TokenUsage usage(JsonNode usage) {
        if (usage.isMissingNode() || usage.isNull()) {
            return null;
        }
        return new TokenUsage(intOrNull(usage, "prompt_tokens"), intOrNull(usage, "completion_tokens"),
                intOrNull(usage, "total_tokens"));
    }

    private Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.intValue() : null;
    }
}
