package com.labelrun.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelrun.ingestion.config.ClassificationServiceProperties;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Chat-completions client using WebClient, JSON object response mode. Reads choices[0].message.content and
 * usage.total_tokens from the envelope.
 */
public class WebClientClassificationServiceClient implements ClassificationServiceClient {

    private final WebClient webClient;
    private final ClassificationServiceProperties properties;
    private final ObjectMapper objectMapper;

    public WebClientClassificationServiceClient(WebClient.Builder builder,
                                                ClassificationServiceProperties properties,
                                                ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ClassificationReply> complete(String systemPrompt, String userPrompt) {
        Map<String, Object> body = Map.of(
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "response_format", Map.of("type", "json_object"),
                "temperature", properties.getTemperature(),
                "max_tokens", properties.getMaxTokens()
        );
        return webClient.post()
                .uri(properties.chatCompletionsUrl())
                .header("api-key", properties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .map(this::parseEnvelope)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ClassificationServiceException("HTTP " + e.getStatusCode().value() + ": " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new ClassificationServiceException("Transport error: " + e.getMessage(), e));
    }

    ClassificationReply parseEnvelope(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ClassificationServiceException("Unparseable service envelope", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ClassificationServiceException("Service envelope has no choices[0].message.content");
        }
        JsonNode totalTokens = root.path("usage").path("total_tokens");
        Long units = totalTokens.canConvertToLong() && totalTokens.isNumber() ? totalTokens.asLong() : null;
        return new ClassificationReply(content.asText(), units);
    }
}
