package com.labelrun.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat-completion endpoint used for classification (Azure OpenAI deployment layout).
 */
@ConfigurationProperties(prefix = "labelrun.service")
@NoArgsConstructor
@Getter
@Setter
public class ClassificationServiceProperties {

    /** Resource endpoint, e.g. https://my-resource.openai.azure.com */
    private String endpoint = "http://localhost:8089";

    /** Deployment (model) name. */
    private String deployment = "gpt-4";

    private String apiVersion = "2024-02-15-preview";

    /** Sent as the api-key header; never logged. */
    private String apiKey = "";

    private double temperature = 0.1;

    private int maxTokens = 500;

    /**
     * Full chat-completions URL for the configured deployment.
     */
    public String chatCompletionsUrl() {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return base + "/openai/deployments/" + deployment + "/chat/completions?api-version=" + apiVersion;
    }
}
