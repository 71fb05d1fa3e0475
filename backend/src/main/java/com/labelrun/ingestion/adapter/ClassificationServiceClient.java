package com.labelrun.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * One outbound call to the classification service. Retries and rate limiting are handled by the caller.
 */
public interface ClassificationServiceClient {

    /**
     * Sends a system instruction and a user message and asks for a JSON object answer.
     *
     * @return the reply; errors with {@link ClassificationServiceException} on transport or envelope failure
     */
    Mono<ClassificationReply> complete(String systemPrompt, String userPrompt);
}
