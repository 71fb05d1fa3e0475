package com.labelrun.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelrun.domain.Label;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {"predictions":[{"index":0,"label":"..."}]}. Structural problems are schema violations and fail the call;
 * a missing or unknown label is kept as {@link Label#UNKNOWN} for the caller to replace.
 */
@Component
@RequiredArgsConstructor
public class PredictionParser {

    static final String PREDICTIONS = "predictions";
    static final String INDEX = "index";
    static final String LABEL = "label";

    private final ObjectMapper objectMapper;

    public List<Prediction> parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ClassificationServiceException("Empty classification answer");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (Exception e) {
            throw new ClassificationServiceException("Classification answer is not valid JSON", e);
        }
        JsonNode predictions = root.path(PREDICTIONS);
        if (!predictions.isArray()) {
            throw new ClassificationServiceException("Schema violation: '" + PREDICTIONS + "' array missing");
        }
        List<Prediction> result = new ArrayList<>(predictions.size());
        for (JsonNode p : predictions) {
            JsonNode index = p.path(INDEX);
            if (!p.isObject() || !index.canConvertToInt() || !index.isIntegralNumber()) {
                throw new ClassificationServiceException("Schema violation: prediction without integer index: " + p);
            }
            JsonNode label = p.path(LABEL);
            String raw = label.isTextual() ? label.asText() : null;
            result.add(new Prediction(index.asInt(), Label.fromWire(raw), raw));
        }
        return result;
    }
}
