package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractHit;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.budgetaudit.util.Strings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the reply shapes providers actually produce into one {@link ExtractResponse}:
 * hits under {@code hits} or {@code pairs}, optionally nested in a {@code result} object,
 * snake_case or camelCase keys, and JSON wrapped in Markdown code fences.
 */
public class ExtractResponseAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ExtractResponseAdapter.class);

    private final ObjectMapper objectMapper;

    public ExtractResponseAdapter() {
        this.objectMapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .build();
    }

    /**
     * Parses the text content of a model reply.
     *
     * @throws ProviderException with {@link ProviderErrorType#PARSE} when the content is not usable JSON
     */
    public ExtractResponse fromModelContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ProviderException("Model returned empty content", ProviderErrorType.PARSE);
        }
        String cleaned = stripCodeFences(content);
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse model content: {}", Strings.abbreviate(cleaned, 200));
            throw new ProviderException("Failed to parse model content: " + e.getOriginalMessage(),
                    ProviderErrorType.PARSE, null, e);
        }
        return normalize(root);
    }

    public ExtractResponse normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ProviderException("Extraction reply is not a JSON object", ProviderErrorType.PARSE);
        }
        JsonNode body = root;
        JsonNode nested = root.get("result");
        if (nested != null && nested.isObject()) {
            body = nested;
        }

        JsonNode hitsNode = body.has("hits") ? body.get("hits") : body.get("pairs");
        List<ExtractHit> hits = new ArrayList<>();
        if (hitsNode != null && hitsNode.isArray()) {
            for (JsonNode hitNode : hitsNode) {
                if (!hitNode.isObject()) {
                    continue;
                }
                try {
                    hits.add(objectMapper.treeToValue(hitNode, ExtractHit.class));
                } catch (JsonProcessingException e) {
                    // A malformed hit is dropped like a hit with a bad span.
                    logger.debug("Skipping unreadable hit: {}", e.getOriginalMessage());
                }
            }
        }

        ExtractResponse.Meta meta = new ExtractResponse.Meta();
        JsonNode metaNode = root.has("meta") ? root.get("meta") : body.get("meta");
        if (metaNode != null && metaNode.isObject()) {
            meta.setModel(metaNode.hasNonNull("model") ? metaNode.get("model").asText() : null);
            meta.setCached(metaNode.path("cached").asBoolean(false));
            JsonNode tokens = metaNode.has("tokens_used") ? metaNode.get("tokens_used") : metaNode.get("tokensUsed");
            if (tokens != null && tokens.canConvertToInt()) {
                meta.setTokensUsed(tokens.asInt());
            }
        }
        return new ExtractResponse(hits, meta);
    }

    static String stripCodeFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
