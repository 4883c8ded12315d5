package com.budgetaudit.processing.ai;

import com.budgetaudit.observability.TracingServiceInterface;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.fasterxml.jackson.databind.JsonNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider for any endpoint speaking the OpenAI chat-completions protocol (Zhipu, ModelScope, DeepSeek).
 * The reply content is parsed through {@link ExtractResponseAdapter}.
 */
public class OpenAiCompatibleProvider implements AiProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
    private static final String SYSTEM_PROMPT = "Respond in JSON only. Do not wrap in Markdown code fences.";

    private final String name;
    private final String model;
    private final RestClient restClient;
    private final ExtractionPromptBuilder promptBuilder;
    private final ExtractResponseAdapter responseAdapter;
    private final TracingServiceInterface tracingService;

    public OpenAiCompatibleProvider(String name, String baseUrl, String apiKey, String model, Duration readTimeout,
                                    TracingServiceInterface tracingService) {
        this(name, model, RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(readTimeout))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build(), tracingService);
    }

    OpenAiCompatibleProvider(String name, String model, RestClient restClient, TracingServiceInterface tracingService) {
        this.name = name;
        this.model = model;
        this.restClient = restClient;
        this.promptBuilder = new ExtractionPromptBuilder();
        this.responseAdapter = new ExtractResponseAdapter();
        this.tracingService = tracingService;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(DEFAULT_CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
        return requestFactory;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getModelId() {
        return model;
    }

    @Override
    public ExtractResponse extract(ExtractRequest request) {
        String prompt = promptBuilder.build(request);
        logger.debug("Calling {} model={}, task={}, promptLength={}", name, model, request.getTask(), prompt.length());

        Span span = tracingService.spanBuilder("ai.extract")
                .setAttribute("provider", name)
                .setAttribute("model", model)
                .setAttribute("task", request.getTask())
                .setAttribute("prompt_length", prompt.length())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            JsonNode reply = call(prompt);
            String content = reply.path("choices").path(0).path("message").path("content").asText(null);
            ExtractResponse response = responseAdapter.fromModelContent(content);

            ExtractResponse.Meta meta = response.getMeta();
            if (meta.getModel() == null) {
                meta.setModel(model);
            }
            JsonNode totalTokens = reply.path("usage").path("total_tokens");
            if (meta.getTokensUsed() == null && totalTokens.canConvertToInt()) {
                meta.setTokensUsed(totalTokens.asInt());
            }

            span.setStatus(StatusCode.OK);
            span.setAttribute("hits", response.getHits().size());
            if (meta.getTokensUsed() != null) {
                span.setAttribute("tokens.total", meta.getTokensUsed());
            }
            logger.debug("{} returned {} hits", name, response.getHits().size());
            return response;
        } catch (ProviderException e) {
            span.setStatus(StatusCode.ERROR);
            span.setAttribute("error.type", e.getErrorType().name());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private JsonNode call(String prompt) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)));

        JsonNode reply;
        try {
            reply = restClient.post().uri("/chat/completions").body(body).retrieve().body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw ProviderException.fromStatus(e.getStatusCode().value(), name + ": " + safeMessage(e), e);
        } catch (ResourceAccessException e) {
            ProviderErrorType type = e.getCause() instanceof SocketTimeoutException
                    ? ProviderErrorType.TIMEOUT : ProviderErrorType.NETWORK;
            throw new ProviderException(name + ": " + safeMessage(e), type, null, e);
        }
        if (reply == null || !reply.path("choices").isArray() || reply.path("choices").isEmpty()) {
            throw new ProviderException(name + ": reply has no choices", ProviderErrorType.PARSE);
        }
        return reply;
    }

    private static String safeMessage(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        return message;
    }
}
