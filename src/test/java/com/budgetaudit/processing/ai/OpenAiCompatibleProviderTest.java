package com.budgetaudit.processing.ai;

import com.budgetaudit.observability.TracingServiceInterface;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for OpenAiCompatibleProvider.
 * Tests the chat-completions call and the mapping of HTTP and transport failures to error types.
 */
@ExtendWith(MockitoExtension.class)
class OpenAiCompatibleProviderTest {

    private static final String BASE_URL = "http://ai.test/v1";
    private static final String SECTION = "年初预算为50.00万元，支出决算为60.00万元，决算数大于预算数。";

    @Mock
    private TracingServiceInterface tracingService;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private OpenAiCompatibleProvider provider;
    private ExtractRequest request;

    @BeforeEach
    void setUp() {
        lenient().when(tracingService.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.setAttribute(anyString(), anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.setAttribute(anyString(), anyLong())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);
        lenient().when(span.makeCurrent()).thenReturn(() -> {});

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer test-key");
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new OpenAiCompatibleProvider("zhipu-flash", "glm-4.5-flash", builder.build(), tracingService);
        request = new ExtractRequest("R33110_pairs_v1", SECTION, "hash", 3);
    }

    @Test
    void testSuccessfulCallParsesFencedContent() throws Exception {
        // Given: the model wraps its JSON in a code fence and reports usage
        String content = "```json\n{\"hits\":[{\"budget_text\":\"50.00\",\"budget_span\":[5,10],"
                + "\"final_text\":\"60.00\",\"final_span\":[19,24],\"stmt_text\":\"决算数大于预算数\",\"stmt_span\":[27,35]}]}\n```";
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("glm-4.5-flash"))
                .andExpect(jsonPath("$.temperature").value(0))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andExpect(jsonPath("$.messages[1].content").value(org.hamcrest.Matchers.containsString(SECTION)))
                .andRespond(withSuccess(reply(content, 77), MediaType.APPLICATION_JSON));

        // When
        ExtractResponse response = provider.extract(request);

        // Then
        server.verify();
        assertThat(response.getHits()).hasSize(1);
        assertThat(response.getHits().get(0).getFinalText()).isEqualTo("60.00");
        assertThat(response.getMeta().getModel()).isEqualTo("glm-4.5-flash");
        assertThat(response.getMeta().getTokensUsed()).isEqualTo(77);
        verify(span).end();
    }

    @Test
    void testRateLimitStatus() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> provider.extract(request))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> {
                    ProviderException error = (ProviderException) e;
                    assertThat(error.getErrorType()).isEqualTo(ProviderErrorType.RATE_LIMIT);
                    assertThat(error.getStatusCode()).isEqualTo(429);
                    assertThat(error.isTransient()).isFalse();
                });
    }

    @Test
    void testServerAndAuthStatuses() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(errorTypeOf(request)).isEqualTo(ProviderErrorType.SERVER);
        assertThat(errorTypeOf(request)).isEqualTo(ProviderErrorType.AUTH);
    }

    @Test
    void testReadTimeoutIsTimeout() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(clientRequest -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThat(errorTypeOf(request)).isEqualTo(ProviderErrorType.TIMEOUT);
    }

    @Test
    void testConnectionFailureIsTransientNetworkError() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(clientRequest -> {
            throw new IOException("Connection reset");
        });

        assertThatThrownBy(() -> provider.extract(request))
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(((ProviderException) e).isTransient()).isTrue());
    }

    @Test
    void testReplyWithoutChoicesIsParseError() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThat(errorTypeOf(request)).isEqualTo(ProviderErrorType.PARSE);
    }

    @Test
    void testNonJsonContentIsParseError() throws Exception {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess(reply("抱歉，我无法完成该任务。", 12), MediaType.APPLICATION_JSON));

        assertThat(errorTypeOf(request)).isEqualTo(ProviderErrorType.PARSE);
    }

    @Test
    void testHttpStatusClassification() {
        assertThat(ProviderException.fromStatus(403, "m", null).getErrorType()).isEqualTo(ProviderErrorType.AUTH);
        assertThat(ProviderException.fromStatus(408, "m", null).getErrorType()).isEqualTo(ProviderErrorType.TIMEOUT);
        assertThat(ProviderException.fromStatus(400, "m", null).getErrorType()).isEqualTo(ProviderErrorType.INVALID_REQUEST);
        assertThat(ProviderException.fromStatus(503, "m", null).getErrorType()).isEqualTo(ProviderErrorType.SERVER);
    }

    private ProviderErrorType errorTypeOf(ExtractRequest extractRequest) {
        try {
            provider.extract(extractRequest);
        } catch (ProviderException e) {
            return e.getErrorType();
        }
        throw new AssertionError("Expected a ProviderException");
    }

    private String reply(String content, int totalTokens) throws Exception {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode message = root.putArray("choices").addObject().putObject("message");
        message.put("role", "assistant");
        message.put("content", content);
        root.putObject("usage").put("total_tokens", totalTokens);
        return objectMapper.writeValueAsString(root);
    }
}
