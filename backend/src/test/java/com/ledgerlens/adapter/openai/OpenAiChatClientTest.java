package com.ledgerlens.adapter.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatClientTest {

    private static final String REPLY = """
            {"id": "chatcmpl-1", "choices": [{"index": 0,
              "message": {"role": "assistant", "content": "{\\"category\\": \\"alimentacion\\"}", "refusal": null}}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private ModelClientProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ModelClientProperties();
        properties.setBaseUrl("http://model.test/v1");
        properties.setApiKey("sk-test");
    }

    private OpenAiChatClient client(HttpStatus status, String body, RateLimiter limiter) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new OpenAiChatClient(builder, objectMapper, properties, limiter);
    }

    private static RateLimiter limiter(int permits) {
        return RateLimiter.of("model-test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(permits)
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    @Test
    @DisplayName("completion posts to /chat/completions with the bearer key and returns the message content")
    void complete() {
        OpenAiChatClient client = client(HttpStatus.OK, REPLY, limiter(5));

        String content = client.complete("gpt-4o-mini", List.of(Map.of("role", "user", "content", "hola")),
                OpenAiChatClient.jsonObject());

        assertThat(content).isEqualTo("{\"category\": \"alimentacion\"}");
        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    @DisplayName("HTTP errors surface as model call failures with the status code")
    void httpError() {
        OpenAiChatClient client = client(HttpStatus.TOO_MANY_REQUESTS, "{\"error\": \"rate\"}", limiter(5));

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", List.of(), null))
                .isInstanceOf(ModelCallException.class)
                .hasMessageContaining("429");
    }

    @Test
    @DisplayName("a call is refused locally once the limiter has no permits left")
    void limiterExhausted() {
        OpenAiChatClient client = client(HttpStatus.OK, REPLY, limiter(1));
        client.complete("gpt-4o-mini", List.of(), null);

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", List.of(), null))
                .isInstanceOf(ModelCallException.class)
                .hasMessageContaining("limiter");
    }

    @Test
    @DisplayName("refusals, empty content and unreadable bodies are rejected")
    void contentFailures() {
        OpenAiChatClient client = client(HttpStatus.OK, REPLY, limiter(5));

        assertThatThrownBy(() -> client.content(
                "{\"choices\": [{\"message\": {\"content\": null, \"refusal\": \"no puedo\"}}]}"))
                .isInstanceOf(ModelCallException.class)
                .hasMessage("Model refused: no puedo");
        assertThatThrownBy(() -> client.content("{\"choices\": [{\"message\": {\"content\": \"\"}}]}"))
                .isInstanceOf(ModelCallException.class)
                .hasMessage("Chat completion without content");
        assertThatThrownBy(() -> client.content("not json"))
                .isInstanceOf(ModelCallException.class)
                .hasMessage("Unreadable chat completion response");
        assertThatThrownBy(() -> client.content(""))
                .isInstanceOf(ModelCallException.class);
    }

    @Test
    @DisplayName("a strict schema response format wraps the schema under its name")
    void jsonSchemaFormat() {
        Map<String, Object> format = OpenAiChatClient.jsonSchema("doc", Map.of("type", "object"));

        assertThat(format).containsEntry("type", "json_schema");
        assertThat(format.get("json_schema")).isEqualTo(
                Map.of("name", "doc", "strict", true, "schema", Map.of("type", "object")));
    }
}
