package com.threadgraph.research.workflow.plugin.reasoning.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.threadgraph.integration.enumerations.ThreadGraphMessageRole;
import com.threadgraph.integration.models.message.ThreadGraphChatMessage;
import com.threadgraph.research.workflow.plugin.config.ResearchWorkflowConfig;
import com.threadgraph.research.workflow.plugin.exception.ReasoningTransportException;
import com.threadgraph.research.workflow.plugin.misc.ResearchWorkflowObjectMapper;
import com.threadgraph.research.workflow.plugin.reasoning.IReasoningClient;
import com.threadgraph.research.workflow.plugin.reasoning.ReasoningRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Calls the Gemini {@code generateContent} REST endpoint.
 *
 * <p>History messages are sent as {@code user} / {@code model} turns followed by the prompt as a final
 * {@code user} turn. Grounded requests enable the {@code google_search} tool; structured requests ask for
 * {@code application/json} output.
 */
@Slf4j
public class GeminiReasoningClient implements IReasoningClient {

    static final String API_KEY_HEADER = "x-goog-api-key";
    private static final String GENERATE_PATH = "/v1beta/models/{model}:generateContent";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration requestTimeout;

    public GeminiReasoningClient(ResearchWorkflowConfig config) {
        this(WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build(), config);
    }

    public GeminiReasoningClient(WebClient webClient, ResearchWorkflowConfig config) {
        this.webClient = webClient;
        this.objectMapper = ResearchWorkflowObjectMapper.getInstance();
        this.apiKey = Objects.requireNonNull(config.getApiKey(), "apiKey");
        this.requestTimeout = config.getRequestTimeout();
    }

    @Override
    public Mono<String> generate(ReasoningRequest request) {
        String model = request.getModel();
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(buildRequestBody(request)))
                .doOnNext(body -> log.debug("Calling {} for {}", model, request.getPurpose()))
                .flatMap(body -> webClient.post()
                        .uri(GENERATE_PATH, model)
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(requestTimeout))
                .map(responseBody -> extractText(model, responseBody))
                .defaultIfEmpty("")
                .onErrorMap(e -> !(e instanceof ReasoningTransportException), e -> toTransportException(model, e));
    }

    Map<String, Object> buildRequestBody(ReasoningRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.getSystemInstruction() != null && !request.getSystemInstruction().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", request.getSystemInstruction()))));
        }

        List<Map<String, Object>> contents = new ArrayList<>();
        for (ThreadGraphChatMessage message : request.getHistory()) {
            if (message.role() == ThreadGraphMessageRole.SYSTEM) {
                continue;
            }
            contents.add(content(message.isUser() ? "user" : "model", message.content()));
        }
        contents.add(content("user", request.getPrompt()));
        body.put("contents", contents);

        if (request.isGroundedSearch()) {
            body.put("tools", List.of(Map.of("google_search", Map.of())));
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (request.getTemperature() != null) {
            generationConfig.put("temperature", request.getTemperature());
        }
        if (request.isStructuredOutput()) {
            generationConfig.put("responseMimeType", MediaType.APPLICATION_JSON_VALUE);
        }
        if (!generationConfig.isEmpty()) {
            body.put("generationConfig", generationConfig);
        }
        return body;
    }

    private static Map<String, Object> content(String role, String text) {
        return Map.of("role", role, "parts", List.of(Map.of("text", text)));
    }

    String extractText(String model, String responseBody) {
        GenerateContentResponse response;
        try {
            response = objectMapper.readValue(responseBody, GenerateContentResponse.class);
        } catch (JacksonException e) {
            throw new ReasoningTransportException(model, "unreadable response: " + e.getOriginalMessage(), false, e);
        }
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            return "";
        }
        Content content = response.candidates().get(0).content();
        if (content == null || content.parts() == null) {
            return "";
        }
        return content.parts().stream()
                .map(Part::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
    }

    private static ReasoningTransportException toTransportException(String model, Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            boolean retryable = status == 429 || responseException.getStatusCode().is5xxServerError();
            log.warn("Model {} answered with status {}", model, status);
            return new ReasoningTransportException(model, "HTTP " + status, retryable, error);
        }
        if (error instanceof TimeoutException) {
            log.warn("Model {} did not answer in time", model);
            return new ReasoningTransportException(model, "timed out", true, error);
        }
        if (error instanceof WebClientRequestException) {
            log.warn("Model {} could not be reached: {}", model, error.getMessage());
            return new ReasoningTransportException(model, "connection failed: " + error.getMessage(), true, error);
        }
        return new ReasoningTransportException(model, String.valueOf(error.getMessage()), false, error);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {
    }
}
