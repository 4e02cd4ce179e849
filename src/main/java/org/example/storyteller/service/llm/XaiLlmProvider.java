package org.example.storyteller.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosted narration model behind xAI's OpenAI-compatible chat completions API.
 */
public class XaiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);
    public static final String DEFAULT_BASE_URL = "https://api.x.ai/v1";
    private static final String STORYTELLER_ROLE =
            "You are a creative writer who turns tabletop role-playing session transcripts into story prose.";

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;
    private final boolean configured;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiLlmProvider(WebClient.Builder webClientBuilder, String baseUrl, String apiKey, String model, Duration timeout) {
        this.model = model;
        this.timeout = timeout;
        this.configured = apiKey != null && !apiKey.isBlank();
        this.webClient = webClientBuilder
                .baseUrl(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("xAI narration model {} (timeout {}s, key {})",
                model, timeout.toSeconds(), configured ? "present" : "missing");
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        String body;
        try {
            body = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(chatRequest(prompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("xAI rejected narration request: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("xAI API error: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            // Timeouts and connection failures arrive here without a status.
            log.error("xAI narration request failed: {}", e.toString());
            throw new LlmProviderException("xAI request failed: " + e.getMessage(), e);
        }
        return completionText(body);
    }

    private Map<String, Object> chatRequest(String prompt, LlmOptions options) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", List.of(
                Map.of("role", "system", "content", STORYTELLER_ROLE),
                Map.of("role", "user", "content", prompt)
        ));
        request.put("temperature", options.temperature());
        if (options.topP() != null) {
            request.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            request.put("max_tokens", options.maxTokens());
        }
        return request;
    }

    /**
     * Reads the first choice's message content out of a chat completion body.
     */
    String completionText(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new LlmProviderException("Unreadable response from xAI API", e);
        }

        JsonNode choice = root == null ? null : root.path("choices").path(0);
        if (choice == null || choice.isMissingNode()) {
            throw new LlmProviderException("xAI response contained no choices");
        }
        JsonNode content = choice.path("message").path("content");
        if (!content.isTextual()) {
            throw new LlmProviderException("xAI response choice had no message content");
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            log.warn("xAI narration hit the max_tokens limit and may end mid-sentence");
        }
        return content.asText();
    }

    @Override
    public boolean isAvailable() {
        if (!configured) {
            log.debug("xAI not available: API key not configured");
        }
        return configured;
    }

    @Override
    public String getProviderName() {
        return "xai";
    }
}
