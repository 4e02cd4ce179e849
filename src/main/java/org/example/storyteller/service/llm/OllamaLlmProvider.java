package org.example.storyteller.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * LLM provider implementation for a locally hosted Ollama server.
 * Calls the /api/generate endpoint without streaming.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final String model;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(WebClient.Builder webClientBuilder, String baseUrl, String model, Duration timeout) {
        this.webClient = webClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeout = timeout;
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}, timeout={}s",
                baseUrl, model, timeout.toSeconds());
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        if (options.topP() != null) {
            ollamaOptions.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            ollamaOptions.put("num_predict", options.maxTokens());
        }

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", ollamaOptions
        );

        try {
            String response = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            JsonNode responseNode = objectMapper.readTree(response == null ? "" : response);
            JsonNode generated = responseNode.get("response");
            if (generated == null || generated.isNull()) {
                throw new LlmProviderException("Ollama response has no 'response' field");
            }
            return generated.asText();

        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException("Ollama API error: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate response from Ollama: {}", e.toString());
            throw new LlmProviderException("Failed to generate response from Ollama", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(AVAILABILITY_TIMEOUT);
            return true;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
