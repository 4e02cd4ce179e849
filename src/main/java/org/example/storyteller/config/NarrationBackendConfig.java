package org.example.storyteller.config;

import org.example.storyteller.service.backend.LocalNarrationBackend;
import org.example.storyteller.service.backend.NarrationBackend;
import org.example.storyteller.service.backend.NarrationBackendRegistry;
import org.example.storyteller.service.backend.RemoteNarrationBackend;
import org.example.storyteller.service.backend.TemplateNarrationBackend;
import org.example.storyteller.service.extract.ElementExtractor;
import org.example.storyteller.service.llm.OllamaLlmProvider;
import org.example.storyteller.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for narration backends.
 * Creates the remote, local and offline backends and the registry that orders them for failover.
 */
@Configuration
public class NarrationBackendConfig {

    private static final Logger log = LoggerFactory.getLogger(NarrationBackendConfig.class);

    // Remote (xAI) backend config
    @Value("${storyteller.backends.remote.base-url:" + XaiLlmProvider.DEFAULT_BASE_URL + "}")
    private String remoteBaseUrl;

    @Value("${storyteller.backends.remote.api-key:}")
    private String remoteApiKey;

    @Value("${storyteller.backends.remote.model:grok-4-1-fast-non-reasoning}")
    private String remoteModel;

    @Value("${storyteller.backends.remote.timeout-seconds:60}")
    private int remoteTimeoutSeconds;

    @Value("${storyteller.backends.remote.max-tokens-per-segment:" + RemoteNarrationBackend.DEFAULT_MAX_TOKENS_PER_SEGMENT + "}")
    private int remoteMaxTokens;

    // Local (Ollama) backend config
    @Value("${storyteller.backends.local.base-url:http://localhost:11434}")
    private String localBaseUrl;

    @Value("${storyteller.backends.local.model:llama3.1:latest}")
    private String localModel;

    @Value("${storyteller.backends.local.timeout-seconds:180}")
    private int localTimeoutSeconds;

    @Value("${storyteller.backends.local.max-tokens-per-segment:" + LocalNarrationBackend.DEFAULT_MAX_TOKENS_PER_SEGMENT + "}")
    private int localMaxTokens;

    // Offline template backend config
    @Value("${storyteller.backends.offline.max-tokens-per-segment:" + TemplateNarrationBackend.DEFAULT_MAX_TOKENS_PER_SEGMENT + "}")
    private int offlineMaxTokens;

    @Value("${storyteller.backends.default-preference:remote,local,offline}")
    private String defaultPreference;

    @Bean
    public RemoteNarrationBackend remoteNarrationBackend(WebClient.Builder webClientBuilder) {
        if (remoteApiKey == null || remoteApiKey.isBlank()) {
            log.warn("xAI API key not configured; remote backend will report unavailable and fail over");
        }
        log.info("Creating remote backend: model={}, maxTokensPerSegment={}", remoteModel, remoteMaxTokens);
        return new RemoteNarrationBackend(
                new XaiLlmProvider(webClientBuilder.clone(), remoteBaseUrl, remoteApiKey, remoteModel,
                        Duration.ofSeconds(remoteTimeoutSeconds)),
                remoteMaxTokens
        );
    }

    @Bean
    public LocalNarrationBackend localNarrationBackend(WebClient.Builder webClientBuilder) {
        log.info("Creating local backend: baseUrl={}, model={}, maxTokensPerSegment={}",
                localBaseUrl, localModel, localMaxTokens);
        return new LocalNarrationBackend(
                new OllamaLlmProvider(webClientBuilder.clone(), localBaseUrl, localModel,
                        Duration.ofSeconds(localTimeoutSeconds)),
                localMaxTokens
        );
    }

    @Bean
    public TemplateNarrationBackend templateNarrationBackend(ElementExtractor elementExtractor) {
        return new TemplateNarrationBackend(elementExtractor, offlineMaxTokens);
    }

    @Bean
    public NarrationBackendRegistry narrationBackendRegistry(List<NarrationBackend> backends) {
        List<String> preference = Arrays.stream(defaultPreference.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
        log.info("Narration backends: {}, default preference: {}",
                backends.stream().map(NarrationBackend::name).toList(), preference);
        return new NarrationBackendRegistry(backends, preference);
    }
}
