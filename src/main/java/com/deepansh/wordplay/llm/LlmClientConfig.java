package com.deepansh.wordplay.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * The raw client is wrapped by {@link ResilientLlmClient}, which is the bean everything
 * else injects.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:openai}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    // Ollama (local, no key)
    @Value("${ollama.base-url}") private String ollamaBaseUrl;
    @Value("${ollama.model}")    private String ollamaModel;
    @Value("${ollama.max-tokens}") private int ollamaMaxTokens;
    @Value("${ollama.temperature}") private double ollamaTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(RestClient.Builder builder) {
        return switch (provider.toLowerCase()) {
            case "groq" -> {
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                        "groq", builder.clone());
            }
            case "ollama" -> {
                LlmProviderProperties p = props("", ollamaBaseUrl, ollamaModel, ollamaMaxTokens, ollamaTemp);
                p.setSupportsJsonMode(false);
                yield new GenericLlmClient(p, "ollama", builder.clone());
            }
            default -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                        "openai", builder.clone());
            }
        };
    }

    private LlmProviderProperties props(String key, String baseUrl, String model, int maxTokens, double temp) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temp);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "groq" -> groqModel;
            case "ollama" -> ollamaModel;
            default -> openAiModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.warn("  {} API key not set! Set env var: {}=<your-key>", name, envVar);
            log.warn("  Model-backed stages will use their deterministic fallbacks.");
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
