package com.deepansh.wordplay.llm;

import com.deepansh.wordplay.exception.ModelCallException;
import com.deepansh.wordplay.exception.ModelUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible completion client: works with OpenAI, Groq and Ollama.
 *
 * Error mapping:
 *
 * | Error                    | Exception                                    |
 * |--------------------------|----------------------------------------------|
 * | 401 invalid_api_key      | ModelCallException (not retried)             |
 * | 400 model_decommissioned | ModelCallException with guidance logged      |
 * | 429 rate limit           | ModelUnavailableException (retried)          |
 * | other 4xx                | ModelCallException (not retried)             |
 * | 5xx server error         | ModelUnavailableException (retried)          |
 * | network error            | ModelUnavailableException (retried)          |
 * | no choices / empty text  | ModelCallException                           |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, CompletionOptions options) {
        Map<String, Object> requestBody = buildRequestBody(systemPrompt, userPrompt, options);

        log.debug("Sending {} completion to {} [model={}]",
                options.getPurpose(), providerName, requestBody.get("model"));

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new ModelUnavailableException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new ModelUnavailableException(providerName + " unreachable: " + e.getMessage(), e);
        }

        return extractContent(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            log.error("================================================================");
            log.error("  MODEL UNAVAILABLE: {} is not served by {}.", props.getModel(), providerName);
            log.error("  Update the model in application.yml or via the provider's env var.");
            log.error("================================================================");
            throw new ModelCallException(
                    "Model '" + props.getModel() + "' is not available on " + providerName);
        }

        if (statusCode == 401) {
            throw new ModelCallException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new ModelUnavailableException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new ModelCallException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String systemPrompt, String userPrompt,
                                                 CompletionOptions options) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", options.getModel() != null ? options.getModel() : props.getModel());
        body.put("max_tokens", options.getMaxTokens() != null ? options.getMaxTokens() : props.getMaxTokens());
        body.put("temperature", options.getTemperature() != null ? options.getTemperature() : props.getTemperature());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt != null ? systemPrompt : ""),
                Map.of("role", "user", "content", userPrompt != null ? userPrompt : "")
        ));

        if (options.isJsonResponse() && props.isSupportsJsonMode()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return body;
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        if (response == null) {
            throw new ModelCallException(providerName + " returned an empty response body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ModelCallException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;
        if (content == null || content.isBlank()) {
            throw new ModelCallException(providerName + " returned an empty completion");
        }
        return content;
    }
}
