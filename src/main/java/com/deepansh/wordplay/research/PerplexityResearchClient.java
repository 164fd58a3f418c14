package com.deepansh.wordplay.research;

import com.deepansh.wordplay.config.HttpClientConfig;
import com.deepansh.wordplay.config.ToolProperties;
import com.deepansh.wordplay.exception.ResearchException;
import com.deepansh.wordplay.text.TextOperations;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Web research backed by the Perplexity chat API, with direct HTTP page scraping.
 *
 * Fallback behavior:
 * - If PERPLEXITY_API_KEY is not set → simulated results, no error
 * - If the API call fails → simulated results with {@code error} set
 * - If the answer cites no URLs → Wikipedia / Google Scholar links for the query
 */
@Component
@Slf4j
public class PerplexityResearchClient implements WebResearchClient {

    private static final Pattern URL = Pattern.compile("https?://[^\\s)\\]]+");
    private static final Pattern CITATION = Pattern.compile("\\[\\d+]");

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient searchClient;
    private final RestClient scrapeClient;

    public PerplexityResearchClient(ToolProperties toolProperties,
                                    ObjectMapper objectMapper,
                                    RestClient.Builder restClientBuilder) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
        ToolProperties.WebSearch.Perplexity perplexity = toolProperties.getWebSearch().getPerplexity();
        ToolProperties.Scrape scrape = toolProperties.getScrape();
        this.searchClient = restClientBuilder.clone()
                .requestFactory(HttpClientConfig.pooledRequestFactory(
                        perplexity.getConnectTimeoutMs(), perplexity.getReadTimeoutMs()))
                .baseUrl(perplexity.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build();
        this.scrapeClient = restClientBuilder.clone()
                .requestFactory(HttpClientConfig.pooledRequestFactory(
                        scrape.getConnectTimeoutMs(), scrape.getReadTimeoutMs()))
                .defaultHeader("User-Agent", scrape.getUserAgent())
                .defaultHeader("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.5")
                .build();
    }

    @Override
    public SearchResults search(String query, String source) {
        ToolProperties.WebSearch.Perplexity config = toolProperties.getWebSearch().getPerplexity();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("No PERPLEXITY_API_KEY configured, using simulated results for '{}'", query);
            return simulatedResults(query);
        }

        log.info("Web search: query='{}' source={}", query, source);
        try {
            String content = askPerplexity(query, config);
            List<SearchResult> results = extractSources(content);
            if (results.isEmpty()) {
                results = defaultSources(query);
            }
            return new SearchResults(results, content, null);
        } catch (RestClientException | ResearchException e) {
            log.error("Perplexity search failed for query='{}': {}", query, e.getMessage());
            return simulatedResults(query).withError(
                    "Search service temporarily unavailable: " + e.getMessage() + ". Showing cached results.");
        }
    }

    private String askPerplexity(String query, ToolProperties.WebSearch.Perplexity config) {
        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content",
                                "You are a helpful research assistant. Provide a comprehensive answer "
                                        + "with specific facts and cite your sources. Always include URLs when available."),
                        Map.of("role", "user", "content",
                                "Research this topic: " + query
                                        + ". Please provide detailed information and cite your sources with URLs.")),
                "max_tokens", config.getMaxTokens(),
                "temperature", config.getTemperature(),
                "return_citations", true,
                "return_images", false);

        String response = searchClient.post()
                .uri("/chat/completions")
                .header("Authorization", "Bearer " + config.getApiKey())
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new ResearchException("Perplexity API error: " + res.getStatusCode());
                })
                .body(String.class);

        try {
            JsonNode root = objectMapper.readTree(response != null ? response : "{}");
            return root.path("choices").path(0).path("message").path("content").asText("");
        } catch (Exception e) {
            throw new ResearchException("Unreadable Perplexity response: " + e.getMessage(), e);
        }
    }

    /** Pulls cited URLs out of the answer; the snippet is the sentence carrying the matching [n] marker. */
    List<SearchResult> extractSources(String content) {
        List<SearchResult> sources = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return sources;
        }
        List<String> sentences = Arrays.stream(content.split("[.!?]+"))
                .filter(s -> s.strip().length() > 10)
                .toList();

        Matcher matcher = URL.matcher(content);
        int index = 0;
        while (matcher.find()) {
            String url = cleanUrl(matcher.group());
            String domain = domainOf(url);
            if (domain == null) {
                log.debug("Skipping invalid URL: {}", url);
                index++;
                continue;
            }
            String marker = "[" + (index + 1) + "]";
            String sentence = sentences.stream()
                    .filter(s -> s.contains(marker))
                    .findFirst()
                    .orElse(index < sentences.size() ? sentences.get(index) : "Information from " + domain);

            String title = Character.toUpperCase(domain.charAt(0)) + domain.substring(1).replace('.', ' ');
            sources.add(new SearchResult(title, CITATION.matcher(sentence).replaceAll("").strip(), url));
            index++;
        }
        return sources;
    }

    private String cleanUrl(String raw) {
        return raw.replaceAll("]\\(.*$", "")
                .replaceAll("[),.]+$", "")
                .strip();
    }

    private List<SearchResult> defaultSources(String query) {
        String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8);
        return List.of(
                new SearchResult(query + " - Wikipedia",
                        "Wikipedia article about " + query + " with comprehensive background information and references.",
                        "https://en.wikipedia.org/wiki/" + URLEncoder.encode(query.replaceAll("\\s+", "_"), StandardCharsets.UTF_8)),
                new SearchResult(query + " - Academic Research",
                        "Academic research and scholarly articles related to " + query + ".",
                        "https://scholar.google.com/scholar?q=" + encoded));
    }

    SearchResults simulatedResults(String query) {
        List<SearchResult> results = List.of(
                new SearchResult(query + " - Overview",
                        "Comprehensive information about " + query
                                + " including key concepts, applications, and recent developments in the field.",
                        "https://example.com/overview"),
                new SearchResult(query + " - Latest Research",
                        "Recent research findings and academic papers related to " + query
                                + ", including methodology and conclusions.",
                        "https://example.com/research"),
                new SearchResult(query + " - Practical Applications",
                        "Real-world applications and case studies demonstrating the use of " + query
                                + " in various industries.",
                        "https://example.com/applications"));
        return new SearchResults(results,
                "This is simulated research data for \"" + query + "\". To get real-time web search results, "
                        + "please configure the PERPLEXITY_API_KEY environment variable.",
                null);
    }

    @Override
    public ScrapedPage scrape(String url) {
        String domain = domainOf(url);
        if (domain == null) {
            throw new ResearchException("Failed to scrape webpage: invalid URL '" + url + "'");
        }

        log.info("Scraping {}", url);
        ToolProperties.Scrape config = toolProperties.getScrape();
        String body;
        try {
            body = scrapeClient.get()
                    .uri(URI.create(url))
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            throw new ResearchException("Failed to scrape webpage: HTTP " + res.getStatusCode());
                        }
                        return readCapped(res, config.getMaxBodyBytes());
                    });
        } catch (RestClientException e) {
            throw new ResearchException("Failed to scrape webpage: " + e.getMessage(), e);
        }

        String content = HtmlText.text(body);
        if (content.length() < config.getMinContentLength()) {
            throw new ResearchException("Failed to scrape webpage: content too short - may be blocked or empty page");
        }

        String title = HtmlText.title(body);
        if (title == null || title.isBlank()) {
            title = domain;
        }
        if (title.length() > config.getMaxTitleLength()) {
            title = title.substring(0, config.getMaxTitleLength());
        }
        return new ScrapedPage(title, content, TextOperations.countWords(content), domain);
    }

    /** Reads at most {@code maxBytes} of the body; anything beyond is left unread. */
    static String readCapped(ClientHttpResponse response, int maxBytes) throws IOException {
        byte[] bytes;
        try (InputStream in = response.getBody()) {
            bytes = in.readNBytes(maxBytes);
        }
        MediaType contentType = response.getHeaders().getContentType();
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        if (bytes.length == maxBytes) {
            log.debug("Scrape body truncated at {} bytes", maxBytes);
        }
        return new String(bytes, charset);
    }

    private static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.strip());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            String host = uri.getHost();
            return host != null && !host.isBlank() ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
