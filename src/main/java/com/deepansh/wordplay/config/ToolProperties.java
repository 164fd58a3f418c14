package com.deepansh.wordplay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strongly-typed configuration for all tools.
 * Bound from application.yml under the "tools" prefix.
 */
@Component
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private WebSearch webSearch = new WebSearch();
    private Scrape scrape = new Scrape();
    private TextProcessing textProcessing = new TextProcessing();

    @Data
    public static class WebSearch {
        private Perplexity perplexity = new Perplexity();

        @Data
        public static class Perplexity {
            /** Empty key means simulated results. */
            private String apiKey = "";
            private String baseUrl = "https://api.perplexity.ai";
            private String model = "sonar";
            private int maxTokens = 1000;
            private double temperature = 0.1;
            private int connectTimeoutMs = 5000;
            private int readTimeoutMs = 30000;
        }
    }

    @Data
    public static class Scrape {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 15000;
        /** Bytes of HTML read from a page; the rest of the response is discarded. */
        private int maxBodyBytes = 2_000_000;
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
                + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
        /** Pages with less extracted text than this are treated as blocked or empty. */
        private int minContentLength = 100;
        private int maxTitleLength = 200;
    }

    @Data
    public static class TextProcessing {
        /** Prefix of scraped content handed to analyze_document_structure by chaining. */
        private int structurePrefixLength = 5000;
    }
}
