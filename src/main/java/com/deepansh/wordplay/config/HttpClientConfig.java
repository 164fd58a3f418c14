package com.deepansh.wordplay.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient.Builder backed by a pooled Apache HttpClient.
 *
 * The shared builder carries the model-call timeouts ({@code llm.connect-timeout-ms},
 * {@code llm.read-timeout-ms}). Clients with their own timeouts, such as search and scrape,
 * clone it and swap in a factory from {@link #pooledRequestFactory(int, int)}.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder restClientBuilder(@Value("${llm.connect-timeout-ms:5000}") int connectTimeoutMs,
                                                @Value("${llm.read-timeout-ms:60000}") int readTimeoutMs) {
        log.info("HttpClient configured with pooled connection manager [connect={}ms, read={}ms]",
                connectTimeoutMs, readTimeoutMs);
        return RestClient.builder().requestFactory(pooledRequestFactory(connectTimeoutMs, readTimeoutMs));
    }

    public static HttpComponentsClientHttpRequestFactory pooledRequestFactory(int connectTimeoutMs, int readTimeoutMs) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(50)
                                .setMaxConnPerRoute(10)
                                .setDefaultConnectionConfig(connectionConfig(connectTimeoutMs, readTimeoutMs))
                                .build())
                .evictExpiredConnections()
                .build();
        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }

    static ConnectionConfig connectionConfig(int connectTimeoutMs, int readTimeoutMs) {
        return ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                .build();
    }
}
