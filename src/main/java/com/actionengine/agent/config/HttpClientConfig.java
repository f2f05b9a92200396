package com.actionengine.agent.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
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
 * Pooled Apache HttpClient behind the model clients.
 *
 * Every thread gets its own model client, but they all clone this builder
 * and so share one connection pool. The response timeout bounds a single
 * completion call; retries and the circuit breaker sit above it.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout-seconds:10}")
    private int connectTimeoutSeconds;

    @Value("${llm.http.response-timeout-seconds:120}")
    private int responseTimeoutSeconds;

    @Value("${llm.http.max-connections:50}")
    private int maxConnections;

    @Bean(name = "llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(maxConnections)
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSeconds))
                                .setSocketTimeout(Timeout.ofSeconds(responseTimeoutSeconds))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofSeconds(responseTimeoutSeconds))
                        .build())
                .evictExpiredConnections()
                .build();

        log.info("LLM HttpClient configured [maxConnections={}, connectTimeout={}s, responseTimeout={}s]",
                maxConnections, connectTimeoutSeconds, responseTimeoutSeconds);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
