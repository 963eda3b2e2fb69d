package com.payerdesk.chatbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient searchWebClient(@Value("${chat.search.base-url:}") String baseUrl,
                                     @Value("${chat.search.timeout-seconds:15}") long timeoutSeconds) {
        return baseClient(baseUrl, timeoutSeconds);
    }

    @Bean
    public WebClient metadataWebClient(@Value("${chat.metadata.base-url:}") String baseUrl,
                                       @Value("${chat.metadata.timeout-seconds:15}") long timeoutSeconds) {
        return baseClient(baseUrl, timeoutSeconds);
    }

    @Bean
    public WebClient skillsWebClient(@Value("${chat.skills.base-url:}") String baseUrl,
                                     @Value("${chat.skills.timeout-seconds:30}") long timeoutSeconds) {
        return baseClient(baseUrl, timeoutSeconds);
    }

    @Bean
    public WebClient llmWebClient(@Value("${chat.llm.base-url:}") String baseUrl,
                                  @Value("${chat.llm.api-key:}") String apiKey,
                                  @Value("${chat.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = builder(baseUrl, timeoutSeconds);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient baseClient(String baseUrl, long timeoutSeconds) {
        return builder(baseUrl, timeoutSeconds)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private WebClient.Builder builder(String baseUrl, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder().exchangeStrategies(exchangeStrategies());
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        return builder;
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
