package com.compareintel.compare.config;

import com.compareintel.compare.service.provider.ProviderType;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(ComparisonProperties.class)
public class WebClientConfig {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Bean
    public WebClient openAiWebClient(ComparisonProperties properties) {
        ProviderSettings settings = properties.provider(ProviderType.OPENAI);
        WebClient.Builder builder = providerClient(ProviderType.OPENAI, settings);
        if (settings.hasApiKey()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
        }
        return builder.build();
    }

    @Bean
    public WebClient anthropicWebClient(ComparisonProperties properties) {
        ProviderSettings settings = properties.provider(ProviderType.ANTHROPIC);
        WebClient.Builder builder = providerClient(ProviderType.ANTHROPIC, settings)
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION);
        if (settings.hasApiKey()) {
            builder.defaultHeader("x-api-key", settings.apiKey());
        }
        return builder.build();
    }

    @Bean
    public WebClient geminiWebClient(ComparisonProperties properties) {
        ProviderSettings settings = properties.provider(ProviderType.GEMINI);
        WebClient.Builder builder = providerClient(ProviderType.GEMINI, settings);
        if (settings.hasApiKey()) {
            builder.defaultHeader("x-goog-api-key", settings.apiKey());
        }
        return builder.build();
    }

    private WebClient.Builder providerClient(ProviderType type, ProviderSettings settings) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(settings.timeout());
        return WebClient.builder()
                .baseUrl(settings.resolvedBaseUrl(type))
                .exchangeStrategies(exchangeStrategies())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
