package com.whereq.headshot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the generation provider and webhook notifications
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB, base64 images
    }

    @Bean
    public WebClient generationProviderWebClient(WebClient.Builder webClientBuilder,
                                                 HeadshotProperties properties) {
        HeadshotProperties.ProviderConfig provider = properties.getProvider();
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(provider.getBaseUrl());
        if (provider.getApiToken() != null && !provider.getApiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiToken());
        }
        return builder.build();
    }
}
