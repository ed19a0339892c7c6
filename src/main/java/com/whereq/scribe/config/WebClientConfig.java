package com.whereq.scribe.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration shared by the WordPress, search, NeuronWriter, synthesis and sitemap clients.
 * Clients that add a base URL or credentials clone the builder first.
 */
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024; // generated articles and large sitemaps

    @Bean
    public WebClient.Builder webClientBuilder(OptimizerProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .followRedirect(true);

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, "WhereQ-Scribe/" + properties.getVersion())
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }
}
