package com.example.webhookrelay.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient cardsServiceWebClient(WebClient.Builder builder, CardsServiceProperties properties) {
        // netty takes the connect timeout as an int; overflow fails startup
        int connectTimeoutMillis = Math.toIntExact(properties.getTimeout().toMillis());

        ConnectionProvider connectionProvider = ConnectionProvider.builder("cards-service-connection-pool")
                .maxConnections(50)
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofSeconds(60))
                .pendingAcquireTimeout(properties.getTimeout())
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        // Connect and response phases share the outbound bound
        HttpClient httpClient = HttpClient.create(connectionProvider)
                .responseTimeout(properties.getTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis);

        log.info("Cards service client initialized: baseUrl={}, timeout={}",
                properties.getBaseUrl(), properties.getTimeout());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
