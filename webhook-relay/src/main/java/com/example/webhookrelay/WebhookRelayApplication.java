package com.example.webhookrelay;

import com.example.webhookrelay.config.CardsServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CardsServiceProperties.class)
public class WebhookRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookRelayApplication.class, args);
    }
}
