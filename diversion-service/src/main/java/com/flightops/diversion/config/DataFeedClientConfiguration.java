package com.flightops.diversion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * HTTP wiring for the live aviation data feed. Only present when {@code datafeed.mode=live}.
 */
@Configuration
@ConditionalOnProperty(name = "datafeed.mode", havingValue = "live")
public class DataFeedClientConfiguration {

    private final Duration connectTimeout;
    private final Duration readTimeout;

    public DataFeedClientConfiguration(@Value("${datafeed.connect-timeout-ms:3000}") long connectTimeoutMs,
                                       @Value("${datafeed.read-timeout-ms:5000}") long readTimeoutMs) {
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.readTimeout = Duration.ofMillis(readTimeoutMs);
    }

    @Bean
    public RestTemplate dataFeedRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper) {
        MappingJackson2HttpMessageConverter feedConverter = new MappingJackson2HttpMessageConverter(objectMapper);
        feedConverter.setSupportedMediaTypes(List.of(MediaType.APPLICATION_JSON));

        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .messageConverters(feedConverter)
                .build();
    }
}
