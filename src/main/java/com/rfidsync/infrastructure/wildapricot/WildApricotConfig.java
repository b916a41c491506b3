package com.rfidsync.infrastructure.wildapricot;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Cliente HTTP hacia Wild Apricot con timeouts acotados,
 * para que un directorio colgado no retrase indefinidamente el siguiente ciclo.
 */
@Configuration
public class WildApricotConfig {

    @Bean
    public RestClient wildApricotRestClient(
            @Value("${wildapricot.connect-timeout:PT10S}") Duration connectTimeout,
            @Value("${wildapricot.read-timeout:PT60S}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
