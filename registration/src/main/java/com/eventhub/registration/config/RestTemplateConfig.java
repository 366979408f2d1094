package com.eventhub.registration.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used for identity directory lookups.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate directoryRestTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(10_000); // 10 seconds
        factory.setReadTimeout(30_000); // 30 seconds
        return new RestTemplate(factory);
    }
}
