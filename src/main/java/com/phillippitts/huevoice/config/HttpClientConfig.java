package com.phillippitts.huevoice.config;

import com.phillippitts.huevoice.config.properties.BridgeProperties;
import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One {@link RestTemplate} per remote system, each with its own timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate hueRestTemplate(RestTemplateBuilder builder, BridgeProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    /** Read timeout matches the recognizer's own deadline so a hung call frees its pool thread. */
    @Bean
    public RestTemplate recognitionRestTemplate(RestTemplateBuilder builder, RecognitionProperties props) {
        return builder
                .setConnectTimeout(props.getTimeout())
                .setReadTimeout(props.getTimeout())
                .build();
    }
}
