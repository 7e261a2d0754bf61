package io.github.sysfina.ingestion.config;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.springframework.context.annotation.Bean;

public class GoogleSheetsFeignConfig {

    @Bean
    public RequestInterceptor googleApiKeyInterceptor(IngestionProperties properties) {
        String apiKey = properties.google().apiKey();
        return new RequestInterceptor() {
            @Override
            public void apply(RequestTemplate template) {
                template.query("key", apiKey);
            }
        };
    }
}
