package io.github.sysfina.ingestion.config;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.springframework.context.annotation.Bean;

public class SupabaseFeignConfig {

    static final String CLIENT_INFO = "import-google-sheets";

    @Bean
    public RequestInterceptor supabaseAuthInterceptor(IngestionProperties properties) {
        String serviceRoleKey = properties.supabase().serviceRoleKey();
        return new RequestInterceptor() {
            @Override
            public void apply(RequestTemplate template) {
                template.header("apikey", serviceRoleKey);
                template.header("Authorization", "Bearer " + serviceRoleKey);
                template.header("X-Client-Info", CLIENT_INFO);
                // PostgREST answers 201/204 without echoing the rows back
                template.header("Prefer", "return=minimal");
            }
        };
    }
}
