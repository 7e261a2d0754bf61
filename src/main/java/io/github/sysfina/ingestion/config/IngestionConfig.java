package io.github.sysfina.ingestion.config;

import io.github.sysfina.ingestion.client.GoogleSheetsClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the Feign clients and binds {@link IngestionProperties}.
 */
@Configuration
@EnableFeignClients(basePackageClasses = GoogleSheetsClient.class)
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfig {
}
