package io.github.sysfina.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound once at startup. A blank required value aborts the boot before any request is served.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record IngestionProperties(
        @Valid @NotNull Supabase supabase,
        @Valid @NotNull Google google
) {

    public record Supabase(
            @NotBlank String url,
            @NotBlank String serviceRoleKey,
            @DefaultValue("lancamentos") @NotBlank String table,
            @DefaultValue("500") @Min(1) int batchSize
    ) {}

    public record Google(
            @DefaultValue("https://sheets.googleapis.com") @NotBlank String baseUrl,
            @NotBlank String apiKey,
            @NotBlank String sheetId,
            @DefaultValue("A:V") @NotBlank String range
    ) {}
}
