package io.github.sysfina.ingestion.service;

import feign.FeignException;
import io.github.sysfina.ingestion.client.GoogleSheetsClient;
import io.github.sysfina.ingestion.client.dto.SheetValuesResponse;
import io.github.sysfina.ingestion.config.IngestionProperties;
import io.github.sysfina.ingestion.domain.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads the receivables range in a single call. No retry and no caching between runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SheetSourceService {

    private final IngestionProperties properties;
    private final GoogleSheetsClient googleSheetsClient;

    /**
     * @return every row of the configured range, header included
     */
    public List<List<String>> fetchRows() {
        IngestionProperties.Google google = properties.google();
        log.info("Lendo planilha {} no intervalo {}", google.sheetId(), google.range());

        SheetValuesResponse response;
        try {
            response = googleSheetsClient.getValues(google.sheetId(), google.range());
        } catch (FeignException e) {
            throw new SourceUnavailableException(e.status(), e.contentUTF8(), e);
        }

        if (response == null || response.values() == null) {
            throw new SourceUnavailableException("Google Sheets response is missing the 'values' array.");
        }
        return response.values();
    }
}
