package io.github.sysfina.ingestion.client;

import io.github.sysfina.ingestion.client.dto.SheetValuesResponse;
import io.github.sysfina.ingestion.config.GoogleSheetsFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "google-sheets",
        url = "${app.google.base-url}",
        configuration = GoogleSheetsFeignConfig.class
)
public interface GoogleSheetsClient {
    @GetMapping("/v4/spreadsheets/{sheetId}/values/{range}")
    SheetValuesResponse getValues(@PathVariable("sheetId") String sheetId, @PathVariable("range") String range);
}
