package io.github.sysfina.ingestion.client;

import io.github.sysfina.ingestion.client.dto.LedgerEntryRow;
import io.github.sysfina.ingestion.config.SupabaseFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * PostgREST endpoints of the Supabase project holding the ledger.
 */
@FeignClient(
        name = "supabase-store",
        url = "${app.supabase.url}",
        configuration = SupabaseFeignConfig.class
)
public interface LedgerStoreClient {
    @DeleteMapping("/rest/v1/{table}")
    void deleteByKind(@PathVariable("table") String table, @RequestParam("tipo") String kindFilter);

    /**
     * Inserts every row in one statement; PostgREST rejects the whole batch if any row fails.
     */
    @PostMapping("/rest/v1/{table}")
    void insertBatch(@PathVariable("table") String table,
                     @RequestParam("columns") String columns,
                     @RequestBody List<LedgerEntryRow> rows);
}
