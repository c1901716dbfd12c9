package io.github.yok.leaksloader.core;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaksloader.model.SourceTable;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class IngestionSummaryTest {

    @Test
    void getTotal_正常ケース_ロードとスキップが混在する_既存件数も合算されること() {
        IngestionSummary summary = new IngestionSummary();
        summary.add(TableLoadResult.loaded(SourceTable.ENTITIES, 3, 0, 0));
        summary.add(TableLoadResult.skipped(SourceTable.OFFICERS, 4));

        assertEquals(7L, summary.getTotal());
        assertFalse(summary.hasGaps());
        assertEquals(List.of(SourceTable.ENTITIES, SourceTable.OFFICERS),
                summary.getResults().stream().map(TableLoadResult::getTable)
                        .collect(Collectors.toList()));
    }

    @Test
    void hasGaps_正常ケース_失敗バッチがある_trueが返ること() {
        IngestionSummary summary = new IngestionSummary();
        summary.add(TableLoadResult.loaded(SourceTable.RELATIONSHIPS, 5000, 1, 5000));

        assertTrue(summary.hasGaps());
        assertTrue(summary.getResults().get(0).hasGaps());
    }

    @Test
    void hasFailures_正常ケース_失敗表がある_trueが返り件数が合算されること() {
        IngestionSummary summary = new IngestionSummary();
        assertTrue(summary.isEmpty());
        summary.add(TableLoadResult.loaded(SourceTable.ENTITIES, 3, 0, 0));
        summary.add(TableLoadResult.failed(SourceTable.OFFICERS, 2));

        assertFalse(summary.isEmpty());
        assertTrue(summary.hasFailures());
        assertFalse(summary.hasGaps());
        assertEquals(5L, summary.getTotal());
        assertEquals(TableLoadResult.Status.FAILED, summary.getResults().get(1).getStatus());
        assertDoesNotThrow(summary::log);
    }

    @Test
    void getResults_異常ケース_返却リストを変更する_UnsupportedOperationExceptionが送出されること() {
        IngestionSummary summary = new IngestionSummary();
        List<TableLoadResult> results = summary.getResults();
        assertThrows(UnsupportedOperationException.class,
                () -> results.add(TableLoadResult.skipped(SourceTable.ADDRESSES, 1)));
    }

    @Test
    void log_正常ケース_空および混在した結果_例外なく出力されること() {
        IngestionSummary empty = new IngestionSummary();
        assertDoesNotThrow(empty::log);

        IngestionSummary summary = new IngestionSummary();
        summary.add(TableLoadResult.loaded(SourceTable.ENTITIES, 814344, 0, 0));
        summary.add(TableLoadResult.skipped(SourceTable.OFFICERS, 771369));
        summary.add(TableLoadResult.loaded(SourceTable.RELATIONSHIPS, 3000, 2, 10000));
        assertDoesNotThrow(summary::log);
    }
}
