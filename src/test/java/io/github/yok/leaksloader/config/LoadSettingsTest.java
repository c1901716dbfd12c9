package io.github.yok.leaksloader.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaksloader.model.SourceTable;
import java.io.File;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadSettingsTest {

    private PathsConfig paths;
    private IngestConfig ingest;
    private ConnectionConfig connection;

    @BeforeEach
    void setup() {
        paths = new PathsConfig();
        paths.setDataPath("/data/icij");
        ingest = new IngestConfig();
        connection = new ConnectionConfig();
    }

    @Test
    void from_正常ケース_既定値_全表が選択されABORT_TABLEとなること() {
        LoadSettings settings = LoadSettings.from(paths, ingest, connection);

        assertEquals(5000, settings.getBatchSize());
        assertEquals(CheckpointMode.NON_EMPTY, settings.getCheckpointMode());
        assertNull(settings.getSchema());
        for (SourceTable table : SourceTable.values()) {
            assertTrue(settings.isSelected(table));
            assertEquals(BatchFailurePolicy.ABORT_TABLE, settings.failurePolicyFor(table));
            assertEquals(table.getTableName(), settings.qualify(table));
            assertEquals(new File("/data/icij", table.getDefaultFileName()),
                    settings.resolveSourceFile(table));
        }
    }

    @Test
    void from_正常ケース_表ごとの上書きを指定する_該当表のみ反映されること() {
        ingest.setFailurePolicy(BatchFailurePolicy.SKIP_BATCH);
        ingest.setTableFailurePolicies(Map.of("Relationships", BatchFailurePolicy.ABORT_TABLE));
        ingest.setSourceFiles(Map.of("officers", "officers-2024.csv"));
        ingest.setTables(List.of("officers", " relationships ", ""));
        ingest.setCheckpointMode(CheckpointMode.STRICT);
        connection.setSchema("PANAMA_PAPERS");

        LoadSettings settings = LoadSettings.from(paths, ingest, connection);

        assertEquals(BatchFailurePolicy.SKIP_BATCH,
                settings.failurePolicyFor(SourceTable.ENTITIES));
        assertEquals(BatchFailurePolicy.ABORT_TABLE,
                settings.failurePolicyFor(SourceTable.RELATIONSHIPS));
        assertEquals(new File("/data/icij", "officers-2024.csv"),
                settings.resolveSourceFile(SourceTable.OFFICERS));
        assertFalse(settings.isSelected(SourceTable.ENTITIES));
        assertTrue(settings.isSelected(SourceTable.OFFICERS));
        assertTrue(settings.isSelected(SourceTable.RELATIONSHIPS));
        assertEquals("PANAMA_PAPERS.officers", settings.qualify(SourceTable.OFFICERS));
        assertEquals(CheckpointMode.STRICT, settings.getCheckpointMode());
    }

    @Test
    void from_正常ケース_空白のみの表選択を指定する_全表が選択されること() {
        ingest.setTables(List.of(" ", ""));

        LoadSettings settings = LoadSettings.from(paths, ingest, connection);

        for (SourceTable table : SourceTable.values()) {
            assertTrue(settings.isSelected(table));
        }
    }

    @Test
    void from_異常ケース_バッチサイズ0を指定する_IllegalArgumentExceptionが送出されること() {
        ingest.setBatchSize(0);
        assertThrows(IllegalArgumentException.class,
                () -> LoadSettings.from(paths, ingest, connection));
    }

    @Test
    void from_異常ケース_未知の表名を指定する_IllegalArgumentExceptionが送出されること() {
        ingest.setTables(List.of("entities", "companies"));
        assertThrows(IllegalArgumentException.class,
                () -> LoadSettings.from(paths, ingest, connection));
    }

    @Test
    void from_異常ケース_不正なスキーマ名を指定する_IllegalArgumentExceptionが送出されること() {
        connection.setSchema("x; DROP TABLE entities");
        assertThrows(IllegalArgumentException.class,
                () -> LoadSettings.from(paths, ingest, connection));
    }

    @Test
    void from_異常ケース_dataPath未設定_IllegalStateExceptionが送出されること() {
        paths.setDataPath(null);
        assertThrows(IllegalStateException.class,
                () -> LoadSettings.from(paths, ingest, connection));
    }
}
