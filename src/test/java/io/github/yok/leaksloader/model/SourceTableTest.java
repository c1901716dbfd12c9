package io.github.yok.leaksloader.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class SourceTableTest {

    @Test
    void values_正常ケース_定義順を確認する_ノード表の後にリレーションシップが並ぶこと() {
        assertArrayEquals(new SourceTable[] {SourceTable.ENTITIES, SourceTable.OFFICERS,
                SourceTable.INTERMEDIARIES, SourceTable.ADDRESSES, SourceTable.RELATIONSHIPS},
                SourceTable.values());
    }

    @Test
    void fromName_正常ケース_大文字と空白を含む名前を指定する_該当する表が返ること() {
        assertEquals(SourceTable.OFFICERS, SourceTable.fromName(" Officers "));
        assertEquals("nodes-officers.csv", SourceTable.OFFICERS.getDefaultFileName());
    }

    @Test
    void fromName_異常ケース_未知の名前を指定する_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> SourceTable.fromName("nodes"));
        assertEquals(true, ex.getMessage().contains("Unknown table: nodes"));
        assertThrows(IllegalArgumentException.class, () -> SourceTable.fromName(null));
    }
}
