package io.github.yok.leaksloader.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ErrorHandler> constructor = ErrorHandler.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        ErrorHandler instance = constructor.newInstance();
        assertEquals(ErrorHandler.class, instance.getClass());
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom2"));
            assertEquals("boom2", ex2.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ根本原因が出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err));
            code = ErrorHandler.errorAndExit("Table [entities] load failed",
                    new IllegalStateException("wrapped", new SQLException("ORA-12899")));
        } finally {
            System.setErr(originalErr);
        }
        assertEquals(ErrorHandler.FATAL_EXIT_CODE, code);
        String message = err.toString();
        assertTrue(message.contains("ERROR: Table [entities] load failed"));
        assertTrue(message.contains("ORA-12899"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でメッセージのみを指定する_終了コード1が返ること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(err));
            code = ErrorHandler.errorAndExit("boom2");
        } finally {
            System.setErr(originalErr);
        }
        assertEquals(1, code);
        assertTrue(err.toString().contains("ERROR: boom2"));
    }
}
