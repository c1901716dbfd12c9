package io.github.yok.leaksloader.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.leaksloader.config.CredentialsConfig;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CredentialResolverTest {

    @TempDir
    Path tempDir;

    private CredentialsConfig config;

    @BeforeEach
    void setup() {
        config = new CredentialsConfig();
        config.setLoaderPassword("PanamaPapers2024!");
        config.setEnvFile(tempDir.resolve(".env").toString());
    }

    @Test
    void resolvePassword_正常ケース_明示パスワードあり_明示値が最優先されること() {
        CredentialResolver resolver = new CredentialResolver(config, key -> "from-env");
        assertEquals("explicit", resolver.resolvePassword("PANAMA_PAPERS", "explicit"));
    }

    @Test
    void resolvePassword_正常ケース_ローダーユーザー_既定パスワードが返ること() {
        CredentialResolver resolver = new CredentialResolver(config, key -> "from-env");
        assertEquals("PanamaPapers2024!", resolver.resolvePassword("panama_papers", null));
    }

    @Test
    void resolvePassword_正常ケース_他ユーザーで環境変数あり_環境変数の値が返ること() {
        CredentialResolver resolver =
                new CredentialResolver(config, Map.of("ADB_ADMIN_PASSWORD", "admin-secret")::get);
        assertEquals("admin-secret", resolver.resolvePassword("ADMIN", ""));
    }

    @Test
    void resolvePassword_正常ケース_他ユーザーでenvファイルのみ_引用符を除いた値が返ること() throws Exception {
        Files.writeString(tempDir.resolve(".env"),
                "OTHER=1\nADB_ADMIN_PASSWORD=\"quoted-secret\"\n", StandardCharsets.UTF_8);
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        assertEquals("quoted-secret", resolver.resolvePassword("ADMIN", null));
    }

    @Test
    void resolvePassword_異常ケース_どこにもパスワードが無い_IllegalStateExceptionが送出されること() {
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> resolver.resolvePassword("ADMIN", null));
        assertTrue(ex.getMessage().contains("ADMIN"));
    }

    @Test
    void resolvePassword_異常ケース_既定パスワード未設定のローダーユーザー_IllegalStateExceptionが送出されること() {
        config.setLoaderPassword(null);
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        assertThrows(IllegalStateException.class,
                () -> resolver.resolvePassword("PANAMA_PAPERS", null));
    }

    @Test
    void readEnvFile_正常ケース_ファイルもキーも無い_nullが返ること() throws Exception {
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        assertNull(resolver.readEnvFile(tempDir.resolve("none.env"), "ADB_ADMIN_PASSWORD"));
        Path env = tempDir.resolve("other.env");
        Files.writeString(env, "FOO='bar'\n", StandardCharsets.UTF_8);
        assertNull(resolver.readEnvFile(env, "ADB_ADMIN_PASSWORD"));
        assertEquals("bar", resolver.readEnvFile(env, "FOO"));
    }

    @Test
    void resolveWalletPassword_正常ケース_ファイルあり_前後空白を除いた値が返ること() throws Exception {
        Files.writeString(tempDir.resolve("wallet_password.txt"), "  w4llet\n",
                StandardCharsets.UTF_8);
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        assertEquals("w4llet", resolver.resolveWalletPassword(tempDir.toFile()));
    }

    @Test
    void resolveWalletPassword_異常ケース_ファイルなし_IllegalStateExceptionが送出されること() {
        CredentialResolver resolver = new CredentialResolver(config, key -> null);
        File walletDir = tempDir.toFile();
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> resolver.resolveWalletPassword(walletDir));
        assertTrue(ex.getMessage().contains("wallet_password.txt"));
    }
}
