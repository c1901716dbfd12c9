package io.github.yok.leaksloader.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import io.github.yok.leaksloader.config.ConnectionConfig;
import io.github.yok.leaksloader.config.CredentialsConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedStatic;

class ConnectionFactoryTest {

    @TempDir
    Path tempDir;

    private ConnectionConfig config;
    private CredentialResolver resolver;

    @BeforeEach
    void setup() {
        config = new ConnectionConfig();
        CredentialsConfig credentials = new CredentialsConfig();
        credentials.setLoaderPassword("PanamaPapers2024!");
        resolver = new CredentialResolver(credentials, key -> null);
    }

    @Test
    void resolveUrl_正常ケース_URL指定あり_そのまま使用されること() {
        config.setUrl(" jdbc:h2:mem:x ");
        config.setService("ignored_low");
        assertEquals("jdbc:h2:mem:x", new ConnectionFactory(config, resolver).resolveUrl());
    }

    @Test
    void resolveUrl_正常ケース_サービスとウォレット_TNS_ADMIN付きURLが組み立てられること() {
        config.setService("panamapoc_low");
        config.setWalletDir(tempDir.toString());
        assertEquals("jdbc:oracle:thin:@panamapoc_low?TNS_ADMIN="
                + tempDir.toFile().getAbsolutePath(),
                new ConnectionFactory(config, resolver).resolveUrl());
    }

    @Test
    void resolveUrl_正常ケース_サービスのみ_ウォレット無しのURLとなること() {
        config.setService("orclpdb");
        assertEquals("jdbc:oracle:thin:@orclpdb",
                new ConnectionFactory(config, resolver).resolveUrl());
    }

    @Test
    void resolveUrl_異常ケース_URLもサービスも無い_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class,
                () -> new ConnectionFactory(config, resolver).resolveUrl());
    }

    @Test
    void buildProperties_正常ケース_ウォレットあり_ウォレット関連プロパティが設定されること() throws Exception {
        Files.writeString(tempDir.resolve("wallet_password.txt"), "w4llet", StandardCharsets.UTF_8);
        config.setWalletDir(tempDir.toString());

        Properties props = new ConnectionFactory(config, resolver).buildProperties();

        assertEquals("PANAMA_PAPERS", props.getProperty("user"));
        assertEquals("PanamaPapers2024!", props.getProperty("password"));
        assertEquals(tempDir.toFile().getAbsolutePath(),
                props.getProperty(ConnectionFactory.WALLET_LOCATION_PROPERTY));
        assertEquals("w4llet", props.getProperty(ConnectionFactory.WALLET_PASSWORD_PROPERTY));
    }

    @Test
    void buildProperties_正常ケース_ウォレット無し_ユーザーとパスワードのみとなること() {
        config.setPassword("explicit");
        Properties props = new ConnectionFactory(config, resolver).buildProperties();
        assertEquals("explicit", props.getProperty("password"));
        assertFalse(props.containsKey(ConnectionFactory.WALLET_LOCATION_PROPERTY));
    }

    @Test
    void buildProperties_異常ケース_ウォレットパスワードファイルなし_IllegalStateExceptionが送出されること() {
        config.setWalletDir(tempDir.toString());
        assertThrows(IllegalStateException.class,
                () -> new ConnectionFactory(config, resolver).buildProperties());
    }

    @Test
    void buildProperties_異常ケース_ウォレットディレクトリなし_IllegalStateExceptionが送出されること() {
        config.setWalletDir(tempDir.resolve("nowhere").toString());
        assertThrows(IllegalStateException.class,
                () -> new ConnectionFactory(config, resolver).buildProperties());
    }

    @Test
    void open_正常ケース_H2へ接続する_接続が返ること() throws Exception {
        config.setUrl("jdbc:h2:mem:connection_factory_test");
        config.setDriverClass("org.h2.Driver");
        config.setUser("sa");
        config.setPassword("sa");

        try (Connection conn = new ConnectionFactory(config, resolver).open()) {
            assertTrue(conn.isValid(1));
        }
    }

    @Test
    void open_異常ケース_ドライバクラスなし_接続前にIllegalStateExceptionが送出されること() {
        config.setUrl("jdbc:none:x");
        config.setDriverClass("com.example.NoSuchDriver");
        config.setPassword("pw");

        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            assertThrows(IllegalStateException.class,
                    () -> new ConnectionFactory(config, resolver).open());
            dm.verify(() -> DriverManager.getConnection(any(String.class), any(Properties.class)),
                    never());
        }
    }

    @Test
    void open_異常ケース_パスワード解決不可_接続前にIllegalStateExceptionが送出されること() {
        config.setUrl("jdbc:h2:mem:never");
        config.setUser("ADMIN");
        ConnectionFactory factory = new ConnectionFactory(config,
                new CredentialResolver(new CredentialsConfig(), key -> null) {
                    @Override
                    String readEnvFile(Path envFile, String key) {
                        return null;
                    }
                });

        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            assertThrows(IllegalStateException.class, factory::open);
            dm.verify(() -> DriverManager.getConnection(any(String.class), any(Properties.class)),
                    never());
        }
    }

    @Test
    void open_正常ケース_ドライバクラス空_DriverManagerへ委譲されること() throws Exception {
        config.setUrl("jdbc:mock:x");
        config.setDriverClass("");
        config.setPassword("pw");
        Connection conn = mock(Connection.class);

        try (MockedStatic<DriverManager> dm = mockStatic(DriverManager.class)) {
            dm.when(() -> DriverManager.getConnection(any(String.class), any(Properties.class)))
                    .thenReturn(conn);
            assertEquals(conn, new ConnectionFactory(config, resolver).open());
        }
    }
}
