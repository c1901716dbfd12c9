package io.github.yok.leaksloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages the destination connection settings loaded from the
 * {@code connection} section of {@code application.yml}.
 *
 * <pre>
 * connection:
 *   service: panamapoc_low
 *   wallet-dir: /opt/wallet
 *   user: PANAMA_PAPERS
 *   driver-class: oracle.jdbc.OracleDriver
 * </pre>
 *
 * <p>
 * When {@code url} is set it is used as is; otherwise an Oracle thin URL is built from
 * {@code service} and {@code walletDir}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // Explicit JDBC URL (optional; overrides service/wallet URL construction)
    private String url;

    // TNS service name (e.g. panamapoc_low)
    private String service;

    // Directory holding the Oracle wallet, tnsnames.ora and wallet_password.txt
    private String walletDir;

    // Database user name
    private String user = "PANAMA_PAPERS";

    // Database password (optional; see CredentialResolver for the fallback chain)
    private String password;

    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass = "oracle.jdbc.OracleDriver";

    // Schema used to qualify the destination table names (optional)
    private String schema;
}
