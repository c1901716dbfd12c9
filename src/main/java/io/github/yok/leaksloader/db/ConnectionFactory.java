package io.github.yok.leaksloader.db;

import io.github.yok.leaksloader.config.ConnectionConfig;
import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens the JDBC connection of an ingestion run.
 *
 * <p>
 * With an explicit {@code connection.url} the URL is used as is. Otherwise an Oracle thin URL is
 * built from the TNS service name; when a wallet directory is configured it becomes the
 * {@code TNS_ADMIN} of the URL and the wallet location/password are passed as connection
 * properties.
 * </p>
 *
 * <p>
 * Credentials are resolved before any connection attempt, so a missing password fails the run
 * before a table is touched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionFactory {

    static final String WALLET_LOCATION_PROPERTY = "oracle.net.wallet_location";

    static final String WALLET_PASSWORD_PROPERTY = "oracle.net.wallet_password";

    private final ConnectionConfig config;

    private final CredentialResolver credentialResolver;

    /**
     * Creates a factory.
     *
     * @param config connection settings
     * @param credentialResolver password resolution chain
     */
    public ConnectionFactory(ConnectionConfig config, CredentialResolver credentialResolver) {
        this.config = config;
        this.credentialResolver = credentialResolver;
    }

    /**
     * Opens a new connection. The caller owns and closes it.
     *
     * @return open connection
     * @throws SQLException if the driver cannot connect
     * @throws IllegalStateException if the settings or credentials are incomplete, or the driver
     *         class cannot be loaded
     */
    public Connection open() throws SQLException {
        String url = resolveUrl();
        Properties props = buildProperties();
        loadDriver(config.getDriverClass());

        log.info("Connecting to database: {} (user={})", url, config.getUser());
        Connection connection = DriverManager.getConnection(url, props);
        log.info("Connected.");
        return connection;
    }

    /**
     * Resolves the JDBC URL.
     *
     * @return explicit URL, or an Oracle thin URL for the service
     * @throws IllegalStateException if neither a URL nor a service is configured
     */
    String resolveUrl() {
        if (StringUtils.isNotBlank(config.getUrl())) {
            return config.getUrl().trim();
        }
        if (StringUtils.isBlank(config.getService())) {
            throw new IllegalStateException(
                    "No destination configured. Set connection.url or connection.service (--service).");
        }
        String url = "jdbc:oracle:thin:@" + config.getService().trim();
        if (StringUtils.isNotBlank(config.getWalletDir())) {
            url += "?TNS_ADMIN=" + walletDir().getAbsolutePath();
        }
        return url;
    }

    /**
     * Builds the connection properties: user, password and, with a wallet, the wallet location
     * and password.
     *
     * @return connection properties
     * @throws IllegalStateException if the user, password or wallet password is missing
     */
    Properties buildProperties() {
        String user = config.getUser();
        if (StringUtils.isBlank(user)) {
            throw new IllegalStateException("connection.user is not configured.");
        }
        Properties props = new Properties();
        props.setProperty("user", user);
        props.setProperty("password", credentialResolver.resolvePassword(user, config.getPassword()));

        if (StringUtils.isNotBlank(config.getWalletDir())) {
            File walletDir = walletDir();
            if (!walletDir.isDirectory()) {
                throw new IllegalStateException("Wallet directory not found: " + walletDir);
            }
            props.setProperty(WALLET_LOCATION_PROPERTY, walletDir.getAbsolutePath());
            props.setProperty(WALLET_PASSWORD_PROPERTY,
                    credentialResolver.resolveWalletPassword(walletDir));
        }
        return props;
    }

    private File walletDir() {
        return new File(config.getWalletDir().trim());
    }

    private static void loadDriver(String driverClass) {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass.trim());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
