package io.github.yok.leaksloader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the password fallback chain, bound from the {@code credentials} section.
 *
 * <p>
 * Only the fixed low-privilege loader identity ({@link #loaderUser}) has a default password; any
 * other user must supply one explicitly or through {@link #adminPasswordEnv}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "credentials")
@Data
public class CredentialsConfig {

    // Low-privilege schema owner created by the database setup scripts
    private String loaderUser = "PANAMA_PAPERS";

    // Password the setup scripts assign to loaderUser
    private String loaderPassword;

    // Environment variable (and .env key) holding the password for any other user
    private String adminPasswordEnv = "ADB_ADMIN_PASSWORD";

    // .env file consulted when the environment variable is not set
    private String envFile = ".env";

    // File inside the wallet directory that holds the wallet password
    private String walletPasswordFile = "wallet_password.txt";
}
