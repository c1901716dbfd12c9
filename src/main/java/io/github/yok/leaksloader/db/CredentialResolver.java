package io.github.yok.leaksloader.db;

import io.github.yok.leaksloader.config.CredentialsConfig;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the database and wallet passwords.
 *
 * <p>
 * Database password chain, first non-blank value wins:
 * </p>
 * <ol>
 * <li>the explicitly supplied password ({@code --password} / {@code connection.password})</li>
 * <li>the configured default password, only when the user is the loader identity</li>
 * <li>the environment variable named by {@code credentials.admin-password-env}</li>
 * <li>the same key in the {@code .env} file</li>
 * </ol>
 *
 * <p>
 * Nothing is resolved for a user other than the loader identity without an explicit or
 * environment-provided secret.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CredentialResolver {

    private final CredentialsConfig config;

    // Environment lookup (System::getenv outside tests)
    private final UnaryOperator<String> environment;

    /**
     * Creates a resolver reading the process environment.
     *
     * @param config credential settings
     */
    public CredentialResolver(CredentialsConfig config) {
        this(config, System::getenv);
    }

    /**
     * Creates a resolver with a custom environment lookup.
     *
     * @param config credential settings
     * @param environment environment variable lookup
     */
    CredentialResolver(CredentialsConfig config, UnaryOperator<String> environment) {
        this.config = config;
        this.environment = environment;
    }

    /**
     * Resolves the database password for the user.
     *
     * @param user database user
     * @param explicitPassword password given on the command line or in configuration, may be
     *        {@code null}
     * @return resolved password
     * @throws IllegalStateException if no source provides a password
     */
    public String resolvePassword(String user, String explicitPassword) {
        if (StringUtils.isNotEmpty(explicitPassword)) {
            log.debug("Using explicitly supplied password for user {}", user);
            return explicitPassword;
        }

        if (StringUtils.equalsIgnoreCase(user, config.getLoaderUser())
                && StringUtils.isNotEmpty(config.getLoaderPassword())) {
            log.debug("Using default password of loader identity {}", user);
            return config.getLoaderPassword();
        }

        String key = config.getAdminPasswordEnv();
        String fromEnv = environment.apply(key);
        if (StringUtils.isNotEmpty(fromEnv)) {
            log.debug("Using password from environment variable {}", key);
            return fromEnv;
        }

        String fromFile = readEnvFile(Paths.get(config.getEnvFile()), key);
        if (StringUtils.isNotEmpty(fromFile)) {
            log.debug("Using password from {} ({})", config.getEnvFile(), key);
            return fromFile;
        }

        throw new IllegalStateException("No password provided for user " + user
                + ". Use --password or set " + key + ".");
    }

    /**
     * Reads the wallet password from the password file inside the wallet directory.
     *
     * @param walletDir Oracle wallet directory
     * @return wallet password (trimmed)
     * @throws IllegalStateException if the file is missing or unreadable
     */
    public String resolveWalletPassword(File walletDir) {
        Path file = walletDir.toPath().resolve(config.getWalletPasswordFile());
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Wallet password file not found: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read wallet password file: " + file, e);
        }
    }

    /**
     * Looks up {@code key=value} in a dotenv file; surrounding quotes of the value are removed.
     *
     * @param envFile path of the file
     * @param key key to find
     * @return value, or {@code null} if the file or key does not exist
     */
    String readEnvFile(Path envFile, String key) {
        if (!Files.isRegularFile(envFile)) {
            return null;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", envFile, e.getMessage());
            return null;
        }
        String prefix = key + "=";
        for (String line : lines) {
            if (line.startsWith(prefix)) {
                String value = line.substring(prefix.length()).trim();
                return StringUtils.strip(value, "\"'");
            }
        }
        return null;
    }
}
