package io.github.yok.leaksloader.config;

import java.io.File;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration.
 *
 * <p>
 * The {@code data-path} must point to the directory holding the ICIJ CSV files
 * ({@code nodes-entities.csv}, {@code relationships.csv}, ...). It can be overridden on the
 * command line with {@code --data-dir}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Directory that contains the source CSV files
    private String dataPath;

    /**
     * Returns the source directory.
     *
     * @return the directory holding the CSV files
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public File getSourceDir() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Set 'data-path' in application.yml or pass --data-dir.");
        }
        return new File(dataPath);
    }
}
