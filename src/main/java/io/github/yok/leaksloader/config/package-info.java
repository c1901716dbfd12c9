/**
 * Configuration package.
 *
 * <p>
 * Holds the {@code @ConfigurationProperties} classes bound from {@code application.yml}
 * (paths, connection, ingestion and credential settings), the policy enums, and
 * {@link io.github.yok.leaksloader.config.LoadSettings}, the immutable settings object built once
 * per run and passed to every loader.
 * </p>
 */
package io.github.yok.leaksloader.config;
