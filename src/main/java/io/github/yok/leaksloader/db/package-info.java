/**
 * Database access package.
 *
 * <p>
 * Builds the single JDBC connection of a run: password fallback chain, Oracle wallet properties
 * and driver loading.
 * </p>
 */
package io.github.yok.leaksloader.db;
