/**
 * CSV source reading.
 *
 * <p>
 * Reads the ICIJ CSV files with Apache Commons CSV, normalizes header names (lower case, trimmed,
 * BOM removed) and resolves each destination column to the first present source alias once per
 * file.
 * </p>
 */
package io.github.yok.leaksloader.parser;
