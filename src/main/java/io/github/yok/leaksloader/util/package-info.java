/**
 * Utility package.
 *
 * <p>
 * Provides the stateless field normalization rules applied to every CSV cell (date parsing,
 * width truncation, missing-value coercion) and the fatal-error reporting helper used by the CLI.
 * </p>
 */
package io.github.yok.leaksloader.util;
