/**
 * Root package of the Offshore Leaks loader.
 *
 * <p>
 * Provides a CLI that bulk-loads the ICIJ Offshore Leaks CSV files (entities, officers,
 * intermediaries, addresses and relationships) into pre-existing relational tables.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.leaksloader.config}: configuration models and run settings</li>
 * <li>{@code io.github.yok.leaksloader.core}: table loaders, batch writing, checkpointing and
 * orchestration</li>
 * <li>{@code io.github.yok.leaksloader.db}: JDBC connection and credential resolution</li>
 * <li>{@code io.github.yok.leaksloader.model}: typed destination records and column
 * definitions</li>
 * <li>{@code io.github.yok.leaksloader.parser}: CSV source reading and header alias
 * resolution</li>
 * </ul>
 */
package io.github.yok.leaksloader;
