/**
 * Destination record types.
 *
 * <p>
 * One immutable record class per destination table. Each class declares its ordered column list
 * ({@link io.github.yok.leaksloader.model.ColumnSpec}) which drives both source alias resolution
 * and the parameter order of the insert statement.
 * </p>
 */
package io.github.yok.leaksloader.model;
