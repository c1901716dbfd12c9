/**
 * Ingestion core.
 *
 * <p>
 * {@link io.github.yok.leaksloader.core.IngestionOrchestrator} runs the five
 * {@link io.github.yok.leaksloader.core.TableLoader table loaders} in dependency order over one
 * connection, asking the {@link io.github.yok.leaksloader.core.CheckpointGuard} whether each
 * table still needs loading. Loaders stream the source file and hand fixed-size batches to a
 * {@link io.github.yok.leaksloader.core.BatchWriter}, which commits each batch as a unit.
 * </p>
 */
package io.github.yok.leaksloader.core;
