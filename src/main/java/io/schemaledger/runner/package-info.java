/**
 * Migration orchestration package.
 *
 * <p>{@link io.schemaledger.runner.MigrationRunner} owns batch numbering, per-migration transactions,
 * fail-fast halting, and the up/down/reset/refresh/status operations used by the CLI.
 */
package io.schemaledger.runner;
