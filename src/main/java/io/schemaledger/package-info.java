/**
 * SchemaLedger source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.schemaledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.schemaledger.cli.SchemaLedgerCommand} maps commands to runner operations.</li>
 *   <li>{@code io.schemaledger.runner.MigrationRunner} applies and rolls back batches.</li>
 *   <li>{@code io.schemaledger.storage.MigrationLedger} is the authoritative record of what was applied.</li>
 * </ul>
 */
package io.schemaledger;
