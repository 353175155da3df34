package io.schemaledger.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaledger.config.ClientSettings;
import io.schemaledger.config.SchemaLedgerConfig;
import io.schemaledger.loader.MigrationScaffolder;
import io.schemaledger.model.MigrationBatchResult;
import io.schemaledger.model.MigrationRecord;
import io.schemaledger.model.MigrationStatusReport;
import io.schemaledger.observability.MigrationAuditLog;
import io.schemaledger.runner.MigrationRunner;
import io.schemaledger.runtime.SchemaLedgerRuntime;
import io.schemaledger.security.SensitiveDataMasker;
import io.schemaledger.storage.ExecutionClient;
import io.schemaledger.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "schemaledger",
        mixinStandardHelpOptions = true,
        description = "Batch-oriented schema migration CLI",
        subcommands = {
                SchemaLedgerCommand.UpCommand.class,
                SchemaLedgerCommand.DownCommand.class,
                SchemaLedgerCommand.ResetCommand.class,
                SchemaLedgerCommand.RefreshCommand.class,
                SchemaLedgerCommand.StatusCommand.class,
                SchemaLedgerCommand.CreateCommand.class,
                SchemaLedgerCommand.HistoryCommand.class,
                SchemaLedgerCommand.HealthCommand.class,
                SchemaLedgerCommand.SettingsCommand.class,
                SchemaLedgerCommand.AuditVerifyCommand.class,
                CommandLine.HelpCommand.class
        }
)
public final class SchemaLedgerCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (ledger db, migrations, audit)", defaultValue = "data")
    String root;

    @Option(names = {"--jdbc-url"}, description = "JDBC URL of the target database (overrides settings file)")
    String jdbcUrl;

    @Option(names = {"--user"}, description = "Database user (overrides settings file)")
    String user;

    @Option(names = {"--password"}, description = "Database password (overrides settings file)")
    String password;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    SchemaLedgerConfig config() {
        return SchemaLedgerConfig.fromRoot(root);
    }

    ClientSettings settings() {
        return ClientSettings.load(config()).withConnection(jdbcUrl, user, password);
    }

    SchemaLedgerRuntime runtime() {
        return new SchemaLedgerRuntime(config(), settings());
    }

    static int printBatch(MigrationBatchResult result) {
        System.out.println(Jsons.toJson(result));
        return result.hasFailures() ? 1 : 0;
    }

    @Command(name = "up", description = "Apply all pending migrations as one batch")
    static final class UpCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                return printBatch(runtime.runner().up());
            }
        }
    }

    @Command(name = "down", description = "Roll back the most recent batch")
    static final class DownCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                return printBatch(runtime.runner().down());
            }
        }
    }

    @Command(name = "reset", description = "Roll back every batch, newest first")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                List<MigrationBatchResult> results = runtime.runner().reset();
                System.out.println(Jsons.toJson(results));
                return results.stream().anyMatch(MigrationBatchResult::hasFailures) ? 1 : 0;
            }
        }
    }

    @Command(name = "refresh", description = "Roll back every batch and apply all migrations again")
    static final class RefreshCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                MigrationRunner.RefreshResult result = runtime.runner().refresh();
                System.out.println(Jsons.toJson(result));
                return result.hasFailures() ? 1 : 0;
            }
        }
    }

    @Command(name = "status", description = "Show applied/pending counts and ledger rows without a registered migration")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                MigrationStatusReport report = runtime.runner().status();
                System.out.println(Jsons.toJson(report));
                return 0;
            }
        }
    }

    @Command(name = "create", description = "Scaffold a timestamped up/down SQL pair")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Parameters(index = "0", description = "Migration description, e.g. create_users")
        String name;

        @Override
        public Integer call() {
            MigrationScaffolder scaffolder = new MigrationScaffolder(parent.settings().migrationsDir());
            System.out.println(Jsons.toJson(scaffolder.create(name)));
            return 0;
        }
    }

    @Command(name = "history", description = "List ledger rows, most recent first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                List<MigrationRecord> rows = runtime.ledger().exists()
                        ? new ArrayList<>(runtime.ledger().getApplied())
                        : new ArrayList<>();
                Collections.reverse(rows);
                int safeLimit = Math.max(1, limit);
                System.out.println(Jsons.toJson(rows.subList(0, Math.min(safeLimit, rows.size()))));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Probe the database connection")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            try (SchemaLedgerRuntime runtime = parent.runtime()) {
                ExecutionClient client = runtime.client();
                boolean healthy = client.healthCheck();
                ObjectNode out = Jsons.mapper().createObjectNode();
                out.put("healthy", healthy);
                out.put("status", client.status().name());
                out.put("lastError", client.lastError() == null
                        ? null
                        : SensitiveDataMasker.maskText(client.lastError().getMessage()));
                System.out.println(Jsons.toJson(out));
                return healthy ? 0 : 1;
            }
        }
    }

    @Command(name = "settings", description = "Print effective settings with credentials masked")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(SensitiveDataMasker.masked(parent.settings().toView())));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SchemaLedgerCommand parent;

        @Override
        public Integer call() {
            MigrationAuditLog auditLog = new MigrationAuditLog(parent.config().auditFile(), null);
            MigrationAuditLog.VerifyOutcome out = auditLog.verify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }
}
