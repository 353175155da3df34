package io.schemaledger;

import io.schemaledger.cli.SchemaLedgerCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SchemaLedgerCommand()).execute(args);
        System.exit(code);
    }
}
