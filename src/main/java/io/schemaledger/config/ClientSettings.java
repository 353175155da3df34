package io.schemaledger.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemaledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Effective connection, retry and ledger settings. Values come from {@code schemaledger-settings.json}
 * under the root directory; anything absent or out of range falls back to the defaults in
 * {@link SchemaLedgerConfig}.
 */
public record ClientSettings(
        String jdbcUrl,
        String username,
        String password,
        int maxRetries,
        long retryIntervalMs,
        long maxBackoffMs,
        long connectionTimeoutMs,
        String ledgerTable,
        String healthCheckTable,
        boolean useTransaction,
        Path migrationsDir
) {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}(\\.[A-Za-z_][A-Za-z0-9_]{0,62})?$");

    public ClientSettings {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be empty");
        }
        ledgerTable = requireIdentifier(ledgerTable, "ledgerTable");
        if (healthCheckTable != null && healthCheckTable.isBlank()) {
            healthCheckTable = null;
        }
        if (healthCheckTable != null) {
            healthCheckTable = requireIdentifier(healthCheckTable, "healthCheckTable");
        }
    }

    public static ClientSettings defaults(SchemaLedgerConfig config) {
        return new ClientSettings(
                config.defaultJdbcUrl(),
                null,
                null,
                SchemaLedgerConfig.DEFAULT_MAX_RETRIES,
                SchemaLedgerConfig.DEFAULT_RETRY_INTERVAL_MS,
                SchemaLedgerConfig.DEFAULT_MAX_BACKOFF_MS,
                SchemaLedgerConfig.DEFAULT_CONNECTION_TIMEOUT_MS,
                SchemaLedgerConfig.DEFAULT_LEDGER_TABLE,
                null,
                true,
                config.migrationsDir()
        );
    }

    public static ClientSettings load(SchemaLedgerConfig config) {
        ClientSettings defaults = defaults(config);
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults, config.rootDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static ClientSettings fromFile(SettingsFile file, ClientSettings defaults, Path rootDir) {
        if (file == null) {
            return defaults;
        }
        long retryInterval = sanitizeLong(file.retryIntervalMs(), defaults.retryIntervalMs(), 0L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), retryInterval);
        Path migrationsDir = file.migrationsDir() == null || file.migrationsDir().isBlank()
                ? defaults.migrationsDir()
                : rootDir.resolve(file.migrationsDir().trim()).normalize();
        return new ClientSettings(
                sanitizeText(file.jdbcUrl(), defaults.jdbcUrl()),
                sanitizeText(file.username(), defaults.username()),
                file.password() == null ? defaults.password() : file.password(),
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                retryInterval,
                maxBackoff,
                sanitizeLong(file.connectionTimeoutMs(), defaults.connectionTimeoutMs(), 1_000L),
                sanitizeText(file.ledgerTable(), defaults.ledgerTable()),
                sanitizeText(file.healthCheckTable(), defaults.healthCheckTable()),
                file.useTransaction() == null ? defaults.useTransaction() : file.useTransaction(),
                migrationsDir
        );
    }

    public ClientSettings withConnection(String jdbcUrl, String username, String password) {
        return new ClientSettings(
                jdbcUrl == null || jdbcUrl.isBlank() ? this.jdbcUrl : jdbcUrl.trim(),
                username == null ? this.username : username,
                password == null ? this.password : password,
                maxRetries,
                retryIntervalMs,
                maxBackoffMs,
                connectionTimeoutMs,
                ledgerTable,
                healthCheckTable,
                useTransaction,
                migrationsDir
        );
    }

    public ClientSettings withRetry(int maxRetries, long retryIntervalMs) {
        return new ClientSettings(
                jdbcUrl,
                username,
                password,
                Math.max(0, maxRetries),
                Math.max(0L, retryIntervalMs),
                Math.max(maxBackoffMs, retryIntervalMs),
                connectionTimeoutMs,
                ledgerTable,
                healthCheckTable,
                useTransaction,
                migrationsDir
        );
    }

    public ClientSettings withUseTransaction(boolean useTransaction) {
        return new ClientSettings(
                jdbcUrl,
                username,
                password,
                maxRetries,
                retryIntervalMs,
                maxBackoffMs,
                connectionTimeoutMs,
                ledgerTable,
                healthCheckTable,
                useTransaction,
                migrationsDir
        );
    }

    public int connectionTimeoutSeconds() {
        return (int) Math.max(1L, (connectionTimeoutMs + 999L) / 1_000L);
    }

    public JsonNode toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("jdbcUrl", jdbcUrl);
        view.put("username", username);
        view.put("password", password);
        view.put("maxRetries", maxRetries);
        view.put("retryIntervalMs", retryIntervalMs);
        view.put("maxBackoffMs", maxBackoffMs);
        view.put("connectionTimeoutMs", connectionTimeoutMs);
        view.put("ledgerTable", ledgerTable);
        view.put("healthCheckTable", healthCheckTable);
        view.put("useTransaction", useTransaction);
        view.put("migrationsDir", migrationsDir == null ? null : migrationsDir.toString());
        return Jsons.mapper().valueToTree(view);
    }

    private static String requireIdentifier(String raw, String field) {
        String value = raw == null ? "" : raw.trim();
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be a plain SQL identifier: " + raw);
        }
        return value;
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String jdbcUrl,
            String username,
            String password,
            Integer maxRetries,
            Long retryIntervalMs,
            Long maxBackoffMs,
            Long connectionTimeoutMs,
            String ledgerTable,
            String healthCheckTable,
            Boolean useTransaction,
            String migrationsDir
    ) {
    }
}
