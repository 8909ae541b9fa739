package com.tabledesigner.config;

import com.tabledesigner.service.AlterationMode;
import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * Immutable settings resolved from Spring properties, falling back to environment variables.
 *
 * @param databasePath SQLite file holding the live tables
 * @param designStorePath SQLite file holding design records
 * @param alterationMode how field removal and field changes are applied
 * @param preserveRows whether rebuilds copy surviving columns into the new table
 * @param maxRows cap on rows returned by ad-hoc queries, 0 for no cap
 * @param poolMaxSize maximum connections per pool
 * @param busyTimeoutMs SQLite busy timeout
 */
public record DesignerSettings(
        String databasePath,
        String designStorePath,
        AlterationMode alterationMode,
        boolean preserveRows,
        int maxRows,
        int poolMaxSize,
        int busyTimeoutMs
) {
    static final String DEFAULT_DATABASE_PATH = "database_designer.db";
    static final String DEFAULT_DESIGN_STORE_PATH = "design_storage.db";
    static final int DEFAULT_MAX_ROWS = 1000;
    static final int DEFAULT_POOL_MAX_SIZE = 4;
    static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    public static DesignerSettings defaults(String databasePath, String designStorePath) {
        return new DesignerSettings(databasePath, designStorePath, AlterationMode.REBUILD, false,
                DEFAULT_MAX_ROWS, DEFAULT_POOL_MAX_SIZE, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public DesignerSettings withAlteration(AlterationMode mode, boolean preserve) {
        return new DesignerSettings(databasePath, designStorePath, mode, preserve, maxRows, poolMaxSize, busyTimeoutMs);
    }

    public static DesignerSettings fromEnvironment(Environment environment) {
        String databasePath = getTrimmed(environment, "tabledesigner.database.path", "TABLEDESIGNER_DATABASE_PATH");
        if (databasePath == null || databasePath.isBlank()) {
            databasePath = DEFAULT_DATABASE_PATH;
        }
        String designStorePath = getTrimmed(environment, "tabledesigner.design-store.path", "TABLEDESIGNER_DESIGN_STORE_PATH");
        if (designStorePath == null || designStorePath.isBlank()) {
            designStorePath = DEFAULT_DESIGN_STORE_PATH;
        }
        String modeRaw = getTrimmed(environment, "tabledesigner.sync.mode", "TABLEDESIGNER_SYNC_MODE");
        AlterationMode mode;
        try {
            mode = AlterationMode.parse(modeRaw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tabledesigner.sync.mode: " + modeRaw + " (expected rebuild or in_place)", e);
        }

        return new DesignerSettings(
                databasePath,
                designStorePath,
                mode,
                getBool(environment, "tabledesigner.sync.preserve-rows", "TABLEDESIGNER_SYNC_PRESERVE_ROWS", false),
                getInt(environment, "tabledesigner.execute.max-rows", "TABLEDESIGNER_EXECUTE_MAX_ROWS", DEFAULT_MAX_ROWS),
                getInt(environment, "tabledesigner.pool.max-size", "TABLEDESIGNER_POOL_MAX_SIZE", DEFAULT_POOL_MAX_SIZE),
                getInt(environment, "tabledesigner.pool.busy-timeout-ms", "TABLEDESIGNER_POOL_BUSY_TIMEOUT_MS", DEFAULT_BUSY_TIMEOUT_MS)
        );
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null && propKey != null) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && environment != null && envKey != null) {
            v = environment.getProperty(envKey);
        }
        return v != null ? v.trim() : null;
    }

    private static boolean getBool(Environment environment, String propKey, String envKey, boolean defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        String s = v.toLowerCase(Locale.ROOT);
        if ("true".equals(s) || "1".equals(s) || "yes".equals(s) || "y".equals(s)) {
            return true;
        }
        if ("false".equals(s) || "0".equals(s) || "no".equals(s) || "n".equals(s)) {
            return false;
        }
        return defaultValue;
    }

    private static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ignored) {
            // Keep default
            return defaultValue;
        }
    }
}
