package de.bsommerfeld.recall.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies {@code schema.sql}, repairs legacy rows and installs the FTS
 * synchronization triggers. Safe to run on every startup.
 *
 * <p>
 * Trigger bodies contain semicolons, so each trigger lives in its own
 * {@code sql/trigger-*.sql} file and is executed as a single statement, and
 * only when {@code sqlite_master} does not list it yet.
 */
final class SchemaBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaBootstrap.class);

    static final String SCHEMA_RESOURCE = "schema.sql";

    /** Trigger name to the {@code sql/} file that creates it. */
    static final Map<String, String> TRIGGERS = new LinkedHashMap<>();

    static {
        TRIGGERS.put("obs_fts_insert", "trigger-obs-fts-insert");
        TRIGGERS.put("obs_fts_delete", "trigger-obs-fts-delete");
        TRIGGERS.put("obs_fts_update", "trigger-obs-fts-update");
        TRIGGERS.put("prompt_fts_insert", "trigger-prompt-fts-insert");
        TRIGGERS.put("prompt_fts_delete", "trigger-prompt-fts-delete");
        TRIGGERS.put("prompt_fts_update", "trigger-prompt-fts-update");
    }

    private SchemaBootstrap() {
    }

    static void apply(Connection conn) throws SQLException {
        applySchema(conn);
        normalizeLegacyRows(conn);
        int created = createMissingTriggers(conn);
        LOG.info("Database schema applied ({} triggers created).", created);
    }

    /**
     * Splits a script on statement-terminating semicolons, i.e. a semicolon
     * followed by a line break or the end of input.
     */
    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        for (String sql : script.split(";\\s*(\\r?\\n|$)")) {
            if (!sql.trim().isEmpty()) {
                statements.add(sql.trim());
            }
        }
        return statements;
    }

    private static void applySchema(Connection conn) throws SQLException {
        List<String> statements = splitStatements(SqlLoader.readResource(SCHEMA_RESOURCE));
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    /** Best effort: a failing repair statement is logged and the next one runs. */
    private static void normalizeLegacyRows(Connection conn) {
        for (String sql : splitStatements(SqlLoader.load("normalize-legacy-rows"))) {
            try (Statement stmt = conn.createStatement()) {
                int changed = stmt.executeUpdate(sql);
                if (changed > 0) {
                    LOG.info("Normalized {} legacy rows: {}", changed, sql);
                }
            } catch (SQLException e) {
                LOG.warn("Legacy row normalization failed for [{}]: {}", sql, e.getMessage());
            }
        }
    }

    private static int createMissingTriggers(Connection conn) throws SQLException {
        int created = 0;
        for (Map.Entry<String, String> trigger : TRIGGERS.entrySet()) {
            if (triggerExists(conn, trigger.getKey())) {
                continue;
            }
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(SqlLoader.load(trigger.getValue()));
            }
            created++;
        }
        return created;
    }

    static boolean triggerExists(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-trigger"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
