package de.bsommerfeld.recall.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 * The naming convention is {@code sql/<operation>-<entity>.sql},
 * e.g. {@code insert-observation.sql}, {@code select-recent-prompts.sql}.
 * Statements with optional filters use numbered parameters ({@code ?1})
 * and treat an empty string as "no filter".
 *
 * @see SqlMemoryStore
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath,
     * trimmed and cached.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, n -> readResource("sql/" + n + ".sql"));
    }

    /** Reads a classpath resource by its full path without caching it. */
    static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
