package de.bsommerfeld.recall.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.recall.core.config.MemoryConfig;
import de.bsommerfeld.recall.core.domain.AddRelation;
import de.bsommerfeld.recall.core.domain.CompactRequest;
import de.bsommerfeld.recall.core.domain.CompactResult;
import de.bsommerfeld.recall.core.domain.ContextResult;
import de.bsommerfeld.recall.core.domain.CreateObservation;
import de.bsommerfeld.recall.core.domain.ExportData;
import de.bsommerfeld.recall.core.domain.ImportResult;
import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.PassiveCaptureRequest;
import de.bsommerfeld.recall.core.domain.PassiveCaptureResult;
import de.bsommerfeld.recall.core.domain.Prompt;
import de.bsommerfeld.recall.core.domain.Relation;
import de.bsommerfeld.recall.core.domain.Scope;
import de.bsommerfeld.recall.core.domain.SearchOptions;
import de.bsommerfeld.recall.core.domain.SearchResult;
import de.bsommerfeld.recall.core.domain.Session;
import de.bsommerfeld.recall.core.domain.SessionSummary;
import de.bsommerfeld.recall.core.domain.Stats;
import de.bsommerfeld.recall.core.domain.TimelineResult;
import de.bsommerfeld.recall.core.domain.UpdateObservation;
import de.bsommerfeld.recall.core.error.ErrorKind;
import de.bsommerfeld.recall.core.error.MemoryException;
import de.bsommerfeld.recall.core.text.FtsQuery;
import de.bsommerfeld.recall.core.text.LearningExtractor;
import de.bsommerfeld.recall.core.text.TextNormalizer;
import de.bsommerfeld.recall.core.util.StorageUtils;
import de.bsommerfeld.recall.core.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import static de.bsommerfeld.recall.core.text.TextNormalizer.nullIfEmpty;

/**
 * SQLite-backed {@link MemoryStore}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * {@link SchemaBootstrap} applies {@code schema.sql} on every startup; every
 * DDL statement uses {@code IF NOT EXISTS} so it is safe to re-run. The FTS5
 * shadow tables are kept in sync by triggers, so nothing here re-indexes.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. Each connection enables foreign keys (relations cascade on hard
 * delete), WAL journaling and a busy timeout, so concurrent writers wait up to
 * {@code busy-timeout-millis} before the call fails with {@code UNAVAILABLE}.
 *
 * <h3>Transaction boundaries</h3>
 * Creation (lookup plus write), updates, relation inserts, import and
 * compaction run in explicit transactions with rollback-on-failure. They
 * begin {@code IMMEDIATE}, taking the write lock up front, so a competing
 * writer waits out the busy timeout instead of failing on a stale snapshot.
 * Single-statement reads use auto-commit.
 *
 * <h3>Time</h3>
 * Every timestamp comes from the injected {@link Clock} and is bound as a
 * parameter, formatted by {@link Timestamps}.
 *
 * @see SqlLoader
 * @see ContextTraversal
 */
@Singleton
public class SqlMemoryStore implements MemoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlMemoryStore.class);

    static final int DEFAULT_SEARCH_LIMIT = 10;
    static final int DEFAULT_SESSION_LIMIT = 5;
    static final int DEFAULT_PROMPT_LIMIT = 20;
    static final int DEFAULT_TIMELINE_WINDOW = 5;
    static final int DEFAULT_STALE_LIMIT = 200;
    static final int PASSIVE_TITLE_LENGTH = 60;

    static final String PASSIVE_TYPE = "passive";
    static final String COMPACTION_SUMMARY_TYPE = "compaction_summary";

    private final MemoryConfig config;
    private final Clock clock;
    private final String dbUrl;
    private final Properties connectionProperties;

    @Inject
    public SqlMemoryStore(MemoryConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        Path dbFile = config.databasePath().toAbsolutePath();
        try {
            StorageUtils.ensureDirectory(dbFile.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create data directory " + dbFile.getParent(), e);
        }
        this.dbUrl = "jdbc:sqlite:" + dbFile;

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setBusyTimeout(config.getBusyTimeoutMillis());
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();

        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initialize() {
        LOG.info("Initializing memory database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            SchemaBootstrap.apply(conn);
        } catch (SQLException e) {
            throw SqlErrors.translate("initialize database", e);
        }
    }

    // =====================================================================
    // Sessions
    // =====================================================================

    @Override
    public void startSession(String id, String project, String directory) {
        requireText(id, "session id");
        int inserted = withConnection("start session",
                conn -> update(conn, "insert-session", id, emptyIfNull(project), emptyIfNull(directory), now()));
        if (inserted == 0) {
            LOG.debug("Session {} already exists, keeping original", id);
        }
    }

    @Override
    public void endSession(String id, String summary) {
        int updated = withConnection("end session",
                conn -> update(conn, "end-session", now(), nullIfEmpty(summary), id));
        if (updated == 0) {
            throw MemoryException.notFound("session " + id + " not found");
        }
    }

    @Override
    public Optional<Session> getSession(String id) {
        return withConnection("get session", conn -> queryOne(conn, "select-session", SqlMemoryStore::mapSession, id));
    }

    @Override
    public List<SessionSummary> recentSessions(String project, int limit) {
        int effective = limit <= 0 ? DEFAULT_SESSION_LIMIT : limit;
        return withConnection("recent sessions", conn -> query(conn, "select-recent-sessions",
                rs -> new SessionSummary(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        rs.getString(5), rs.getInt(6)),
                emptyIfNull(project), effective));
    }

    // =====================================================================
    // Observations
    // =====================================================================

    @Override
    public long createObservation(CreateObservation request) {
        requireText(request.sessionId(), "session id");
        requireText(request.type(), "type");

        String type = request.type();
        String title = TextNormalizer.redactPrivate(request.title());
        String content = TextNormalizer.cleanContent(request.content(), config.getMaxObservationLength());
        Scope scope = Scope.parse(request.scope());
        String hash = TextNormalizer.contentHash(content);
        String topicKey = TextNormalizer.normalizeTopicKey(request.topicKey());
        String project = nullIfEmpty(request.project());
        String toolName = nullIfEmpty(request.toolName());
        String now = now();

        return inTransaction("create observation", conn -> {
            if (!topicKey.isEmpty()) {
                Optional<Long> existing = queryOne(conn, "select-topic-match", rs -> rs.getLong(1),
                        topicKey, project, scope.wire());
                if (existing.isPresent()) {
                    update(conn, "update-topic-match", type, title, content, toolName, topicKey, hash, now, now,
                            existing.get());
                    LOG.debug("Topic upsert of observation #{} ({})", existing.get(), topicKey);
                    return existing.get();
                }
            }

            String windowStart = Timestamps.before(clock, config.dedupeWindow());
            Optional<Long> duplicate = queryOne(conn, "select-duplicate", rs -> rs.getLong(1),
                    hash, project, scope.wire(), type, title, windowStart);
            if (duplicate.isPresent()) {
                update(conn, "update-duplicate", now, now, duplicate.get());
                LOG.debug("Duplicate of observation #{} absorbed", duplicate.get());
                return duplicate.get();
            }

            long id = insert(conn, "insert-observation", request.sessionId(), type, title, content, toolName,
                    project, scope.wire(), nullIfEmpty(topicKey), hash, now, now, now);
            LOG.debug("Inserted observation #{} ({})", id, type);
            return id;
        });
    }

    @Override
    public Observation getObservation(long id) {
        return withConnection("get observation", conn -> requireActive(conn, id));
    }

    @Override
    public Observation updateObservation(long id, UpdateObservation update) {
        return inTransaction("update observation", conn -> {
            Observation current = requireActive(conn, id);

            String type = update.type() != null ? update.type() : current.type();
            String title = update.title() != null ? TextNormalizer.redactPrivate(update.title()) : current.title();
            String content = update.content() != null
                    ? TextNormalizer.cleanContent(update.content(), config.getMaxObservationLength())
                    : current.content();
            String project = update.project() != null ? update.project() : current.project();
            Scope scope = update.scope() != null ? Scope.parse(update.scope()) : current.scope();
            String topicKey = update.topicKey() != null
                    ? TextNormalizer.normalizeTopicKey(update.topicKey())
                    : current.topicKey();

            update(conn, "update-observation", type, title, content, nullIfEmpty(project), scope.wire(),
                    nullIfEmpty(topicKey), TextNormalizer.contentHash(content), now(), id);
            return requireActive(conn, id);
        });
    }

    @Override
    public boolean deleteObservation(long id, boolean hard) {
        int affected = withConnection("delete observation", conn -> hard
                ? update(conn, "hard-delete-observation", id)
                : update(conn, "soft-delete-observation", now(), now(), id));
        LOG.debug("{} delete of observation #{} affected {} row(s)", hard ? "Hard" : "Soft", id, affected);
        return affected > 0;
    }

    @Override
    public Optional<Observation> findByTopicKey(String topicKey, String project, String scope) {
        String key = TextNormalizer.normalizeTopicKey(topicKey);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return withConnection("find by topic key", conn -> queryOne(conn, "select-by-topic-key",
                SqlMemoryStore::mapObservation, key, nullIfEmpty(project), Scope.parse(scope).wire()));
    }

    @Override
    public List<Observation> recentObservations(String project, String scope, int limit) {
        int effective = limit <= 0 ? config.getMaxContextResults() : limit;
        return withConnection("recent observations", conn -> query(conn, "select-recent-observations",
                SqlMemoryStore::mapObservation, "", emptyIfNull(project), scopeFilter(scope), effective));
    }

    @Override
    public int countObservations(String project, String scope) {
        return withConnection("count observations",
                conn -> queryInt(conn, "count-observations", "", emptyIfNull(project), scopeFilter(scope)));
    }

    // =====================================================================
    // Relations
    // =====================================================================

    @Override
    public List<Long> addRelation(AddRelation request) {
        long from = request.fromId();
        long to = request.toId();
        if (from == to) {
            throw MemoryException.invalidArgument("cannot relate observation #" + from + " to itself");
        }
        String type = request.type() == null || request.type().isBlank() ? Relation.DEFAULT_TYPE : request.type();
        String note = nullIfEmpty(request.note());
        String now = now();

        return inTransaction("add relation", conn -> {
            for (long id : new long[] { from, to }) {
                if (queryOne(conn, "select-active-observation", rs -> rs.getInt(1), id).isEmpty()) {
                    throw MemoryException.notFound("observation #" + id + " not found or deleted");
                }
            }
            List<Long> ids = new ArrayList<>(2);
            ids.add(insertRelation(conn, from, to, type, note, now));
            if (request.bidirectional()) {
                ids.add(insertRelation(conn, to, from, type, note, now));
            }
            LOG.debug("Related #{} -> #{} ({}), bidirectional={}", from, to, type, request.bidirectional());
            return List.copyOf(ids);
        });
    }

    private long insertRelation(Connection conn, long from, long to, String type, String note, String now)
            throws SQLException {
        try {
            return insert(conn, "insert-relation", from, to, type, note, now);
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) {
                throw new MemoryException(ErrorKind.ALREADY_EXISTS,
                        "relation already exists: #" + from + " -> #" + to + " (" + type + ")", e);
            }
            throw e;
        }
    }

    @Override
    public void removeRelation(long id) {
        int removed = withConnection("remove relation", conn -> update(conn, "delete-relation", id));
        if (removed == 0) {
            throw MemoryException.notFound("relation #" + id + " not found");
        }
    }

    @Override
    public List<Relation> getRelations(long observationId) {
        return withConnection("get relations", conn -> query(conn, "select-relations",
                rs -> new Relation(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getString(4), rs.getString(5),
                        rs.getString(6)),
                observationId));
    }

    @Override
    public Optional<GraphNode> findNode(long id) {
        return withConnection("find node", conn -> queryOne(conn, "select-node",
                rs -> new GraphNode(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5)),
                id));
    }

    @Override
    public ContextResult buildContext(long rootId, int depth) {
        return new ContextTraversal(this).build(rootId, depth);
    }

    // =====================================================================
    // Search
    // =====================================================================

    @Override
    public List<SearchResult> search(String query, SearchOptions options) {
        SearchOptions opts = options == null ? SearchOptions.none() : options;
        int limit = opts.limit() <= 0 ? DEFAULT_SEARCH_LIMIT : opts.limit();
        int effective = Math.min(limit, config.getMaxSearchResults());
        String type = emptyIfNull(opts.type());
        String project = emptyIfNull(opts.project());
        String scope = opts.scope() == null ? "" : opts.scope().wire();

        String match = FtsQuery.sanitize(query);
        if (match.isEmpty()) {
            return withConnection("search recent", conn -> query(conn, "select-recent-observations",
                    rs -> new SearchResult(mapObservation(rs), 0.0), type, project, scope, effective));
        }
        return withConnection("search", conn -> query(conn, "search-observations",
                rs -> new SearchResult(mapObservation(rs), rs.getDouble(16)), match, type, project, scope,
                effective));
    }

    @Override
    public int countSearchResults(String query, SearchOptions options) {
        SearchOptions opts = options == null ? SearchOptions.none() : options;
        String type = emptyIfNull(opts.type());
        String project = emptyIfNull(opts.project());
        String scope = opts.scope() == null ? "" : opts.scope().wire();

        String match = FtsQuery.sanitize(query);
        if (match.isEmpty()) {
            return withConnection("count search results",
                    conn -> queryInt(conn, "count-observations", type, project, scope));
        }
        return withConnection("count search results",
                conn -> queryInt(conn, "count-search-observations", match, type, project, scope));
    }

    @Override
    public List<Prompt> searchPrompts(String query, String project, int limit) {
        int effective = limit <= 0 ? DEFAULT_SEARCH_LIMIT : limit;
        String match = FtsQuery.sanitize(query);
        if (match.isEmpty()) {
            return recentPrompts(project, effective);
        }
        return withConnection("search prompts", conn -> query(conn, "search-prompts", SqlMemoryStore::mapPrompt,
                match, emptyIfNull(project), effective));
    }

    // =====================================================================
    // Timeline
    // =====================================================================

    @Override
    public TimelineResult timeline(long focusId, int before, int after) {
        int beforeCount = before <= 0 ? DEFAULT_TIMELINE_WINDOW : before;
        int afterCount = after <= 0 ? DEFAULT_TIMELINE_WINDOW : after;

        return withConnection("timeline", conn -> {
            Observation focus = requireActive(conn, focusId);
            Session session = loadSessionQuietly(conn, focus.sessionId());

            List<Observation> older = new ArrayList<>(query(conn, "select-timeline-before",
                    SqlMemoryStore::mapObservation, focus.sessionId(), focusId, beforeCount));
            Collections.reverse(older);
            List<Observation> newer = query(conn, "select-timeline-after",
                    SqlMemoryStore::mapObservation, focus.sessionId(), focusId, afterCount);
            int total = queryInt(conn, "count-session-observations", focus.sessionId());

            return new TimelineResult(focus, List.copyOf(older), newer, session, total);
        });
    }

    /** The session is context only; failing to load it must not fail the timeline. */
    private Session loadSessionQuietly(Connection conn, String sessionId) {
        try {
            return queryOne(conn, "select-session", SqlMemoryStore::mapSession, sessionId).orElse(null);
        } catch (SQLException e) {
            LOG.warn("Could not load session {} for timeline: {}", sessionId, e.getMessage());
            return null;
        }
    }

    // =====================================================================
    // Prompts
    // =====================================================================

    @Override
    public long addPrompt(String sessionId, String content, String project) {
        requireText(sessionId, "session id");
        String cleaned = TextNormalizer.cleanContent(content, config.getMaxObservationLength());
        return withConnection("add prompt",
                conn -> insert(conn, "insert-prompt", sessionId, cleaned, nullIfEmpty(project), now()));
    }

    @Override
    public List<Prompt> recentPrompts(String project, int limit) {
        int effective = limit <= 0 ? DEFAULT_PROMPT_LIMIT : limit;
        return withConnection("recent prompts", conn -> query(conn, "select-recent-prompts",
                SqlMemoryStore::mapPrompt, emptyIfNull(project), effective));
    }

    // =====================================================================
    // Stats, Export & Import
    // =====================================================================

    @Override
    public Stats stats() {
        return withConnection("stats", conn -> new Stats(
                queryInt(conn, "count-sessions"),
                queryInt(conn, "count-observations", "", "", ""),
                queryInt(conn, "count-prompts"),
                queryLenient(conn, "select-projects", rs -> rs.getString(1), "project")));
    }

    @Override
    public ExportData exportData() {
        ExportData data = withConnection("export", conn -> new ExportData(
                ExportData.FORMAT_VERSION,
                now(),
                queryLenient(conn, "export-sessions", SqlMemoryStore::mapSession, "session"),
                queryLenient(conn, "export-observations", SqlMemoryStore::mapObservation, "observation"),
                queryLenient(conn, "export-prompts", SqlMemoryStore::mapPrompt, "prompt")));
        LOG.info("Exported {} sessions, {} observations, {} prompts",
                data.sessions().size(), data.observations().size(), data.prompts().size());
        return data;
    }

    @Override
    public ImportResult importData(ExportData data) {
        if (data == null) {
            throw MemoryException.invalidArgument("import data is missing");
        }
        validateImport(data);
        String now = now();

        ImportResult result = inTransaction("import", conn -> {
            int sessions = 0;
            for (Session s : data.sessions()) {
                sessions += update(conn, "import-session", s.id(), emptyIfNull(s.project()),
                        emptyIfNull(s.directory()), s.startedAt() != null ? s.startedAt() : now, s.endedAt(),
                        s.summary());
            }

            int observations = 0;
            for (Observation o : data.observations()) {
                String content = emptyIfNull(o.content());
                String createdAt = o.createdAt() != null ? o.createdAt() : now;
                Scope scope = o.scope() == null ? Scope.PROJECT : o.scope();
                insert(conn, "import-observation", o.sessionId(), o.type(), emptyIfNull(o.title()), content,
                        o.toolName(), o.project(), scope.wire(),
                        nullIfEmpty(TextNormalizer.normalizeTopicKey(o.topicKey())),
                        TextNormalizer.contentHash(content),
                        Math.max(o.revisionCount(), 1), Math.max(o.duplicateCount(), 1),
                        o.lastSeenAt(), createdAt, o.updatedAt() != null ? o.updatedAt() : createdAt,
                        o.deletedAt());
                observations++;
            }

            int prompts = 0;
            for (Prompt p : data.prompts()) {
                insert(conn, "import-prompt", p.sessionId(), emptyIfNull(p.content()), p.project(),
                        p.createdAt() != null ? p.createdAt() : now);
                prompts++;
            }
            return new ImportResult(sessions, observations, prompts);
        });

        LOG.info("Imported {} sessions, {} observations, {} prompts",
                result.sessionsImported(), result.observationsImported(), result.promptsImported());
        return result;
    }

    /** Rejects rows that would break NOT NULL columns before anything is written. */
    private static void validateImport(ExportData data) {
        for (Session s : data.sessions()) {
            requireText(s.id(), "imported session id");
        }
        for (Observation o : data.observations()) {
            requireText(o.sessionId(), "session id of imported observation #" + o.id());
            requireText(o.type(), "type of imported observation #" + o.id());
        }
        for (Prompt p : data.prompts()) {
            requireText(p.sessionId(), "session id of imported prompt #" + p.id());
        }
    }

    // =====================================================================
    // Passive Capture
    // =====================================================================

    @Override
    public PassiveCaptureResult passiveCapture(PassiveCaptureRequest request) {
        List<String> learnings = LearningExtractor.extract(request.content());
        if (learnings.isEmpty()) {
            return new PassiveCaptureResult(0, 0, 0);
        }

        String project = nullIfEmpty(request.project());
        int saved = 0;
        int duplicates = 0;
        for (String learning : learnings) {
            String hash = TextNormalizer.contentHash(learning);
            boolean known = withConnection("passive capture", conn -> queryOne(conn, "select-passive-duplicate",
                    rs -> rs.getLong(1), hash, project).isPresent());
            if (known) {
                duplicates++;
                continue;
            }

            createObservation(new CreateObservation(request.sessionId(), PASSIVE_TYPE,
                    TextNormalizer.truncate(learning, PASSIVE_TITLE_LENGTH), learning, request.source(),
                    request.project(), Scope.PROJECT.wire(), null));
            saved++;
        }
        LOG.debug("Passive capture: {} extracted, {} saved, {} duplicates", learnings.size(), saved, duplicates);
        return new PassiveCaptureResult(learnings.size(), saved, duplicates);
    }

    // =====================================================================
    // Compaction
    // =====================================================================

    @Override
    public List<Observation> findStaleObservations(String project, String scope, int olderThanDays, int limit) {
        if (olderThanDays <= 0) {
            throw MemoryException.invalidArgument("older than days must be > 0, got " + olderThanDays);
        }
        int effective = limit <= 0 ? DEFAULT_STALE_LIMIT : limit;
        String cutoff = Timestamps.before(clock, Duration.ofDays(olderThanDays));
        return withConnection("find stale observations", conn -> query(conn, "select-stale-observations",
                SqlMemoryStore::mapObservation, cutoff, emptyIfNull(project), scopeFilter(scope), effective));
    }

    @Override
    public CompactResult compact(CompactRequest request) {
        if (request.ids().isEmpty()) {
            throw MemoryException.invalidArgument("no observation ids to compact");
        }
        boolean hasTitle = request.summaryTitle() != null && !request.summaryTitle().isBlank();
        boolean hasContent = request.summaryContent() != null && !request.summaryContent().isBlank();
        if (hasContent && !hasTitle) {
            throw MemoryException.invalidArgument("summary content requires a summary title");
        }

        String project = emptyIfNull(request.project());
        String scopeFilter = scopeFilter(request.scope());
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? MANUAL_SESSION
                : request.sessionId();
        String now = now();

        CompactResult result = inTransaction("compact observations", conn -> {
            int before = queryInt(conn, "count-observations", "", project, scopeFilter);
            int deleted = 0;
            for (Long id : request.ids()) {
                deleted += update(conn, "soft-delete-observation", now, now, id);
            }

            Long summaryId = null;
            if (hasTitle) {
                update(conn, "insert-session", sessionId, project, "", now);
                String content = TextNormalizer.cleanContent(request.summaryContent(),
                        config.getMaxObservationLength());
                summaryId = insert(conn, "insert-observation", sessionId, COMPACTION_SUMMARY_TYPE,
                        TextNormalizer.redactPrivate(request.summaryTitle()), content, null, nullIfEmpty(project),
                        Scope.parse(request.scope()).wire(), null, TextNormalizer.contentHash(content), now, now, now);
            }

            int after = queryInt(conn, "count-observations", "", project, scopeFilter);
            return new CompactResult(deleted, before, after, summaryId);
        });

        LOG.info("Compacted {} of {} requested observations", result.deletedCount(), request.ids().size());
        return result;
    }

    // =====================================================================
    // Row Mapping
    // =====================================================================

    static Observation mapObservation(ResultSet rs) throws SQLException {
        return new Observation(
                rs.getLong(1),
                rs.getString(2),
                rs.getString(3),
                rs.getString(4),
                rs.getString(5),
                rs.getString(6),
                rs.getString(7),
                Scope.parse(rs.getString(8)),
                rs.getString(9),
                rs.getInt(10),
                rs.getInt(11),
                rs.getString(12),
                rs.getString(13),
                rs.getString(14),
                rs.getString(15));
    }

    private static Session mapSession(ResultSet rs) throws SQLException {
        return new Session(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                rs.getString(6));
    }

    private static Prompt mapPrompt(ResultSet rs) throws SQLException {
        return new Prompt(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5));
    }

    // =====================================================================
    // JDBC Helpers
    // =====================================================================

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> T withConnection(String action, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            throw SqlErrors.translate(action, e);
        }
    }

    private <T> T inTransaction(String action, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate(action, e);
        }
    }

    private Observation requireActive(Connection conn, long id) throws SQLException {
        return queryOne(conn, "select-observation", SqlMemoryStore::mapObservation, id)
                .orElseThrow(() -> MemoryException.notFound("observation #" + id + " not found"));
    }

    private static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }

    private static <T> List<T> query(Connection conn, String sqlName, RowMapper<T> mapper, Object... args)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, args);
            List<T> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            return results;
        }
    }

    /** Like {@link #query} but a row that fails to map is logged and skipped. */
    private static <T> List<T> queryLenient(Connection conn, String sqlName, RowMapper<T> mapper, String what)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName));
                ResultSet rs = ps.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                try {
                    results.add(mapper.map(rs));
                } catch (SQLException e) {
                    LOG.warn("Skipping unreadable {} row: {}", what, e.getMessage());
                }
            }
            return results;
        }
    }

    private static <T> Optional<T> queryOne(Connection conn, String sqlName, RowMapper<T> mapper, Object... args)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    private static int queryInt(Connection conn, String sqlName, Object... args) throws SQLException {
        return queryOne(conn, sqlName, rs -> rs.getInt(1), args).orElse(0);
    }

    private static int update(Connection conn, String sqlName, Object... args) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            bind(ps, args);
            return ps.executeUpdate();
        }
    }

    private static long insert(Connection conn, String sqlName, Object... args) throws SQLException {
        update(conn, sqlName, args);
        return queryOne(conn, "select-last-insert-id", rs -> rs.getLong(1))
                .orElseThrow(() -> new SQLException("no row id after " + sqlName));
    }

    // =====================================================================
    // Small Helpers
    // =====================================================================

    private String now() {
        return Timestamps.now(clock);
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }

    /** Empty for "no filter", the normalized wire value otherwise. */
    private static String scopeFilter(String scope) {
        return scope == null || scope.isBlank() ? "" : Scope.parse(scope).wire();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw MemoryException.invalidArgument(field + " is required");
        }
    }
}
