package de.bsommerfeld.recall.db;

import de.bsommerfeld.recall.core.config.MemoryConfig;
import de.bsommerfeld.recall.core.domain.AddRelation;
import de.bsommerfeld.recall.core.domain.CompactRequest;
import de.bsommerfeld.recall.core.domain.CompactResult;
import de.bsommerfeld.recall.core.domain.ContextNode;
import de.bsommerfeld.recall.core.domain.ContextResult;
import de.bsommerfeld.recall.core.domain.CreateObservation;
import de.bsommerfeld.recall.core.domain.ExportData;
import de.bsommerfeld.recall.core.domain.ImportResult;
import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.PassiveCaptureRequest;
import de.bsommerfeld.recall.core.domain.PassiveCaptureResult;
import de.bsommerfeld.recall.core.domain.Prompt;
import de.bsommerfeld.recall.core.domain.Relation;
import de.bsommerfeld.recall.core.domain.RelationDirection;
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
import de.bsommerfeld.recall.core.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlMemoryStore against a real temporary SQLite
 * database. Time is driven by a {@link MutableClock} so dedup windows and
 * stale cutoffs are deterministic.
 */
class SqlMemoryStoreTest {

    private static final String SESSION = "s1";
    private static final String PROJECT = "alpha";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private MemoryConfig config;
    private SqlMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        config = new MemoryConfig();
        config.setDataDir(tempDir.toString());
        store = new SqlMemoryStore(config, clock);
        store.startSession(SESSION, PROJECT, "/work/alpha");
    }

    // -- Sessions --

    @Test
    void startSession_shouldKeepOriginalOnDuplicateId() {
        store.startSession(SESSION, "other", "/elsewhere");

        Session session = store.getSession(SESSION).orElseThrow();
        assertEquals(PROJECT, session.project());
        assertEquals("/work/alpha", session.directory());
        assertEquals("2024-03-01 10:00:00", session.startedAt());
        assertNull(session.endedAt());
    }

    @Test
    void endSession_shouldSetEndAndSummary() {
        clock.advance(Duration.ofHours(1));
        store.endSession(SESSION, "wired up the store");

        Session session = store.getSession(SESSION).orElseThrow();
        assertEquals("2024-03-01 11:00:00", session.endedAt());
        assertEquals("wired up the store", session.summary());
    }

    @Test
    void endSession_shouldStoreEmptySummaryAsAbsent() {
        store.endSession(SESSION, "");

        assertNull(store.getSession(SESSION).orElseThrow().summary());
    }

    @Test
    void endSession_shouldFailForUnknownSession() {
        MemoryException e = assertThrows(MemoryException.class, () -> store.endSession("nope", "x"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void getSession_shouldReturnEmptyForUnknown() {
        assertTrue(store.getSession("nope").isEmpty());
    }

    @Test
    void recentSessions_shouldCountActiveObservations() {
        store.startSession("s2", "beta", "/work/beta");
        long a = store.createObservation(obs("First", "first observation body"));
        store.createObservation(obs("Second", "second observation body"));
        store.deleteObservation(a, false);

        List<SessionSummary> all = store.recentSessions(null, 0);
        assertEquals(2, all.size());
        SessionSummary alpha = all.stream().filter(s -> s.id().equals(SESSION)).findFirst().orElseThrow();
        assertEquals(1, alpha.observationCount());

        List<SessionSummary> beta = store.recentSessions("beta", 10);
        assertEquals(1, beta.size());
        assertEquals("s2", beta.get(0).id());
        assertEquals(0, beta.get(0).observationCount());
    }

    // -- Observation Creation --

    @Test
    void createObservation_shouldStartCountersAtOne() {
        long id = store.createObservation(obs("JWT auth", "Switched to JWT tokens for the API")
                .withToolName("mem_save"));

        Observation saved = store.getObservation(id);
        assertEquals(SESSION, saved.sessionId());
        assertEquals("decision", saved.type());
        assertEquals("JWT auth", saved.title());
        assertEquals("Switched to JWT tokens for the API", saved.content());
        assertEquals("mem_save", saved.toolName());
        assertEquals(PROJECT, saved.project());
        assertEquals(Scope.PROJECT, saved.scope());
        assertNull(saved.topicKey());
        assertEquals(1, saved.revisionCount());
        assertEquals(1, saved.duplicateCount());
        assertEquals("2024-03-01 10:00:00", saved.createdAt());
        assertEquals(saved.createdAt(), saved.updatedAt());
        assertNull(saved.deletedAt());
    }

    @Test
    void createObservation_shouldAbsorbDuplicateWithinWindow() {
        long first = store.createObservation(obs("Cache", "Use  Redis for the session cache"));
        clock.advance(Duration.ofMinutes(10));
        long second = store.createObservation(obs("Cache", "use redis for the SESSION cache"));

        assertEquals(first, second);
        Observation saved = store.getObservation(first);
        assertEquals(2, saved.duplicateCount());
        assertEquals(1, saved.revisionCount());
        assertEquals("2024-03-01 10:10:00", saved.lastSeenAt());
        assertEquals("Use  Redis for the session cache", saved.content());
    }

    @Test
    void createObservation_shouldInsertAgainAfterWindow() {
        long first = store.createObservation(obs("Cache", "Use Redis for the session cache"));
        clock.advance(Duration.ofMinutes(20));
        long second = store.createObservation(obs("Cache", "Use Redis for the session cache"));

        assertNotEquals(first, second);
        assertEquals(1, store.getObservation(first).duplicateCount());
        assertEquals(2, store.countObservations(PROJECT, null));
    }

    @Test
    void createObservation_shouldUseDefaultWindowForNonPositiveSetting() {
        config.setDedupeWindowMinutes(0);
        long first = store.createObservation(obs("Cache", "Use Redis for the session cache"));
        clock.advance(Duration.ofMinutes(1));
        assertEquals(first, store.createObservation(obs("Cache", "Use Redis for the session cache")));

        config.setDedupeWindowMinutes(-5);
        clock.advance(Duration.ofMinutes(10));
        assertEquals(first, store.createObservation(obs("Cache", "Use Redis for the session cache")));

        assertEquals(3, store.getObservation(first).duplicateCount());
    }

    @Test
    void createObservation_shouldSerializeConcurrentWriters() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(pool.submit(() -> store.createObservation(obs("Parallel " + n, "body " + n))));
            }
            for (Future<Long> f : futures) {
                assertTrue(f.get(30, TimeUnit.SECONDS) > 0);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, store.countObservations(PROJECT, null));
    }

    @Test
    void createObservation_shouldNotDedupeAcrossTitles() {
        long first = store.createObservation(obs("Cache A", "same body"));
        long second = store.createObservation(obs("Cache B", "same body"));

        assertNotEquals(first, second);
    }

    @Test
    void createObservation_shouldUpsertByTopicKey() {
        long first = store.createObservation(obs("Auth model", "sessions in cookies")
                .withTopicKey("Architecture/Auth  Model"));
        clock.advance(Duration.ofHours(2));
        long second = store.createObservation(obs("Auth model v2", "JWT with refresh tokens")
                .withTopicKey("architecture/auth model"));

        assertEquals(first, second);
        Observation saved = store.getObservation(first);
        assertEquals(2, saved.revisionCount());
        assertEquals("JWT with refresh tokens", saved.content());
        assertEquals("Auth model v2", saved.title());
        assertEquals("architecture/auth-model", saved.topicKey());
        assertEquals("2024-03-01 12:00:00", saved.updatedAt());
        assertEquals("2024-03-01 10:00:00", saved.createdAt());
    }

    @Test
    void createObservation_shouldKeepTopicKeysApartPerScope() {
        long project = store.createObservation(obs("Prefs", "tabs").withTopicKey("prefs/editor"));
        long personal = store.createObservation(obs("Prefs", "spaces").withTopicKey("prefs/editor")
                .withScope("personal"));

        assertNotEquals(project, personal);
        assertEquals(Scope.PERSONAL, store.getObservation(personal).scope());
    }

    @Test
    void createObservation_shouldRedactPrivateSpans() {
        long id = store.createObservation(obs("Token <private>abc</private>",
                "the key is <private>hunter2</private> for staging"));

        Observation saved = store.getObservation(id);
        assertEquals("Token " + TextNormalizer.REDACTED, saved.title());
        assertEquals("the key is " + TextNormalizer.REDACTED + " for staging", saved.content());
    }

    @Test
    void createObservation_shouldTruncateLongContent() {
        long id = store.createObservation(obs("Long", "x".repeat(2500)));

        String content = store.getObservation(id).content();
        assertEquals("x".repeat(2000) + TextNormalizer.TRUNCATION_MARKER, content);
    }

    @Test
    void createObservation_shouldNormalizeUnknownScopeToProject() {
        long id = store.createObservation(obs("Scope", "whatever").withScope("team"));

        assertEquals(Scope.PROJECT, store.getObservation(id).scope());
    }

    @Test
    void createObservation_shouldFailForMissingSession() {
        CreateObservation request = new CreateObservation("ghost", "decision", "t", "c", PROJECT);

        MemoryException e = assertThrows(MemoryException.class, () -> store.createObservation(request));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void createObservation_shouldRejectBlankType() {
        CreateObservation request = new CreateObservation(SESSION, " ", "t", "c", PROJECT);

        MemoryException e = assertThrows(MemoryException.class, () -> store.createObservation(request));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    // -- Observation Update & Delete --

    @Test
    void updateObservation_shouldApplyOnlyGivenFields() {
        long id = store.createObservation(obs("Original", "original content").withTopicKey("notes/one"));
        clock.advance(Duration.ofMinutes(5));

        Observation updated = store.updateObservation(id, UpdateObservation.empty()
                .withContent("new <private>secret</private> content"));

        assertEquals("Original", updated.title());
        assertEquals("new " + TextNormalizer.REDACTED + " content", updated.content());
        assertEquals("notes/one", updated.topicKey());
        assertEquals(2, updated.revisionCount());
        assertEquals("2024-03-01 10:05:00", updated.updatedAt());
    }

    @Test
    void updateObservation_shouldFailForDeleted() {
        long id = store.createObservation(obs("Gone", "soon deleted"));
        store.deleteObservation(id, false);

        MemoryException e = assertThrows(MemoryException.class,
                () -> store.updateObservation(id, UpdateObservation.empty().withTitle("x")));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void deleteObservation_softShouldHideEverywhereButExport() {
        long id = store.createObservation(obs("Hidden authentication note", "authentication detail"));
        long other = store.createObservation(obs("Visible", "still here"));

        assertTrue(store.deleteObservation(id, false));
        assertFalse(store.deleteObservation(id, false));

        assertThrows(MemoryException.class, () -> store.getObservation(id));
        assertTrue(store.search("authentication", SearchOptions.none()).isEmpty());
        assertEquals(List.of(other), ids(store.recentObservations(PROJECT, null, 0)));
        assertEquals(1, store.countObservations(PROJECT, null));
        assertEquals(1, store.stats().totalObservations());

        Observation exported = store.exportData().observations().stream()
                .filter(o -> o.id() == id).findFirst().orElseThrow();
        assertTrue(exported.isDeleted());
        assertEquals("2024-03-01 10:00:00", exported.deletedAt());
    }

    @Test
    void deleteObservation_softShouldKeepRelations() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        store.addRelation(new AddRelation(a, b, "depends_on"));

        store.deleteObservation(b, false);

        assertEquals(1, store.getRelations(a).size());
    }

    @Test
    void deleteObservation_hardShouldCascadeRelations() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        long c = store.createObservation(obs("C", "node c"));
        store.addRelation(new AddRelation(a, b, null));
        store.addRelation(new AddRelation(c, b, null));

        assertTrue(store.deleteObservation(b, true));

        assertTrue(store.getRelations(a).isEmpty());
        assertTrue(store.getRelations(c).isEmpty());
        assertTrue(store.findNode(b).isEmpty());
        assertTrue(store.exportData().observations().stream().noneMatch(o -> o.id() == b));
    }

    @Test
    void deleteObservation_shouldReturnFalseForUnknownId() {
        assertFalse(store.deleteObservation(999, true));
        assertFalse(store.deleteObservation(999, false));
    }

    @Test
    void findByTopicKey_shouldMatchNormalizedKey() {
        long id = store.createObservation(obs("Plan", "the plan").withTopicKey("plan/Release"));

        assertEquals(id, store.findByTopicKey("  PLAN/release ", PROJECT, "project").orElseThrow().id());
        assertTrue(store.findByTopicKey("plan/release", "beta", "project").isEmpty());
        assertTrue(store.findByTopicKey("", PROJECT, "project").isEmpty());
    }

    @Test
    void countObservations_shouldFilterByScope() {
        store.createObservation(obs("P1", "project one"));
        store.createObservation(obs("P2", "personal one").withScope("personal"));

        assertEquals(2, store.countObservations(PROJECT, null));
        assertEquals(1, store.countObservations(PROJECT, "personal"));
        assertEquals(0, store.countObservations("beta", null));
    }

    // -- Relations --

    @Test
    void addRelation_shouldDefaultType() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));

        List<Long> ids = store.addRelation(new AddRelation(a, b, " "));

        assertEquals(1, ids.size());
        Relation rel = store.getRelations(a).get(0);
        assertEquals(Relation.DEFAULT_TYPE, rel.type());
        assertEquals(a, rel.fromId());
        assertEquals(b, rel.toId());
        assertEquals("", rel.note());
    }

    @Test
    void addRelation_shouldRejectSelfEdge() {
        long a = store.createObservation(obs("A", "node a"));

        MemoryException e = assertThrows(MemoryException.class,
                () -> store.addRelation(new AddRelation(a, a, "relates_to")));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void addRelation_shouldRejectDuplicateTriple() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        store.addRelation(new AddRelation(a, b, "depends_on"));

        MemoryException e = assertThrows(MemoryException.class,
                () -> store.addRelation(new AddRelation(a, b, "depends_on")));
        assertEquals(ErrorKind.ALREADY_EXISTS, e.kind());

        store.addRelation(new AddRelation(a, b, "implements"));
        assertEquals(2, store.getRelations(a).size());
    }

    @Test
    void addRelation_shouldRejectMissingOrDeletedEndpoint() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        store.deleteObservation(b, false);

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(MemoryException.class,
                () -> store.addRelation(new AddRelation(a, 999, null))).kind());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(MemoryException.class,
                () -> store.addRelation(new AddRelation(a, b, null))).kind());
    }

    @Test
    void addRelation_bidirectionalShouldInsertBothLegs() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));

        List<Long> ids = store.addRelation(new AddRelation(a, b, "relates_to", "both ways", true));

        assertEquals(2, ids.size());
        List<Relation> rels = store.getRelations(a);
        assertEquals(2, rels.size());
        assertTrue(rels.stream().anyMatch(r -> r.fromId() == b && r.toId() == a));
        assertEquals("both ways", rels.get(0).note());
    }

    @Test
    void addRelation_bidirectionalShouldRollBackWhenReverseLegExists() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        store.addRelation(new AddRelation(b, a, "relates_to"));

        MemoryException e = assertThrows(MemoryException.class,
                () -> store.addRelation(new AddRelation(a, b, "relates_to", null, true)));
        assertEquals(ErrorKind.ALREADY_EXISTS, e.kind());

        List<Relation> rels = store.getRelations(a);
        assertEquals(1, rels.size());
        assertEquals(b, rels.get(0).fromId());
    }

    @Test
    void removeRelation_shouldDeleteEdge() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        long relId = store.addRelation(new AddRelation(a, b, null)).get(0);

        store.removeRelation(relId);

        assertTrue(store.getRelations(a).isEmpty());
        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(MemoryException.class, () -> store.removeRelation(relId)).kind());
    }

    // -- Context Traversal --

    @Test
    void buildContext_shouldRespectDepth() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        long c = store.createObservation(obs("C", "node c"));
        store.addRelation(new AddRelation(a, b, "depends_on"));
        store.addRelation(new AddRelation(b, c, "depends_on"));

        ContextResult shallow = store.buildContext(a, 1);
        assertEquals(a, shallow.root().id());
        assertEquals(List.of(b), nodeIds(shallow));
        assertEquals(1, shallow.maxDepth());

        ContextResult deep = store.buildContext(a, 2);
        assertEquals(List.of(b, c), nodeIds(deep));
        assertEquals(2, deep.totalNodes());
        assertEquals(2, deep.maxDepth());
        assertEquals(2, deep.connected().get(1).depth());
    }

    @Test
    void buildContext_shouldTerminateOnCycles() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        long c = store.createObservation(obs("C", "node c"));
        store.addRelation(new AddRelation(a, b, null));
        store.addRelation(new AddRelation(b, c, null));
        store.addRelation(new AddRelation(c, a, null));

        ContextResult result = store.buildContext(a, 5);

        assertEquals(2, result.totalNodes());
        assertFalse(nodeIds(result).contains(a));
    }

    @Test
    void buildContext_shouldReportIncomingEdges() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        store.addRelation(new AddRelation(b, a, "caused_by", "root cause", false));

        ContextNode node = store.buildContext(a, 1).connected().get(0);

        assertEquals(b, node.id());
        assertEquals(RelationDirection.INCOMING, node.direction());
        assertEquals("caused_by", node.relationType());
        assertEquals("root cause", node.note());
        assertEquals("B", node.title());
        assertEquals(PROJECT, node.project());
    }

    @Test
    void buildContext_shouldUseDefaultDepthForZero() {
        long a = store.createObservation(obs("A", "node a"));
        long b = store.createObservation(obs("B", "node b"));
        long c = store.createObservation(obs("C", "node c"));
        long d = store.createObservation(obs("D", "node d"));
        store.addRelation(new AddRelation(a, b, null));
        store.addRelation(new AddRelation(b, c, null));
        store.addRelation(new AddRelation(c, d, null));

        assertEquals(List.of(b, c), nodeIds(store.buildContext(a, 0)));
        assertEquals(List.of(b, c, d), nodeIds(store.buildContext(a, 99)));
    }

    @Test
    void buildContext_shouldFailForDeletedRoot() {
        long a = store.createObservation(obs("A", "node a"));
        store.deleteObservation(a, false);

        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(MemoryException.class, () -> store.buildContext(a, 2)).kind());
    }

    // -- Search --

    @Test
    void search_shouldRankFullTextMatches() {
        long hit = store.createObservation(obs("Authentication flow", "JWT authentication with refresh tokens"));
        store.createObservation(obs("Database", "SQLite with WAL journaling"));

        List<SearchResult> results = store.search("authentication", SearchOptions.none());

        assertEquals(List.of(hit), results.stream().map(r -> r.observation().id()).collect(Collectors.toList()));
        assertTrue(results.get(0).rank() < 0, "FTS5 rank is negative for matches");
        assertEquals(1, store.countSearchResults("authentication", SearchOptions.none()));
    }

    @Test
    void search_shouldApplyFilters() {
        store.createObservation(obs("SQLite choice", "we use sqlite"));
        long bug = store.createObservation(new CreateObservation(SESSION, "bug", "SQLite lock", "sqlite busy",
                PROJECT));
        store.startSession("s2", "beta", "/work/beta");
        store.createObservation(new CreateObservation("s2", "bug", "SQLite in beta", "sqlite elsewhere", "beta"));

        List<SearchResult> results = store.search("sqlite", new SearchOptions("bug", PROJECT, null, 0));

        assertEquals(1, results.size());
        assertEquals(bug, results.get(0).observation().id());
        assertEquals(3, store.countSearchResults("sqlite", SearchOptions.none()));
        assertEquals(2, store.countSearchResults("sqlite", SearchOptions.forProject(PROJECT)));
    }

    @Test
    void search_blankQueryShouldEqualRecencyListing() {
        for (int i = 0; i < 4; i++) {
            store.createObservation(obs("Note " + i, "content number " + i));
            clock.advance(Duration.ofMinutes(1));
        }

        List<SearchResult> results = store.search("   ", SearchOptions.none());

        assertEquals(ids(store.recentObservations(null, null, 10)),
                results.stream().map(r -> r.observation().id()).collect(Collectors.toList()));
        assertTrue(results.stream().allMatch(r -> r.rank() == 0.0));
        assertEquals(4, store.countSearchResults("", SearchOptions.none()));
    }

    @Test
    void search_shouldCapLimitAtConfiguredMaximum() {
        for (int i = 0; i < 25; i++) {
            store.createObservation(obs("Note " + i, "shared keyword entry " + i));
        }

        assertEquals(10, store.search("keyword", SearchOptions.none()).size());
        assertEquals(20, store.search("keyword", new SearchOptions(null, null, null, 100)).size());
        assertEquals(25, store.countSearchResults("keyword", SearchOptions.none()));
    }

    @Test
    void search_shouldTolerateQuerySyntax() {
        store.createObservation(obs("Quotes", "handles \"quoted\" text"));

        assertDoesNotThrow(() -> store.search("foo\" OR bar* NEAR", SearchOptions.none()));
        assertEquals(1, store.search("\"quoted\"", SearchOptions.none()).size());
    }

    // -- Prompts --

    @Test
    void addPrompt_shouldBeSearchable() {
        long id = store.addPrompt(SESSION, "please refactor the <private>api key</private> loader", PROJECT);
        store.addPrompt(SESSION, "write tests for the parser", PROJECT);

        List<Prompt> hits = store.searchPrompts("refactor", PROJECT, 0);
        assertEquals(1, hits.size());
        assertEquals(id, hits.get(0).id());
        assertEquals("please refactor the " + TextNormalizer.REDACTED + " loader", hits.get(0).content());
        assertTrue(store.searchPrompts("refactor", "beta", 0).isEmpty());
    }

    @Test
    void recentPrompts_shouldReturnNewestFirst() {
        long first = store.addPrompt(SESSION, "first prompt", PROJECT);
        clock.advance(Duration.ofMinutes(1));
        long second = store.addPrompt(SESSION, "second prompt", null);

        List<Prompt> all = store.recentPrompts(null, 0);
        assertEquals(List.of(second, first), all.stream().map(Prompt::id).collect(Collectors.toList()));
        assertEquals("", all.get(0).project());
        assertEquals(1, store.recentPrompts(PROJECT, 0).size());
        assertEquals(all.stream().map(Prompt::id).collect(Collectors.toList()),
                store.searchPrompts(" ", null, 0).stream().map(Prompt::id).collect(Collectors.toList()));
    }

    @Test
    void addPrompt_shouldFailForMissingSession() {
        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(MemoryException.class, () -> store.addPrompt("ghost", "hi", PROJECT)).kind());
    }

    // -- Timeline --

    @Test
    void timeline_shouldReturnChronologicalWindow() {
        long[] ids = new long[5];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = store.createObservation(obs("Step " + i, "step content " + i));
        }

        TimelineResult result = store.timeline(ids[2], 1, 1);

        assertEquals(ids[2], result.focus().id());
        assertEquals(List.of(ids[1]), ids(result.before()));
        assertEquals(List.of(ids[3]), ids(result.after()));
        assertEquals(5, result.totalInRange());
        assertEquals(SESSION, result.sessionInfo().orElseThrow().id());
        assertEquals(3, result.windowSize());
    }

    @Test
    void timeline_shouldDefaultWindowsAndSkipDeleted() {
        long[] ids = new long[4];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = store.createObservation(obs("Step " + i, "step content " + i));
        }
        store.startSession("s2", PROJECT, "/work/alpha");
        store.createObservation(new CreateObservation("s2", "decision", "Other", "other session", PROJECT));
        store.deleteObservation(ids[1], false);

        TimelineResult result = store.timeline(ids[2], 0, 0);

        assertEquals(List.of(ids[0]), ids(result.before()));
        assertEquals(List.of(ids[3]), ids(result.after()));
        assertEquals(3, result.totalInRange());
    }

    @Test
    void timeline_shouldFailForMissingFocus() {
        assertEquals(ErrorKind.NOT_FOUND,
                assertThrows(MemoryException.class, () -> store.timeline(42, 1, 1)).kind());
    }

    // -- Stats, Export & Import --

    @Test
    void stats_shouldCountEverything() {
        store.startSession("s2", "beta", "/work/beta");
        store.createObservation(obs("A", "alpha content"));
        clock.advance(Duration.ofMinutes(1));
        store.createObservation(new CreateObservation("s2", "decision", "B", "beta content", "beta"));
        store.addPrompt(SESSION, "a prompt", PROJECT);

        Stats stats = store.stats();

        assertEquals(2, stats.totalSessions());
        assertEquals(2, stats.totalObservations());
        assertEquals(1, stats.totalPrompts());
        assertEquals(List.of("beta", PROJECT), stats.projects());
    }

    @Test
    void exportImport_shouldRoundTripIntoEmptyStore() {
        long kept = store.createObservation(obs("Kept", "kept content").withTopicKey("notes/kept"));
        long gone = store.createObservation(obs("Gone", "gone content"));
        store.deleteObservation(gone, false);
        store.addPrompt(SESSION, "a prompt", PROJECT);

        ExportData data = store.exportData();
        assertEquals(ExportData.FORMAT_VERSION, data.version());
        assertEquals(1, data.sessions().size());
        assertEquals(2, data.observations().size());
        assertEquals(1, data.prompts().size());

        MemoryConfig otherConfig = new MemoryConfig();
        otherConfig.setDataDir(tempDir.resolve("other").toString());
        SqlMemoryStore target = new SqlMemoryStore(otherConfig, clock);

        ImportResult result = target.importData(data);
        assertEquals(new ImportResult(1, 2, 1), result);

        Stats stats = target.stats();
        assertEquals(1, stats.totalSessions());
        assertEquals(1, stats.totalObservations());
        assertEquals(1, stats.totalPrompts());
        Observation imported = target.findByTopicKey("notes/kept", PROJECT, "project").orElseThrow();
        assertEquals("kept content", imported.content());
        assertEquals(store.getObservation(kept).createdAt(), imported.createdAt());

        ImportResult again = target.importData(data);
        assertEquals(0, again.sessionsImported());
        assertEquals(2, again.observationsImported());
        assertEquals(2, target.stats().totalObservations());
    }

    @Test
    void importData_shouldRollBackOnMissingSession() {
        store.createObservation(obs("A", "content"));
        ExportData data = store.exportData();
        ExportData orphaned = new ExportData(data.version(), data.exportedAt(), List.of(), data.observations(),
                List.of());

        MemoryConfig otherConfig = new MemoryConfig();
        otherConfig.setDataDir(tempDir.resolve("orphan").toString());
        SqlMemoryStore target = new SqlMemoryStore(otherConfig, clock);

        assertThrows(MemoryException.class, () -> target.importData(orphaned));
        assertEquals(0, target.stats().totalObservations());
    }

    @Test
    void importData_shouldRejectObservationWithoutSessionOrType() {
        Observation noSession = new Observation(1, null, "decision", "t", "c", null, PROJECT, Scope.PROJECT, null,
                1, 1, null, "2024-03-01 10:00:00", "2024-03-01 10:00:00", null);
        Observation noType = new Observation(2, SESSION, null, "t", "c", null, PROJECT, Scope.PROJECT, null,
                1, 1, null, "2024-03-01 10:00:00", "2024-03-01 10:00:00", null);
        Session session = new Session("s9", PROJECT, "/work", "2024-03-01 09:00:00", null, null);

        for (Observation bad : List.of(noSession, noType)) {
            ExportData data = new ExportData(ExportData.FORMAT_VERSION, null, List.of(session), List.of(bad),
                    List.of());
            MemoryException e = assertThrows(MemoryException.class, () -> store.importData(data));
            assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
        }

        assertTrue(store.getSession("s9").isEmpty());
    }

    // -- Passive Capture --

    @Test
    void passiveCapture_shouldSaveNewLearningsOnce() {
        String text = """
                Done with the refactor.

                ## Key Learnings:
                1. SQLite FTS5 tables need triggers to stay in sync
                2. Always bind timestamps instead of using datetime('now')
                """;
        PassiveCaptureRequest request = new PassiveCaptureRequest(SESSION, text, PROJECT, "subagent");

        PassiveCaptureResult first = store.passiveCapture(request);
        assertEquals(new PassiveCaptureResult(2, 2, 0), first);

        List<Observation> saved = store.recentObservations(PROJECT, null, 0);
        assertEquals(2, saved.size());
        assertTrue(saved.stream().allMatch(o -> o.type().equals(SqlMemoryStore.PASSIVE_TYPE)));
        assertTrue(saved.stream().allMatch(o -> "subagent".equals(o.toolName())));

        clock.advance(Duration.ofDays(1));
        assertEquals(new PassiveCaptureResult(2, 0, 2), store.passiveCapture(request));
    }

    @Test
    void passiveCapture_shouldReturnZerosWithoutLearnings() {
        PassiveCaptureResult result = store.passiveCapture(
                new PassiveCaptureRequest(SESSION, "just some text", PROJECT, null));

        assertEquals(new PassiveCaptureResult(0, 0, 0), result);
    }

    // -- Compaction --

    @Test
    void findStaleObservations_shouldReturnOldestFirst() {
        clock.set(Instant.parse("2024-01-01T00:00:00Z"));
        long oldest = store.createObservation(obs("Old 1", "old one"));
        clock.advance(Duration.ofDays(1));
        long older = store.createObservation(obs("Old 2", "old two"));
        clock.set(Instant.parse("2024-03-01T00:00:00Z"));
        store.createObservation(obs("New", "fresh"));

        assertEquals(List.of(oldest, older), ids(store.findStaleObservations(PROJECT, null, 30, 0)));
        assertEquals(List.of(oldest), ids(store.findStaleObservations(PROJECT, null, 30, 1)));
        assertTrue(store.findStaleObservations("beta", null, 30, 0).isEmpty());
    }

    @Test
    void findStaleObservations_shouldRejectNonPositiveAge() {
        assertEquals(ErrorKind.INVALID_ARGUMENT, assertThrows(MemoryException.class,
                () -> store.findStaleObservations(PROJECT, null, 0, 10)).kind());
    }

    @Test
    void compact_shouldSoftDeleteAndCreateSummary() {
        long a = store.createObservation(obs("A", "stale a"));
        long b = store.createObservation(obs("B", "stale b"));
        store.createObservation(obs("C", "fresh c"));

        CompactResult result = store.compact(new CompactRequest(List.of(a, b, 999L), "Summary of A and B",
                "A and B covered the early setup", PROJECT, null, null));

        assertEquals(2, result.deletedCount());
        assertEquals(3, result.totalBefore());
        assertEquals(2, result.totalAfter());
        Observation summary = store.getObservation(result.summary().orElseThrow());
        assertEquals(SqlMemoryStore.COMPACTION_SUMMARY_TYPE, summary.type());
        assertEquals(MemoryStore.MANUAL_SESSION, summary.sessionId());
        assertTrue(store.getSession(MemoryStore.MANUAL_SESSION).isPresent());
        assertThrows(MemoryException.class, () -> store.getObservation(a));
    }

    @Test
    void compact_shouldSkipSummaryWithoutTitle() {
        long a = store.createObservation(obs("A", "stale a"));

        CompactResult result = store.compact(new CompactRequest(List.of(a), null, null, PROJECT, null, SESSION));

        assertEquals(1, result.deletedCount());
        assertTrue(result.summary().isEmpty());
        assertEquals(0, result.totalAfter());
    }

    @Test
    void compact_shouldValidateRequest() {
        long a = store.createObservation(obs("A", "stale a"));

        assertEquals(ErrorKind.INVALID_ARGUMENT, assertThrows(MemoryException.class,
                () -> store.compact(new CompactRequest(List.of(), "t", null, PROJECT, null, null))).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, assertThrows(MemoryException.class,
                () -> store.compact(new CompactRequest(List.of(a), "", "content", PROJECT, null, null))).kind());
        assertEquals(1, store.countObservations(PROJECT, null));
    }

    // -- Lifecycle --

    @Test
    void reopen_shouldKeepDataAndSearchIndex() {
        long id = store.createObservation(obs("Persistent", "survives a restart"));

        SqlMemoryStore reopened = new SqlMemoryStore(config, clock);

        assertEquals("Persistent", reopened.getObservation(id).title());
        assertEquals(1, reopened.search("restart", SearchOptions.none()).size());
    }

    // -- Helpers --

    private static CreateObservation obs(String title, String content) {
        return new CreateObservation(SESSION, "decision", title, content, PROJECT);
    }

    private static List<Long> ids(List<Observation> observations) {
        return observations.stream().map(Observation::id).collect(Collectors.toList());
    }

    private static List<Long> nodeIds(ContextResult result) {
        return result.connected().stream().map(ContextNode::id).collect(Collectors.toList());
    }
}
