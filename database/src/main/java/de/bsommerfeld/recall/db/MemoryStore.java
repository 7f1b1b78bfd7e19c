package de.bsommerfeld.recall.db;

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
import de.bsommerfeld.recall.core.domain.SearchOptions;
import de.bsommerfeld.recall.core.domain.SearchResult;
import de.bsommerfeld.recall.core.domain.Session;
import de.bsommerfeld.recall.core.domain.SessionSummary;
import de.bsommerfeld.recall.core.domain.Stats;
import de.bsommerfeld.recall.core.domain.TimelineResult;
import de.bsommerfeld.recall.core.domain.UpdateObservation;
import de.bsommerfeld.recall.core.error.MemoryException;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract of the memory engine. Implementations must be
 * thread-safe; every call is synchronous.
 *
 * <p>
 * Failures surface as {@link MemoryException}. Its
 * {@link de.bsommerfeld.recall.core.error.ErrorKind} distinguishes missing
 * records, bad input, duplicate relations, a busy database (safe to retry) and
 * unexpected driver errors.
 *
 * <p>
 * Soft-deleted observations are invisible to every method except
 * {@link #exportData()} and {@link #findNode(long)}.
 *
 * @see SqlMemoryStore
 */
public interface MemoryStore extends GraphSource {

    /** Session used when a caller saves something without naming one. */
    String MANUAL_SESSION = "manual-save";

    // =====================================================================
    // Sessions
    // =====================================================================

    /** Registers a session. A duplicate id is ignored and the original row kept. */
    void startSession(String id, String project, String directory);

    /** Sets {@code ended_at} and the summary; an empty summary is stored as absent. */
    void endSession(String id, String summary);

    Optional<Session> getSession(String id);

    /**
     * Sessions with their active observation counts, most recently active
     * first.
     *
     * @param project filter, {@code null} or empty for all
     * @param limit   non-positive means 5
     */
    List<SessionSummary> recentSessions(String project, int limit);

    // =====================================================================
    // Observations
    // =====================================================================

    /**
     * Stores an observation, going through topic upsert, content dedup or
     * plain insert, in that order of precedence.
     *
     * @return id of the inserted or reused row
     * @throws MemoryException {@code NOT_FOUND} if the session does not exist
     */
    long createObservation(CreateObservation request);

    /**
     * Applies the non-null fields with the same normalization as creation and
     * bumps {@code revision_count}.
     *
     * @return the updated record
     */
    Observation updateObservation(long id, UpdateObservation update);

    /**
     * Soft delete sets {@code deleted_at}; hard delete removes the row and,
     * through the foreign key cascade, every relation touching it.
     *
     * @return whether a row was affected
     */
    boolean deleteObservation(long id, boolean hard);

    /** The active observation under {@code topicKey}; an empty key never matches. */
    Optional<Observation> findByTopicKey(String topicKey, String project, String scope);

    /**
     * @param limit non-positive means the configured context cap
     */
    List<Observation> recentObservations(String project, String scope, int limit);

    int countObservations(String project, String scope);

    // =====================================================================
    // Relations
    // =====================================================================

    /**
     * @return one id, or two for a bidirectional request (forward first)
     * @throws MemoryException {@code INVALID_ARGUMENT} for a self edge,
     *                         {@code NOT_FOUND} for a missing endpoint,
     *                         {@code ALREADY_EXISTS} for a duplicate triple
     */
    List<Long> addRelation(AddRelation request);

    void removeRelation(long id);

    /** Depth-limited, cycle-safe walk from {@code rootId}. */
    ContextResult buildContext(long rootId, int depth);

    // =====================================================================
    // Search
    // =====================================================================

    /**
     * Ranked full-text search. A blank query returns the recency listing with
     * rank 0 and never touches the index.
     */
    List<SearchResult> search(String query, SearchOptions options);

    /** Size of the unlimited result set {@link #search} draws from. */
    int countSearchResults(String query, SearchOptions options);

    /** @param limit non-positive means 10 */
    List<Prompt> searchPrompts(String query, String project, int limit);

    // =====================================================================
    // Timeline
    // =====================================================================

    /**
     * @param before non-positive means 5
     * @param after  non-positive means 5
     */
    TimelineResult timeline(long focusId, int before, int after);

    // =====================================================================
    // Prompts
    // =====================================================================

    long addPrompt(String sessionId, String content, String project);

    /** @param limit non-positive means 20 */
    List<Prompt> recentPrompts(String project, int limit);

    // =====================================================================
    // Maintenance
    // =====================================================================

    Stats stats();

    /** Every session, every observation (soft-deleted included) and every prompt. */
    ExportData exportData();

    /**
     * Loads an export in one transaction. Sessions are insert-or-ignore,
     * observations and prompts are always inserted as new rows.
     */
    ImportResult importData(ExportData data);

    /** Extracts learnings from free text and saves the ones not stored yet. */
    PassiveCaptureResult passiveCapture(PassiveCaptureRequest request);

    /**
     * Active observations created more than {@code olderThanDays} ago, oldest
     * first.
     */
    List<Observation> findStaleObservations(String project, String scope, int olderThanDays, int limit);

    /** Soft-deletes the given ids and optionally stores a summary in their place. */
    CompactResult compact(CompactRequest request);
}
