/**
 * SQLite persistence for the memory engine.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Caller / tool adapter]
 *        │
 *        ▼
 *   MemoryStore        ← interface, bound to SqlMemoryStore via MemoryModule
 *        │
 *        ├── ContextTraversal   ← BFS over GraphSource (the store itself)
 *        ├── ContextFormatter   ← markdown views over recent data
 *        ├── ProgressDocuments  ← topic-keyed JSON progress per project
 *        └── ExportCodec        ← JSON file format of ExportData
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ sessions                                                          │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ caller-supplied                                │
 * │ project          │ project name                                   │
 * │ directory        │ working directory                              │
 * │ started_at       │ set on insert, never changed                   │
 * │ ended_at         │ set by endSession                              │
 * │ summary          │ optional closing summary                       │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ observations                                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ monotonic                                      │
 * │ session_id       │ FK → sessions.id                               │
 * │ type, title      │ free-form tag and headline                     │
 * │ content          │ redacted, length-capped body                   │
 * │ tool_name        │ optional producer                              │
 * │ project, scope   │ scope is 'project' or 'personal'               │
 * │ topic_key        │ normalized slug, drives topic upserts          │
 * │ normalized_hash  │ SHA-256 of normalized content, drives dedup    │
 * │ revision_count   │ ≥ 1, bumped by upsert and update               │
 * │ duplicate_count  │ ≥ 1, bumped by dedup hits                      │
 * │ last_seen_at     │ last write or re-report                        │
 * │ created_at       │                                                │
 * │ updated_at       │                                                │
 * │ deleted_at       │ soft-delete tombstone                          │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ relations                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │                                                │
 * │ from_id, to_id   │ FK → observations.id ON DELETE CASCADE         │
 * │ type             │ default 'relates_to', UNIQUE(from, to, type)   │
 * │ note             │ optional                                       │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ user_prompts                                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ write-once                                     │
 * │ session_id       │ FK → sessions.id                               │
 * │ content, project │                                                │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * <h3>Full-text search</h3>
 * {@code observations_fts} (title, content, tool_name, type, project) and
 * {@code prompts_fts} (content, project) are external-content FTS5 tables.
 * Six {@code AFTER INSERT/UPDATE/DELETE} triggers keep them in sync, so a
 * soft delete re-indexes the row and a hard delete removes it. Queries join
 * back to the base table and order by {@code fts.rank}.
 *
 * <h2>SQL File Inventory</h2>
 * Statements live in {@code sql/*.sql} and are loaded via {@link
 * de.bsommerfeld.recall.db.SqlLoader}. Optional filters are written as
 * {@code (?1 = '' OR column = ?1)} and bound with an empty string when unset.
 */
package de.bsommerfeld.recall.db;
