package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single memory entry: a decision, bug fix, pattern, progress note and so on.
 * Timestamps are UTC strings in {@code yyyy-MM-dd HH:mm:ss} form.
 *
 * <p>
 * {@code deletedAt} is the soft-delete tombstone. Every read path except the
 * full export hides rows that carry it.
 *
 * @param id             store-assigned, monotonic
 * @param sessionId      owning session
 * @param type           free-form tag (e.g. {@code decision}, {@code bugfix})
 * @param title          short headline
 * @param content        body, redacted and length-capped on write
 * @param toolName       tool that produced the observation, may be {@code null}
 * @param project        project name, may be {@code null}
 * @param scope          normalized visibility
 * @param topicKey       normalized topic slug for upserts, may be {@code null}
 * @param revisionCount  number of writes through topic upsert or update, ≥ 1
 * @param duplicateCount number of times the same content was reported, ≥ 1
 * @param lastSeenAt     last time the observation was written or re-reported
 * @param createdAt      creation timestamp
 * @param updatedAt      last modification timestamp
 * @param deletedAt      soft-delete timestamp, {@code null} while active
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Observation(
        @JsonProperty("id") long id,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("project") String project,
        @JsonProperty("scope") Scope scope,
        @JsonProperty("topic_key") String topicKey,
        @JsonProperty("revision_count") int revisionCount,
        @JsonProperty("duplicate_count") int duplicateCount,
        @JsonProperty("last_seen_at") String lastSeenAt,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("deleted_at") String deletedAt) {

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }
}
