package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A saved user prompt. Prompts are write-once.
 *
 * @param project project name, empty string when none was given
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Prompt(
        @JsonProperty("id") long id,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("content") String content,
        @JsonProperty("project") String project,
        @JsonProperty("created_at") String createdAt) {
}
