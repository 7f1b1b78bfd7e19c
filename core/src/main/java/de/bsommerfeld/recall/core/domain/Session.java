package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A unit of work. The id is chosen by the caller; starting a session twice
 * keeps the original row.
 *
 * @param id        caller-supplied identifier
 * @param project   project the session worked on
 * @param directory working directory of the session
 * @param startedAt UTC start timestamp
 * @param endedAt   UTC end timestamp, {@code null} while the session is open
 * @param summary   closing summary, {@code null} when none was given
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Session(
        @JsonProperty("id") String id,
        @JsonProperty("project") String project,
        @JsonProperty("directory") String directory,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("ended_at") String endedAt,
        @JsonProperty("summary") String summary) {
}
