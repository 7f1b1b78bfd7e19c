package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full logical dump of a store. Observations include soft-deleted rows.
 */
public record ExportData(
        @JsonProperty("version") String version,
        @JsonProperty("exported_at") String exportedAt,
        @JsonProperty("sessions") List<Session> sessions,
        @JsonProperty("observations") List<Observation> observations,
        @JsonProperty("prompts") List<Prompt> prompts) {

    public static final String FORMAT_VERSION = "0.1.0";

    public ExportData {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
        observations = observations == null ? List.of() : List.copyOf(observations);
        prompts = prompts == null ? List.of() : List.copyOf(prompts);
    }
}
