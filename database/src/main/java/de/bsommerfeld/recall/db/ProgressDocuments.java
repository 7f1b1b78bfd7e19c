package de.bsommerfeld.recall.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import de.bsommerfeld.recall.core.domain.CreateObservation;
import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.Scope;
import de.bsommerfeld.recall.core.error.MemoryException;

import java.util.Optional;

/**
 * One living JSON progress document per project, stored as an observation
 * under topic key {@code progress/<project>} so every save replaces the
 * previous revision.
 */
public class ProgressDocuments {

    static final String TYPE = "progress";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MemoryStore store;

    @Inject
    public ProgressDocuments(MemoryStore store) {
        this.store = store;
    }

    static String topicKey(String project) {
        return "progress/" + project;
    }

    /**
     * @param json      the document, must parse as JSON
     * @param sessionId owning session, {@link MemoryStore#MANUAL_SESSION} when blank
     * @return id of the progress observation
     */
    public long save(String project, String json, String sessionId) {
        requireProject(project);
        if (json == null || json.isBlank()) {
            throw MemoryException.invalidArgument("progress content is required");
        }
        try {
            MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw MemoryException.invalidArgument("progress content must be valid JSON: " + e.getOriginalMessage());
        }

        String session = sessionId == null || sessionId.isBlank() ? MemoryStore.MANUAL_SESSION : sessionId;
        if (session.equals(MemoryStore.MANUAL_SESSION)) {
            store.startSession(session, project, "");
        }

        return store.createObservation(new CreateObservation(session, TYPE, "Progress: " + project, json,
                null, project, Scope.PROJECT.wire(), topicKey(project)));
    }

    public Optional<Observation> read(String project) {
        requireProject(project);
        return store.findByTopicKey(topicKey(project), project, Scope.PROJECT.wire());
    }

    private static void requireProject(String project) {
        if (project == null || project.isBlank()) {
            throw MemoryException.invalidArgument("project is required");
        }
    }
}
