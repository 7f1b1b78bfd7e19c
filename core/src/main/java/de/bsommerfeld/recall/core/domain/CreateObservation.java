package de.bsommerfeld.recall.core.domain;

/**
 * Input for creating an observation. Optional fields may be {@code null} or
 * empty; {@code scope} is free-form and normalized by the store.
 */
public record CreateObservation(
        String sessionId,
        String type,
        String title,
        String content,
        String toolName,
        String project,
        String scope,
        String topicKey) {

    public CreateObservation(String sessionId, String type, String title, String content, String project) {
        this(sessionId, type, title, content, null, project, null, null);
    }

    public CreateObservation withScope(String scope) {
        return new CreateObservation(sessionId, type, title, content, toolName, project, scope, topicKey);
    }

    public CreateObservation withTopicKey(String topicKey) {
        return new CreateObservation(sessionId, type, title, content, toolName, project, scope, topicKey);
    }

    public CreateObservation withToolName(String toolName) {
        return new CreateObservation(sessionId, type, title, content, toolName, project, scope, topicKey);
    }
}
