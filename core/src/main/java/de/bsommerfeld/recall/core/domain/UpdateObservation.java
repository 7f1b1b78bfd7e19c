package de.bsommerfeld.recall.core.domain;

/**
 * Partial update. A {@code null} field keeps the stored value.
 */
public record UpdateObservation(
        String type,
        String title,
        String content,
        String project,
        String scope,
        String topicKey) {

    public static UpdateObservation empty() {
        return new UpdateObservation(null, null, null, null, null, null);
    }

    public UpdateObservation withType(String type) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }

    public UpdateObservation withTitle(String title) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }

    public UpdateObservation withContent(String content) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }

    public UpdateObservation withProject(String project) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }

    public UpdateObservation withScope(String scope) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }

    public UpdateObservation withTopicKey(String topicKey) {
        return new UpdateObservation(type, title, content, project, scope, topicKey);
    }
}
