package de.bsommerfeld.recall.core.domain;

/**
 * Free text to mine for learnings.
 *
 * @param source tag stored as the tool name of every saved learning
 */
public record PassiveCaptureRequest(String sessionId, String content, String project, String source) {
}
