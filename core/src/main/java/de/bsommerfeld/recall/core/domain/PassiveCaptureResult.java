package de.bsommerfeld.recall.core.domain;

public record PassiveCaptureResult(int extracted, int saved, int duplicates) {
}
