package de.bsommerfeld.recall.core.domain;

/**
 * Filters for observation search. {@code null} fields are not applied.
 *
 * @param limit requested result count, non-positive means the default
 */
public record SearchOptions(String type, String project, Scope scope, int limit) {

    public static SearchOptions none() {
        return new SearchOptions(null, null, null, 0);
    }

    public static SearchOptions forProject(String project) {
        return new SearchOptions(null, project, null, 0);
    }

    public SearchOptions withType(String type) {
        return new SearchOptions(type, project, scope, limit);
    }

    public SearchOptions withScope(Scope scope) {
        return new SearchOptions(type, project, scope, limit);
    }

    public SearchOptions withLimit(int limit) {
        return new SearchOptions(type, project, scope, limit);
    }
}
