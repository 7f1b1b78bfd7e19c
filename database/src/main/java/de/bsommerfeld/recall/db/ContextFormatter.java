package de.bsommerfeld.recall.db;

import com.google.inject.Inject;
import de.bsommerfeld.recall.core.config.MemoryConfig;
import de.bsommerfeld.recall.core.domain.DetailLevel;
import de.bsommerfeld.recall.core.domain.Observation;
import de.bsommerfeld.recall.core.domain.Prompt;
import de.bsommerfeld.recall.core.domain.SearchResult;
import de.bsommerfeld.recall.core.domain.SessionSummary;

import java.util.List;

import static de.bsommerfeld.recall.core.text.TextNormalizer.truncate;

/**
 * Renders memory as markdown for injection into an assistant's context.
 */
public class ContextFormatter {

    static final int PROMPTS_IN_CONTEXT = 10;
    static final int SUMMARY_SNIPPET = 200;
    static final int CONTENT_SNIPPET = 300;

    private final MemoryStore store;
    private final MemoryConfig config;

    @Inject
    public ContextFormatter(MemoryStore store, MemoryConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * Recent sessions, prompts and observations as one markdown block.
     *
     * @return the block, or an empty string when there is nothing to show
     */
    public String formatContext(String project, String scope) {
        List<SessionSummary> sessions = store.recentSessions(project, SqlMemoryStore.DEFAULT_SESSION_LIMIT);
        List<Observation> observations = store.recentObservations(project, scope, config.getMaxContextResults());
        List<Prompt> prompts = store.recentPrompts(project, PROMPTS_IN_CONTEXT);

        if (sessions.isEmpty() && observations.isEmpty() && prompts.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder("## Memory from Previous Sessions\n\n");

        if (!sessions.isEmpty()) {
            sb.append("### Recent Sessions\n");
            for (SessionSummary s : sessions) {
                String summary = s.summary() == null ? "" : ": " + truncate(s.summary(), SUMMARY_SNIPPET);
                sb.append("- **").append(s.project()).append("** (").append(s.startedAt()).append(')')
                        .append(summary)
                        .append(" [").append(s.observationCount()).append(" observations]\n");
            }
            sb.append('\n');
        }

        if (!prompts.isEmpty()) {
            sb.append("### Recent User Prompts\n");
            for (Prompt p : prompts) {
                sb.append("- ").append(p.createdAt()).append(": ")
                        .append(truncate(p.content(), SUMMARY_SNIPPET)).append('\n');
            }
            sb.append('\n');
        }

        if (!observations.isEmpty()) {
            sb.append("### Recent Observations\n");
            for (Observation o : observations) {
                sb.append("- [").append(o.type()).append("] **").append(o.title()).append("**: ")
                        .append(truncate(o.content(), CONTENT_SNIPPET)).append('\n');
            }
            sb.append('\n');
        }

        return sb.toString();
    }

    /**
     * Numbered search listing. {@code SUMMARY} prints headlines only,
     * {@code STANDARD} adds a content snippet, {@code FULL} the whole content.
     */
    public static String formatSearchResults(List<SearchResult> results, DetailLevel level) {
        if (results.isEmpty()) {
            return "No memories found matching your query.";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(results.size()).append(" memories:\n\n");

        for (int i = 0; i < results.size(); i++) {
            Observation o = results.get(i).observation();
            sb.append('[').append(i + 1).append("] #").append(o.id())
                    .append(" (").append(o.type()).append(") - ").append(o.title()).append('\n');
            if (level == DetailLevel.SUMMARY) {
                continue;
            }

            String body = level == DetailLevel.FULL ? o.content() : truncate(o.content(), CONTENT_SNIPPET);
            String topic = o.topicKey() == null || o.topicKey().isEmpty() ? "" : " | topic: " + o.topicKey();
            sb.append("    ").append(body).append('\n')
                    .append("    ").append(o.project() == null ? "" : o.project()).append(topic)
                    .append(" | scope: ").append(o.scope().wire()).append("\n\n");
        }

        if (level == DetailLevel.SUMMARY) {
            sb.append(DetailLevel.SUMMARY_FOOTER);
        }
        return sb.toString();
    }

    /** Empty unless the listing was cut, e.g. {@code 📊 Showing 10 of 42 results.} */
    public static String navigationHint(int showing, int total, String hint) {
        if (showing >= total) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n📊 Showing ").append(showing).append(" of ").append(total)
                .append(" results.");
        if (hint != null && !hint.isBlank()) {
            sb.append(' ').append(hint);
        }
        return sb.toString();
    }
}
