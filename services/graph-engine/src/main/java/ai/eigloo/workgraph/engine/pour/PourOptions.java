package ai.eigloo.workgraph.engine.pour;

import java.util.Set;

/**
 * Caller choices for a pour.
 *
 * @param title Workflow title override; null to render the playbook title
 * @param ephemeral Whether the poured workflow is disposable
 * @param tags Tags applied to the workflow
 */
public record PourOptions(String title, boolean ephemeral, Set<String> tags) {

    public PourOptions {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static PourOptions defaults() {
        return new PourOptions(null, false, Set.of());
    }

    public static PourOptions ephemeralPour() {
        return new PourOptions(null, true, Set.of());
    }

    public PourOptions withTitle(String newTitle) {
        return new PourOptions(newTitle, ephemeral, tags);
    }
}
