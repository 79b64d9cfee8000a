package ai.eigloo.workgraph.engine.state;

/**
 * Options for {@link DerivedStateCalculator#ready(ReadyQuery)}.
 *
 * @param includeEphemeral include tasks of ephemeral workflows
 * @param limit maximum number of results after sorting, null for no limit
 */
public record ReadyQuery(boolean includeEphemeral, Integer limit) {

    public ReadyQuery {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
    }

    public static ReadyQuery defaults() {
        return new ReadyQuery(false, null);
    }

    public ReadyQuery withLimit(int newLimit) {
        return new ReadyQuery(includeEphemeral, newLimit);
    }

    public ReadyQuery withEphemeral() {
        return new ReadyQuery(true, limit);
    }
}
