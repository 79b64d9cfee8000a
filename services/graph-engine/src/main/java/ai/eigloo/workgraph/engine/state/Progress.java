package ai.eigloo.workgraph.engine.state;

/**
 * Roll-up of the member tasks of a plan or workflow.
 *
 * <p>{@code open}, {@code inProgress} and {@code blocked} count stored statuses;
 * {@code readyTasks} and {@code blockedTasks} are derived from the graph.</p>
 */
public record Progress(
        String containerId,
        int total,
        int closed,
        int cancelled,
        int open,
        int inProgress,
        int blocked,
        int readyTasks,
        int blockedTasks,
        int percentComplete) {

    /**
     * Rounded {@code closed / (total - cancelled)} as a percentage, 0 when nothing countable remains.
     */
    public static int percentComplete(int total, int closed, int cancelled) {
        int denominator = total - cancelled;
        if (denominator <= 0) {
            return 0;
        }
        return (int) Math.round(closed * 100.0 / denominator);
    }
}
