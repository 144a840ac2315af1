package work.forge.scaffold.runtime;

/**
 * Cooperative cancellation flag, observed by the engine between steps only.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
