package work.forge.scaffold.runtime;

/**
 * What a step action reports back: either it emitted its artifacts, or a finer-grained check
 * inside the action decided there was nothing to emit.
 */
public record ActionResult(boolean skipped, String reason) {
    private static final ActionResult DONE = new ActionResult(false, null);

    public static ActionResult done() {
        return DONE;
    }

    public static ActionResult skipped(String reason) {
        return new ActionResult(true, reason);
    }
}
