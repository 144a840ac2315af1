package work.forge.scaffold.api;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import work.forge.scaffold.runtime.CancellationToken;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Immutable options for one generation run.
 *
 * @param overwrite replace existing artifacts instead of reporting conflicts
 * @param dryRun write into memory only; the report still lists every artifact
 * @param categories when non-empty, only steps of these categories run
 */
public record GenerateOptions(
    boolean overwrite,
    boolean dryRun,
    Set<StepCategory> categories,
    CancellationToken cancellationToken
) {
    public GenerateOptions {
        Objects.requireNonNull(cancellationToken, "cancellationToken");
        categories = categories == null || categories.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(categories));
    }

    public static GenerateOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean overwrite = true;
        private boolean dryRun;
        private Set<StepCategory> categories = Set.of();
        private CancellationToken cancellationToken = new CancellationToken();

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder categories(Set<StepCategory> categories) {
            this.categories = categories;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public GenerateOptions build() {
            return new GenerateOptions(overwrite, dryRun, categories, cancellationToken);
        }
    }
}
