package io.colframe.core;

/**
 * Immutable configuration for the relational operators.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * ColframeConfiguration config = ColframeConfiguration.builder()
 *     .collisionSuffix("_dup")
 *     .sortBeforeGrouping(false)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.colframe.runtime.DataFrameOperations
 */
public final class ColframeConfiguration {

    private static final ColframeConfiguration DEFAULTS = builder().build();

    // Join column naming
    private final String collisionSuffix;
    private final String leftSuffix;
    private final String rightSuffix;

    // Grouping
    private final boolean sortBeforeGrouping;

    // Dispatch
    private final boolean planCacheEnabled;

    private ColframeConfiguration(Builder builder) {
        this.collisionSuffix = builder.collisionSuffix;
        this.leftSuffix = builder.leftSuffix;
        this.rightSuffix = builder.rightSuffix;
        this.sortBeforeGrouping = builder.sortBeforeGrouping;
        this.planCacheEnabled = builder.planCacheEnabled;
    }

    /**
     * Create a new builder for ColframeConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The shared default configuration.
     */
    public static ColframeConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Suffix appended, possibly several times, to a right-side join column whose
     * name collides with an earlier output column.
     *
     * @return collision suffix (default: "_y")
     */
    public String collisionSuffix() {
        return collisionSuffix;
    }

    /**
     * Default suffix applied to left-side columns of a join.
     *
     * @return left suffix (default: empty)
     */
    public String leftSuffix() {
        return leftSuffix;
    }

    /**
     * Default suffix applied to right-side columns of a join.
     *
     * @return right suffix (default: empty)
     */
    public String rightSuffix() {
        return rightSuffix;
    }

    /**
     * Whether group-by and join sort their inputs when the caller does not say.
     *
     * @return true if inputs are sorted by default
     */
    public boolean sortBeforeGrouping() {
        return sortBeforeGrouping;
    }

    /**
     * Whether resolved key plans are cached by kind tuple.
     *
     * @return true if the plan cache is enabled (default: true)
     */
    public boolean planCacheEnabled() {
        return planCacheEnabled;
    }

    /**
     * Builder for ColframeConfiguration.
     */
    public static class Builder {
        private String collisionSuffix = "_y";
        private String leftSuffix = "";
        private String rightSuffix = "";
        private boolean sortBeforeGrouping = true;
        private boolean planCacheEnabled = true;

        private Builder() {
        }

        /**
         * Set the suffix used to deduplicate colliding right-side join columns.
         *
         * @param collisionSuffix non-empty suffix
         * @return this builder for method chaining
         */
        public Builder collisionSuffix(String collisionSuffix) {
            if (collisionSuffix == null || collisionSuffix.isEmpty()) {
                throw new IllegalArgumentException("collisionSuffix must not be empty");
            }
            this.collisionSuffix = collisionSuffix;
            return this;
        }

        public Builder leftSuffix(String leftSuffix) {
            this.leftSuffix = leftSuffix == null ? "" : leftSuffix;
            return this;
        }

        public Builder rightSuffix(String rightSuffix) {
            this.rightSuffix = rightSuffix == null ? "" : rightSuffix;
            return this;
        }

        /**
         * Set the default sort flag of group-by and join.
         *
         * @param sortBeforeGrouping false to assume inputs are already sorted
         * @return this builder for method chaining
         */
        public Builder sortBeforeGrouping(boolean sortBeforeGrouping) {
            this.sortBeforeGrouping = sortBeforeGrouping;
            return this;
        }

        /**
         * Enable or disable caching of resolved key plans.
         *
         * @param planCacheEnabled true to cache plans by kind tuple
         * @return this builder for method chaining
         */
        public Builder planCacheEnabled(boolean planCacheEnabled) {
            this.planCacheEnabled = planCacheEnabled;
            return this;
        }

        /**
         * Build the immutable ColframeConfiguration.
         *
         * @return a new ColframeConfiguration instance
         */
        public ColframeConfiguration build() {
            return new ColframeConfiguration(this);
        }
    }
}
