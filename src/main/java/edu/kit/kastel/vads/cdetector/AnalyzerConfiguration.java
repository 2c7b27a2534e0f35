package edu.kit.kastel.vads.cdetector;

import java.util.EnumSet;
import java.util.Set;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;

/// Immutable settings of one detector instance.
///
/// {@code callsSatisfyLoopGuards}: a call inside a loop exit guard may make the guard true.
/// {@code proveMonotonicBounds}: a counter that only moves one way may prove an exit unreachable.
public record AnalyzerConfiguration(
    Set<AnalysisGroup> enabledGroups,
    boolean parallel,
    boolean reportUncheckedAllocation,
    boolean callsSatisfyLoopGuards,
    boolean proveMonotonicBounds,
    int headerEditDistance
) {
    public static final AnalyzerConfiguration DEFAULT = new Builder().build();

    public AnalyzerConfiguration {
        enabledGroups = Set.copyOf(enabledGroups);
        if (headerEditDistance < 0) {
            throw new IllegalArgumentException("header edit distance must not be negative: " + headerEditDistance);
        }
    }

    public boolean isEnabled(AnalysisGroup group) {
        return enabledGroups().contains(group);
    }

    public static class Builder {
        private final Set<AnalysisGroup> enabledGroups = EnumSet.allOf(AnalysisGroup.class);
        private boolean parallel;
        private boolean reportUncheckedAllocation;
        private boolean callsSatisfyLoopGuards = true;
        private boolean proveMonotonicBounds = true;
        private int headerEditDistance = 2;

        public Builder setEnabled(AnalysisGroup group, boolean enabled) {
            if (enabled) {
                this.enabledGroups.add(group);
            } else {
                this.enabledGroups.remove(group);
            }
            return this;
        }

        public Builder setOnly(AnalysisGroup... groups) {
            this.enabledGroups.clear();
            this.enabledGroups.addAll(Set.of(groups));
            return this;
        }

        public Builder setParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder setReportUncheckedAllocation(boolean reportUncheckedAllocation) {
            this.reportUncheckedAllocation = reportUncheckedAllocation;
            return this;
        }

        public Builder setCallsSatisfyLoopGuards(boolean callsSatisfyLoopGuards) {
            this.callsSatisfyLoopGuards = callsSatisfyLoopGuards;
            return this;
        }

        public Builder setProveMonotonicBounds(boolean proveMonotonicBounds) {
            this.proveMonotonicBounds = proveMonotonicBounds;
            return this;
        }

        public Builder setHeaderEditDistance(int headerEditDistance) {
            this.headerEditDistance = headerEditDistance;
            return this;
        }

        public AnalyzerConfiguration build() {
            return new AnalyzerConfiguration(enabledGroups, parallel, reportUncheckedAllocation,
                callsSatisfyLoopGuards, proveMonotonicBounds, headerEditDistance);
        }
    }
}
