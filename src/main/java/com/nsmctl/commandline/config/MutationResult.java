package com.nsmctl.commandline.config;

import java.util.Optional;

import com.nsmctl.commandline.report.TabularReport;

/**
 * Outcome of one pass over a config object: either a read-only report (nothing selected or supplied) or the
 * mutated object for the caller to persist. Never both.
 */
public final class MutationResult<C> {

    public enum Outcome {
        REPORT, MUTATED
    }

    private final Outcome outcome;
    private final TabularReport report;
    private final C config;
    private final ChangeSet changeSet;

    private MutationResult(Outcome outcome, TabularReport report, C config, ChangeSet changeSet) {
        this.outcome = outcome;
        this.report = report;
        this.config = config;
        this.changeSet = changeSet;
    }

    public static <C> MutationResult<C> report(TabularReport report) {
        return new MutationResult<>(Outcome.REPORT, report, null, new ChangeSet());
    }

    public static <C> MutationResult<C> mutated(C config, ChangeSet changeSet) {
        if (changeSet.isEmpty()) {
            throw new IllegalArgumentException("A mutated result needs at least one change");
        }
        return new MutationResult<>(Outcome.MUTATED, null, config, changeSet);
    }

    public boolean isMutated() {
        return outcome == Outcome.MUTATED;
    }

    public Optional<TabularReport> getReport() {
        return Optional.ofNullable(report);
    }

    public Optional<C> getConfig() {
        return Optional.ofNullable(config);
    }

    public ChangeSet getChangeSet() {
        return changeSet;
    }

    @Override
    public String toString() {
        return isMutated() ? changeSet.toString() : report.render();
    }
}
