package org.sqlver.upgrade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlver.model.Ordered;
import org.sqlver.upgrade.model.ReportedProblem;
import org.sqlver.upgrade.model.UpgradeAnalysisProblem;
import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaBranch;
import org.sqlver.version.SchemaProblem;
import org.sqlver.version.SchemaVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Upgrade of a whole branch from its parent version.
 *
 * <p>A branch without a parent is not an upgrade: nothing is diffed and the schema has to be
 * created from scratch. Otherwise both payloads are resolved (loading them when lazy) and diffed
 * once, at construction.
 */
public class BranchUpgradeAnalysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(BranchUpgradeAnalysis.class);

    private final SchemaBranch branch;
    private final SchemaVersion currentVersion;
    private final SchemaVersion previousVersion;
    private final SchemaUpgradedSet upgradeSet;
    private final List<UpgradeStep> changes;
    private final List<ReportedProblem> problems;

    public BranchUpgradeAnalysis(SchemaBranch branch) {
        this.branch = Objects.requireNonNull(branch, "branch must not be null");
        this.currentVersion = branch.getPayload();
        this.previousVersion = branch.getParent().map(SchemaBranch::getPayload).orElse(null);

        if (previousVersion == null) {
            LOGGER.debug("{} has no parent, no upgrade to analyze", branch);
            this.upgradeSet = null;
            this.changes = List.of();
        } else {
            List<Ordered> target = new ArrayList<>(currentVersion.getTopChanges());
            target.addAll(currentVersion.getSchema());
            this.upgradeSet = new SchemaUpgradedSet(previousVersion.getSchema(), target);
            this.changes = upgradeSet.allUpgrades();
            LOGGER.debug("Analyzed {} -> {}: {} steps", previousVersion.getVersion(), currentVersion.getVersion(), changes.size());
        }
        this.problems = collectProblems();
    }

    private List<ReportedProblem> collectProblems() {
        List<ReportedProblem> ret = new ArrayList<>();
        for (SchemaProblem p : currentVersion.getProblems()) {
            ret.add(ReportedProblem.of(currentVersion.getVersion(), p));
        }
        if (previousVersion != null) {
            for (SchemaProblem p : previousVersion.getProblems()) {
                ret.add(ReportedProblem.of(previousVersion.getVersion(), p));
            }
        }
        if (upgradeSet != null) {
            for (UpgradeAnalysisProblem p : upgradeSet.getErrors()) {
                ret.add(ReportedProblem.of(ProblemLevel.ERROR, currentVersion.getVersion(), p));
            }
            for (UpgradeAnalysisProblem p : upgradeSet.getWarnings()) {
                ret.add(ReportedProblem.of(ProblemLevel.WARNING, currentVersion.getVersion(), p));
            }
        }
        return Collections.unmodifiableList(ret);
    }

    public SchemaBranch getBranch() {
        return branch;
    }

    public SchemaVersion getCurrentVersion() {
        return currentVersion;
    }

    /** Payload of the parent branch, {@code null} when this is not an upgrade. */
    public SchemaVersion getPreviousVersion() {
        return previousVersion;
    }

    public boolean isUpgrade() {
        return upgradeSet != null;
    }

    /** The diff, {@code null} when this is not an upgrade. */
    public SchemaUpgradedSet getUpgradeSet() {
        return upgradeSet;
    }

    /** Ordered upgrade steps; empty when this is not an upgrade. */
    public List<UpgradeStep> getChanges() {
        return changes;
    }

    /**
     * Parse problems of the current version, then of the parent, then the problems of the diff.
     */
    public List<ReportedProblem> getProblems() {
        return problems;
    }

    public boolean hasErrors() {
        return problems.stream().anyMatch(ReportedProblem::isBlocking);
    }
}
