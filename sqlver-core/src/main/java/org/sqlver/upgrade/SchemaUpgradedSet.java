package org.sqlver.upgrade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlver.model.Ordered;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.change.Change;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.upgrade.model.UpgradeAnalysisProblem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches the objects of a previous version against the objects and changes of the current one.
 *
 * <p>Objects are matched by full name; an object carrying a rename change is matched by the
 * previous name of that change. A remove change is matched by its previous name. Every other change
 * is kept as a stand-alone change. Objects of the previous version left unmatched are removed
 * implicitly.
 */
public class SchemaUpgradedSet {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaUpgradedSet.class);

    private final List<UpgradeAnalysis> upgrades = new ArrayList<>();
    private final List<Change> standAloneChanges = new ArrayList<>();
    private final List<UpgradeAnalysisProblem> errors = new ArrayList<>();
    private final List<UpgradeAnalysisProblem> warnings = new ArrayList<>();

    /**
     * @param beforeList objects of the previous version
     * @param afterList  objects and changes of the current version
     * @throws IllegalArgumentException when {@code afterList} holds something that is neither a
     *                                  schema object nor a change
     */
    public SchemaUpgradedSet(List<? extends SchemaObject> beforeList, List<? extends Ordered> afterList) {
        Objects.requireNonNull(beforeList, "beforeList must not be null");
        Objects.requireNonNull(afterList, "afterList must not be null");

        Map<String, SchemaObject> previous = new LinkedHashMap<>();
        for (SchemaObject obj : beforeList) {
            if (previous.putIfAbsent(obj.getFullName(), obj) != null) {
                errors.add(new UpgradeAnalysisProblem(obj, "duplicate name"));
            }
        }

        Map<String, SchemaObject> seenAfter = new LinkedHashMap<>();
        for (Ordered item : afterList) {
            if (item instanceof Change change) {
                if (change instanceof SchemaChange sc && sc.getChangeType() == ChangeType.REMOVE) {
                    SchemaObject matched = previous.remove(sc.getPreviousName());
                    if (matched == null) {
                        errors.add(new UpgradeAnalysisProblem(sc, "remove change has no known previous object"));
                    } else {
                        LOGGER.trace("Matched removal of {}", matched.getFullName());
                        upgrades.add(createUpgrade(matched, null, sc));
                    }
                } else {
                    standAloneChanges.add(change);
                }
            } else if (item instanceof SchemaObject obj) {
                if (seenAfter.putIfAbsent(obj.getFullName(), obj) != null) {
                    errors.add(new UpgradeAnalysisProblem(obj, "duplicate name"));
                    continue;
                }
                String matchName = previousNameOf(obj);
                SchemaObject matched = previous.remove(matchName);
                LOGGER.trace("Matched {} against previous '{}': {}", obj.getFullName(), matchName, matched != null);
                upgrades.add(createUpgrade(matched, obj, null));
            } else {
                throw new IllegalArgumentException("expected a schema object or a change, but found " + item);
            }
        }

        for (SchemaObject leftover : previous.values()) {
            warnings.add(new UpgradeAnalysisProblem(leftover, "no explicit removal for " + leftover.getFullName()));
            upgrades.add(createUpgrade(leftover, null, null));
        }

        for (UpgradeAnalysis upgrade : upgrades) {
            errors.addAll(upgrade.getErrors());
            warnings.addAll(upgrade.getWarnings());
        }

        LOGGER.debug("Matched {} upgrades and {} stand-alone changes ({} errors, {} warnings)",
                upgrades.size(), standAloneChanges.size(), errors.size(), warnings.size());
    }

    private static String previousNameOf(SchemaObject obj) {
        for (Change c : obj.getChanges()) {
            if (c instanceof SchemaChange sc && sc.getChangeType() == ChangeType.RENAME
                    && sc.getObjectType() == obj.getObjectType()) {
                return sc.getPreviousName();
            }
        }
        return obj.getFullName();
    }

    private static UpgradeAnalysis createUpgrade(SchemaObject before, SchemaObject after, SchemaChange removal) {
        SchemaObject basis = after != null ? after : before;
        return switch (basis.getObjectType()) {
            case TABLE -> new TableUpgradeAnalysis(before, after, removal);
            case VIEW -> new ViewUpgradeAnalysis(before, after, removal);
            case COLUMN -> new ColumnUpgradeAnalysis(before, after, removal);
            case CONSTRAINT -> new ConstraintUpgradeAnalysis(before, after, removal);
        };
    }

    public List<UpgradeAnalysis> getUpgrades() {
        return Collections.unmodifiableList(upgrades);
    }

    public List<Change> getStandAloneChanges() {
        return Collections.unmodifiableList(standAloneChanges);
    }

    /** Own problems followed by the problems of every upgrade. */
    public List<UpgradeAnalysisProblem> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<UpgradeAnalysisProblem> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasChanges() {
        return !standAloneChanges.isEmpty() || upgrades.stream().anyMatch(UpgradeAnalysis::hasChanges);
    }

    /**
     * Stand-alone changes and upgrades, in the order they must be applied.
     *
     * @throws org.sqlver.model.OrderCycleException when the before/after constraints form a cycle
     */
    public List<UpgradeStep> allUpgrades() {
        List<UpgradeStep> steps = new ArrayList<>(standAloneChanges.size() + upgrades.size());
        standAloneChanges.forEach(c -> steps.add(UpgradeStep.of(c)));
        upgrades.forEach(u -> steps.add(UpgradeStep.of(u)));
        return Ordered.fullSort(steps);
    }
}
