package org.sqlver.upgrade;

import org.sqlver.model.ColumnarSchemaObject;
import org.sqlver.model.Order;
import org.sqlver.model.Ordered;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.Change;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.upgrade.model.UpgradeAnalysisProblem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Diff of one schema object between the previous version ({@code before}) and the current one.
 *
 * <p>The current side is either the object itself, a remove change standing in for it, or nothing
 * at all (the object silently disappeared). At least one side is always present. Problems in the
 * authored changes are collected, never thrown.
 */
public abstract class UpgradeAnalysis implements Ordered {

    private final SchemaObject before;
    private final SchemaObject after;
    private final SchemaChange removal;

    private final List<Change> changes;
    private final Map<ChangeType, List<Change>> changesByType;
    private final SchemaUpgradedSet constraintUpgrades;

    protected final List<UpgradeAnalysisProblem> errors = new ArrayList<>();
    protected final List<UpgradeAnalysisProblem> warnings = new ArrayList<>();

    /**
     * @param before  object in the previous version, or {@code null} when it is new
     * @param after   object in the current version, or {@code null} when it was removed
     * @param removal remove change replacing {@code after}, or {@code null}
     */
    protected UpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        if (after != null && removal != null) {
            throw new IllegalArgumentException("an upgrade cannot have both an object and a removal as target");
        }
        if (removal != null && removal.getChangeType() != ChangeType.REMOVE) {
            throw new IllegalArgumentException("removal target must be a remove change, but found " + removal);
        }
        if (before == null && after == null && removal == null) {
            throw new IllegalArgumentException("an upgrade needs a previous or a current object");
        }
        if (before == null && removal != null) {
            throw new IllegalArgumentException("cannot remove an object that has no previous version");
        }
        this.before = before;
        this.after = after;
        this.removal = removal;

        if (removal != null) {
            this.changes = List.of(removal);
        } else if (after != null) {
            this.changes = ownChanges(after);
        } else {
            this.changes = List.of();
            warnings.add(new UpgradeAnalysisProblem(before, "implicit removal of object"));
        }
        this.changesByType = categorize(changes);
        validateChanges();

        this.constraintUpgrades = new SchemaUpgradedSet(
                before == null ? List.of() : before.getConstraints(),
                after == null ? List.of() : after.getConstraints());
        errors.addAll(constraintUpgrades.getErrors());
        // 객체 자체가 제거되면 제약조건은 함께 사라지므로 경고는 올리지 않는다
        if (after != null) {
            warnings.addAll(constraintUpgrades.getWarnings());
        }
    }

    // 컬럼 대상 변경은 컬럼 매칭에서 처리
    private static List<Change> ownChanges(SchemaObject after) {
        if (!(after instanceof ColumnarSchemaObject)) {
            return List.copyOf(after.getChanges());
        }
        return after.getChanges().stream()
                .filter(c -> c.getObjectType() != SchemaObjectType.COLUMN)
                .toList();
    }

    private static Map<ChangeType, List<Change>> categorize(List<Change> changes) {
        Map<ChangeType, List<Change>> ret = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            ret.put(type, new ArrayList<>());
        }
        for (Change c : changes) {
            ret.get(c.getChangeType()).add(c);
        }
        ret.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(ret);
    }

    private void validateChanges() {
        Object subject = getSubject();
        int structural = 0;
        for (ChangeType type : ChangeType.values()) {
            if (!type.isStructural()) {
                continue;
            }
            int count = changesByType.get(type).size();
            if (count > 1) {
                errors.add(new UpgradeAnalysisProblem(subject, "at most 1 " + type.displayName() + " is allowed"));
            }
            structural += count;
        }
        int partial = changesByType.get(ChangeType.ALTER).size() + changesByType.get(ChangeType.SQL).size();
        if (structural > 1 || (structural > 0 && partial > 0)) {
            errors.add(new UpgradeAnalysisProblem(subject,
                    "at most 1 of an add, remove, or rename is allowed, and it cannot be done with an alter or sql change"));
        }

        if (before == null) {
            if (changesByType.get(ChangeType.ADD).isEmpty()) {
                warnings.add(new UpgradeAnalysisProblem(subject, "implicit add"));
            }
            if (!changesByType.get(ChangeType.REMOVE).isEmpty()
                    || !changesByType.get(ChangeType.RENAME).isEmpty()
                    || !changesByType.get(ChangeType.ALTER).isEmpty()) {
                errors.add(new UpgradeAnalysisProblem(subject, "can only add due to no previous version found"));
            }
        }
    }

    /**
     * Reports a previous object of another kind than this analysis handles.
     */
    protected final void checkPreviousKind(SchemaObjectType expected) {
        if (before != null && before.getObjectType() != expected) {
            errors.add(new UpgradeAnalysisProblem(getSubject(),
                    "cannot upgrade directly from a " + before.getObjectType().displayName()
                            + " to a " + expected.displayName()));
        }
    }

    /** Kind of schema object this analysis handles. */
    public abstract SchemaObjectType getObjectType();

    public SchemaObject getBefore() {
        return before;
    }

    /** The current object, {@code null} when the object was removed. */
    public SchemaObject getAfter() {
        return after;
    }

    /** The explicit remove change, {@code null} unless the object was removed on purpose. */
    public SchemaChange getRemoval() {
        return removal;
    }

    public boolean isAdd() {
        return before == null;
    }

    public boolean isRemove() {
        return after == null;
    }

    public boolean isImplicitRemove() {
        return after == null && removal == null;
    }

    /** Authored changes of the current object; the remove change for an explicit removal. */
    public List<Change> getChanges() {
        return changes;
    }

    public List<Change> getChanges(ChangeType type) {
        return changesByType.get(type);
    }

    public SchemaUpgradedSet getConstraintUpgrades() {
        return constraintUpgrades;
    }

    public List<UpgradeAnalysisProblem> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<UpgradeAnalysisProblem> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * True when the object is added or removed, carries authored changes, or when its
     * constraints changed.
     */
    public boolean hasChanges() {
        return isAdd() || isRemove() || !changes.isEmpty() || constraintUpgrades.hasChanges();
    }

    /** Order of the current object, else of the removal, else of the previous object. */
    @Override
    public Order getOrder() {
        if (after != null) {
            return after.getOrder();
        }
        if (removal != null) {
            return removal.getOrder();
        }
        return before.getOrder();
    }

    /** Name of the current object, or of the previous one when it was removed. */
    public String getName() {
        return after != null ? after.getName() : before.getName();
    }

    public String getFullName() {
        return after != null ? after.getFullName() : before.getFullName();
    }

    protected Object getSubject() {
        return after != null ? after : before;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + (before == null ? "-" : before.getFullName())
                + " -> " + (after != null ? after.getFullName() : removal != null ? "remove" : "-") + ")";
    }
}
