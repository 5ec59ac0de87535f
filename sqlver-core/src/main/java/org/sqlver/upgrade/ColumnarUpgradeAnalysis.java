package org.sqlver.upgrade;

import org.sqlver.model.ColumnarSchemaObject;
import org.sqlver.model.Ordered;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.Change;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.model.change.SqlChange;
import org.sqlver.upgrade.model.UpgradeAnalysisProblem;

import java.util.ArrayList;
import java.util.List;

/**
 * Upgrade of a table or a view: on top of the base analysis the columns are matched between
 * both versions. Column-scoped changes of the current object take part in the column matching.
 */
public abstract class ColumnarUpgradeAnalysis extends UpgradeAnalysis {

    private final SchemaUpgradedSet columnUpgrades;

    protected ColumnarUpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        super(before, after, removal);
        if (after instanceof ColumnarSchemaObject afterColumnar) {
            List<Ordered> afterColumns = new ArrayList<>(afterColumnar.getColumns());
            for (Change c : afterColumnar.getChanges()) {
                if (c.getObjectType() == SchemaObjectType.COLUMN) {
                    afterColumns.add(c);
                }
            }
            // 새 객체는 빈 컬럼 목록과 비교한다
            List<? extends SchemaObject> beforeColumns = before instanceof ColumnarSchemaObject beforeColumnar
                    ? beforeColumnar.getColumns()
                    : List.of();
            this.columnUpgrades = new SchemaUpgradedSet(beforeColumns, afterColumns);
            errors.addAll(columnUpgrades.getErrors());
            // 새 객체의 컬럼은 객체와 함께 만들어지므로 implicit add 경고는 올리지 않는다
            if (before instanceof ColumnarSchemaObject) {
                warnings.addAll(columnUpgrades.getWarnings());
            }
            for (Change c : columnUpgrades.getStandAloneChanges()) {
                if (!(c instanceof SqlChange)) {
                    errors.add(new UpgradeAnalysisProblem(c, "invalid columnar change"));
                }
            }
        } else {
            this.columnUpgrades = null;
        }
    }

    /** Column matching, {@code null} when the object was removed. A new object is matched against no columns. */
    public SchemaUpgradedSet getColumnUpgrades() {
        return columnUpgrades;
    }

    @Override
    public boolean hasChanges() {
        return super.hasChanges() || (columnUpgrades != null && columnUpgrades.hasChanges());
    }
}
