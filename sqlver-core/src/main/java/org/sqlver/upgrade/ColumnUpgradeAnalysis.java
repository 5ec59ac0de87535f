package org.sqlver.upgrade;

import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.SchemaChange;

/**
 * Upgrade of a single column. Column-level constraints are diffed by the base analysis.
 */
public class ColumnUpgradeAnalysis extends UpgradeAnalysis {

    public ColumnUpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        super(before, after, removal);
        checkPreviousKind(SchemaObjectType.COLUMN);
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.COLUMN;
    }
}
