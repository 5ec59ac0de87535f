package org.sqlver.upgrade;

import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.SchemaChange;

public class TableUpgradeAnalysis extends ColumnarUpgradeAnalysis {

    public TableUpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        super(before, after, removal);
        checkPreviousKind(SchemaObjectType.TABLE);
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.TABLE;
    }
}
