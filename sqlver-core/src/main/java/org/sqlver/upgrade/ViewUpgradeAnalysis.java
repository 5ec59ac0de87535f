package org.sqlver.upgrade;

import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.SchemaChange;

public class ViewUpgradeAnalysis extends ColumnarUpgradeAnalysis {

    public ViewUpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        super(before, after, removal);
        checkPreviousKind(SchemaObjectType.VIEW);
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.VIEW;
    }
}
