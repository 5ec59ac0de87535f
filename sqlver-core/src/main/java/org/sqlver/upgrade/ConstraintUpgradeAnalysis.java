package org.sqlver.upgrade;

import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.change.SchemaChange;

public class ConstraintUpgradeAnalysis extends UpgradeAnalysis {

    public ConstraintUpgradeAnalysis(SchemaObject before, SchemaObject after, SchemaChange removal) {
        super(before, after, removal);
        checkPreviousKind(SchemaObjectType.CONSTRAINT);
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.CONSTRAINT;
    }
}
