package org.sqlver.upgrade;

import org.sqlver.model.change.Change;

public interface UpgradeStepVisitor {
    void visitUpgrade(UpgradeAnalysis upgrade);

    void visitChange(Change change);
}
