package org.sqlver.upgrade;

import lombok.Getter;
import org.sqlver.model.Order;
import org.sqlver.model.Ordered;
import org.sqlver.model.change.Change;

import java.util.Objects;

/**
 * One element of an upgrade plan: the upgrade of an object, or a change that stands on its own.
 */
@Getter
public final class UpgradeStep implements Ordered {

    public enum Type {
        SCHEMA, CHANGE
    }

    private final Type type;
    private final UpgradeAnalysis upgrade;
    private final Change change;

    private UpgradeStep(Type type, UpgradeAnalysis upgrade, Change change) {
        this.type = type;
        this.upgrade = upgrade;
        this.change = change;
    }

    public static UpgradeStep of(UpgradeAnalysis upgrade) {
        return new UpgradeStep(Type.SCHEMA, Objects.requireNonNull(upgrade, "upgrade must not be null"), null);
    }

    public static UpgradeStep of(Change change) {
        return new UpgradeStep(Type.CHANGE, null, Objects.requireNonNull(change, "change must not be null"));
    }

    @Override
    public Order getOrder() {
        return type == Type.SCHEMA ? upgrade.getOrder() : change.getOrder();
    }

    public String getName() {
        return type == Type.SCHEMA
                ? upgrade.getFullName()
                : change.getChangeType().displayName() + " " + change.getObjectType().displayName();
    }

    public void accept(UpgradeStepVisitor visitor) {
        switch (type) {
            case SCHEMA -> visitor.visitUpgrade(upgrade);
            case CHANGE -> visitor.visitChange(change);
        }
    }

    @Override
    public String toString() {
        return type + " " + getName() + " @" + getOrder();
    }
}
