package org.sqlver.cli.output;

import org.sqlver.model.change.Change;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.model.change.SqlChange;
import org.sqlver.model.sql.SqlString;
import org.sqlver.upgrade.ColumnarUpgradeAnalysis;
import org.sqlver.upgrade.UpgradeAnalysis;
import org.sqlver.upgrade.UpgradeStep;
import org.sqlver.upgrade.UpgradeStepVisitor;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Prints an upgrade plan, one numbered line per step that changes something:
 * {@code NNN  name  summary}. Raw SQL changes are followed by their statement for the platform,
 * including the ones nested in a table, view, column or constraint upgrade.
 */
public class PlanPrinter implements UpgradeStepVisitor {

    private final PrintStream out;
    private final String platform;
    private int index;

    public PlanPrinter(PrintStream out, String platform) {
        this.out = out;
        this.platform = platform;
    }

    /**
     * @return number of printed steps
     */
    public int print(List<UpgradeStep> steps) {
        for (UpgradeStep step : steps) {
            step.accept(this);
        }
        return index;
    }

    @Override
    public void visitUpgrade(UpgradeAnalysis upgrade) {
        if (!upgrade.hasChanges()) {
            return;
        }
        line(upgrade.getFullName(), summarize(upgrade));
        List<SqlChange> nested = new ArrayList<>();
        collectSql(upgrade, nested);
        nested.sort(Comparator.comparing(SqlChange::getOrder));
        nested.forEach(this::printSql);
    }

    @Override
    public void visitChange(Change change) {
        String name = change.getAffects().isEmpty() ? "-" : String.join(",", change.getAffects());
        String summary = change.getChangeType().displayName() + " " + change.getObjectType().displayName();
        if (change.getComment() != null) {
            summary += " (" + change.getComment() + ")";
        }
        line(name, summary);
        if (change instanceof SqlChange sql) {
            printSql(sql);
        }
    }

    private void printSql(SqlChange sql) {
        Optional<SqlString> statement = sql.getSqlSet().forPlatform(platform);
        out.println(statement
                .map(s -> "       " + s.getSql().strip())
                .orElse("       -- no sql for platform " + platform));
    }

    // 객체 자신의 SQL 변경, 독립 컬럼 SQL 변경, 하위 컬럼과 제약조건의 SQL 변경
    private static void collectSql(UpgradeAnalysis upgrade, List<SqlChange> into) {
        for (Change c : upgrade.getChanges(ChangeType.SQL)) {
            into.add((SqlChange) c);
        }
        if (upgrade instanceof ColumnarUpgradeAnalysis columnar && columnar.getColumnUpgrades() != null) {
            for (Change c : columnar.getColumnUpgrades().getStandAloneChanges()) {
                if (c instanceof SqlChange sql) {
                    into.add(sql);
                }
            }
            for (UpgradeAnalysis column : columnar.getColumnUpgrades().getUpgrades()) {
                collectSql(column, into);
            }
        }
        for (UpgradeAnalysis constraint : upgrade.getConstraintUpgrades().getUpgrades()) {
            collectSql(constraint, into);
        }
    }

    private void line(String name, String summary) {
        index++;
        out.printf("%03d  %s  %s%n", index, name, summary);
    }

    static String summarize(UpgradeAnalysis upgrade) {
        String type = upgrade.getObjectType().displayName();
        if (upgrade.isAdd()) {
            return "add " + type;
        }
        if (upgrade.isRemove()) {
            return upgrade.isImplicitRemove() ? "remove " + type + " (implicit)" : "remove " + type;
        }

        List<String> parts = new ArrayList<>();
        for (Change c : upgrade.getChanges(ChangeType.RENAME)) {
            parts.add("rename " + type + " from " + ((SchemaChange) c).getPreviousName());
        }
        if (!upgrade.getChanges(ChangeType.ALTER).isEmpty()) {
            parts.add("alter " + type);
        }
        if (!upgrade.getChanges(ChangeType.SQL).isEmpty()) {
            parts.add(upgrade.getChanges(ChangeType.SQL).size() + " sql change(s)");
        }
        if (upgrade instanceof ColumnarUpgradeAnalysis columnar && columnar.getColumnUpgrades() != null) {
            long columns = columnar.getColumnUpgrades().getUpgrades().stream()
                    .filter(UpgradeAnalysis::hasChanges)
                    .count() + columnar.getColumnUpgrades().getStandAloneChanges().size();
            if (columns > 0) {
                parts.add(columns + " column change(s)");
            }
        }
        long constraints = upgrade.getConstraintUpgrades().getUpgrades().stream()
                .filter(UpgradeAnalysis::hasChanges)
                .count();
        if (constraints > 0) {
            parts.add(constraints + " constraint change(s)");
        }
        return parts.isEmpty() ? "upgrade " + type : String.join(", ", parts);
    }
}
