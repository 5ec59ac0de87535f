package org.sqlver.cli.output;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqlver.model.ColumnModel;
import org.sqlver.model.Order;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.TableModel;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.model.change.SqlChange;
import org.sqlver.model.sql.SqlSet;
import org.sqlver.model.sql.SqlString;
import org.sqlver.upgrade.SchemaUpgradedSet;
import org.sqlver.upgrade.UpgradeAnalysis;
import org.sqlver.upgrade.UpgradeStep;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanPrinterTest {

    private int seq;

    @BeforeEach
    void setUp() {
        seq = 0;
    }

    private Order next() {
        return Order.of(0, 0, seq++);
    }

    private TableModel.TableModelBuilder table(String name) {
        return TableModel.builder().order(next()).name(name);
    }

    private ColumnModel column(String name) {
        return ColumnModel.builder().order(next()).name(name).valueType("int").build();
    }

    private static UpgradeAnalysis single(SchemaUpgradedSet set) {
        assertThat(set.getUpgrades()).hasSize(1);
        return set.getUpgrades().get(0);
    }

    @Test
    @DisplayName("업그레이드 요약: add, remove, rename")
    void summarizesKinds() {
        TableModel added = table("a").change(SchemaChange.of(next(), SchemaObjectType.TABLE, ChangeType.ADD, null)).build();
        TableModel old = table("old").build();
        TableModel renamed = table("new")
                .change(SchemaChange.of(next(), SchemaObjectType.TABLE, ChangeType.RENAME, "..old"))
                .column(column("id"))
                .build();

        assertThat(PlanPrinter.summarize(single(new SchemaUpgradedSet(List.of(), List.of(added)))))
                .isEqualTo("add table");
        assertThat(PlanPrinter.summarize(single(new SchemaUpgradedSet(List.of(old), List.of()))))
                .isEqualTo("remove table (implicit)");
        assertThat(PlanPrinter.summarize(single(new SchemaUpgradedSet(List.of(old), List.of(renamed)))))
                .isEqualTo("rename table from ..old, 1 column change(s)");
    }

    @Test
    @DisplayName("변경이 없는 업그레이드는 건너뛰고 SQL 변경은 플랫폼 SQL 과 함께 출력한다")
    void printsOnlyChangingSteps() {
        TableModel same = table("same").column(column("id")).build();
        SqlChange cleanup = SqlChange.builder()
                .order(next())
                .objectType(SchemaObjectType.TABLE)
                .affect("same")
                .sqlSet(SqlSet.of(
                        new SqlString("DELETE FROM same LIMIT 10", "native", List.of("mysql")),
                        SqlString.universal("DELETE FROM same")))
                .build();
        SchemaUpgradedSet set = new SchemaUpgradedSet(List.of(same), List.of(same, cleanup));
        List<UpgradeStep> steps = set.allUpgrades();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();

        int printed = new PlanPrinter(new PrintStream(buf, true), "mysql").print(steps);

        assertThat(steps).hasSize(2);
        assertThat(printed).isEqualTo(1);
        String nl = System.lineSeparator();
        assertThat(buf.toString()).isEqualTo(
                "001  same  sql table" + nl
                        + "       DELETE FROM same LIMIT 10" + nl);
    }

    private SqlChange sql(SchemaObjectType type, String statement) {
        return SqlChange.builder()
                .order(next())
                .objectType(type)
                .sqlSet(SqlSet.of(SqlString.universal(statement)))
                .build();
    }

    private static String render(SchemaUpgradedSet set) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        new PlanPrinter(new PrintStream(buf, true), "postgresql").print(set.allUpgrades());
        return buf.toString();
    }

    @Test
    @DisplayName("테이블과 컬럼에 붙은 SQL 변경도 요약 다음 줄에 플랫폼 SQL 로 출력한다")
    void printsSqlNestedInTable() {
        TableModel before = table("orders").column(column("id")).build();
        TableModel after = table("orders")
                .column(column("id"))
                .change(sql(SchemaObjectType.TABLE, "UPDATE orders SET id = id"))
                .change(sql(SchemaObjectType.COLUMN, "UPDATE orders SET id = 0"))
                .build();

        String nl = System.lineSeparator();
        assertThat(render(new SchemaUpgradedSet(List.of(before), List.of(after)))).isEqualTo(
                "001  ..orders  1 sql change(s), 1 column change(s)" + nl
                        + "       UPDATE orders SET id = id" + nl
                        + "       UPDATE orders SET id = 0" + nl);
    }

    @Test
    @DisplayName("새 테이블의 컬럼 SQL 변경도 출력한다")
    void printsColumnSqlOfNewTable() {
        TableModel added = table("audit")
                .column(column("id"))
                .change(SchemaChange.of(next(), SchemaObjectType.TABLE, ChangeType.ADD, null))
                .change(sql(SchemaObjectType.COLUMN, "UPDATE audit SET id = 1"))
                .build();

        String nl = System.lineSeparator();
        assertThat(render(new SchemaUpgradedSet(List.of(), List.of(added)))).isEqualTo(
                "001  ..audit  add table" + nl
                        + "       UPDATE audit SET id = 1" + nl);
    }
}
