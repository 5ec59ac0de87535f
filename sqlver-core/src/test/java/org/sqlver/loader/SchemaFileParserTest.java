package org.sqlver.loader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlver.model.ColumnModel;
import org.sqlver.model.ConstraintModel;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.TableModel;
import org.sqlver.model.ViewModel;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.model.change.SqlChange;
import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaProblem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaFileParserTest {

    private static final String PRICE_YAML = """
            # Simple table that contains the data input.
            table:
              name: PRICE
              columns:
              - column:
                  name: Price_Id
                  type: int
                  autoIncrement: true
                  constraints:
                  - constraint:
                      type: primary key
                      name: Price__Price_Id__Key
              - column:
                  name: Product_Sku
                  type: nvarchar(255)
                  constraints:
                  - constraint:
                      type: not null
                  - constraint:
                      type: unique index
                      name: Price__Product_Sku__Idx
              - column:
                  name: Price
                  type: float
                  constraints:
                  - constraint:
                      type: not null
                  - constraint:
                      type: value restriction
                      message: price must be non-negative
                      dialects:
                      - dialect:
                          platforms: all
                          sql: "{Price} >= 0.0"
            """;

    @TempDir
    Path tempDir;

    private SchemaFileParser parser;

    @BeforeEach
    void setUp() {
        parser = new SchemaFileParser(new OrderSequencer());
    }

    private ParsedSchema parse(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content);
        return parser.parse(file, fileName);
    }

    @Test
    @DisplayName("테이블, 컬럼, 컬럼 제약조건을 읽는다")
    void parsesTableWithColumnConstraints() throws IOException {
        ParsedSchema parsed = parse("02_price.yaml", PRICE_YAML);

        assertThat(parsed.getProblems()).isEmpty();
        assertThat(parsed.getSchema()).singleElement().isInstanceOf(TableModel.class);
        TableModel price = (TableModel) parsed.getSchema().get(0);
        assertThat(price.getName()).isEqualTo("PRICE");
        assertThat(price.getOrder().getLabel()).isEqualTo("price");
        assertThat(price.getColumns()).extracting(ColumnModel::getName)
                .containsExactly("Price_Id", "Product_Sku", "Price");

        ColumnModel id = price.getColumns().get(0);
        assertThat(id.isAutoIncrement()).isTrue();
        assertThat(id.getValueType()).isEqualTo("int");
        assertThat(id.getConstraints()).singleElement().satisfies(c -> {
            assertThat(c.getConstraintType()).isEqualTo("primarykey");
            assertThat(c.getFullName()).isEqualTo("Price__Price_Id__Key");
            assertThat(c.getColumnNames()).containsExactly("Price_Id");
        });

        ConstraintModel restriction = price.getColumns().get(2).getConstraints().get(1);
        assertThat(restriction.getConstraintType()).isEqualTo("valuerestriction");
        assertThat(restriction.getDetails()).containsEntry("message", "price must be non-negative");
        assertThat(restriction.getSql().forPlatform("mysql")).hasValueSatisfying(
                s -> assertThat(s.getSql()).isEqualTo("{Price} >= 0.0"));
    }

    @Test
    @DisplayName("선언 순서대로 order 가 증가한다")
    void ordersFollowDeclaration() throws IOException {
        ParsedSchema parsed = parse("01.yaml", """
                tables:
                - table:
                    name: a
                - table:
                    name: b
                    order: 10
                - table:
                    name: c
                """);

        assertThat(parsed.getSchema()).extracting(o -> o.getOrder().getSequence()).containsExactly(0, 10, 11);
        assertThat(parsed.getSchema()).extracting(o -> o.getOrder().getGroup()).containsOnly(0);
    }

    @Test
    @DisplayName("before/after 는 테이블에선 order 라벨, 컬럼에선 위치 힌트")
    void beforeAndAfterDependOnElement() throws IOException {
        ParsedSchema parsed = parse("01.yaml", """
                table:
                  name: orders
                  schema: shop
                  after: shop.customers
                  columns:
                  - column:
                      name: total
                      type: int
                      after: id
                      orderBefore: shop.orders
                """);

        TableModel orders = (TableModel) parsed.getSchema().get(0);
        assertThat(orders.getOrder().getLabel()).isEqualTo("shop.orders");
        assertThat(orders.getOrder().getOccursAfter()).containsExactly("shop.customers");

        ColumnModel total = orders.getColumns().get(0);
        assertThat(total.getAfterColumn()).isEqualTo("id");
        assertThat(total.getOrder().getOccursAfter()).isEmpty();
        assertThat(total.getOrder().getOccursBefore()).containsExactly("shop.orders");
    }

    @Test
    @DisplayName("키 이름은 대소문자, 공백, '_', '-' 를 무시한다")
    void keysAreNormalized() throws IOException {
        ParsedSchema parsed = parse("01.yaml", """
                Table:
                  Table_Name: t
                  columns:
                  - column:
                      name: id
                      Auto-Increment: yes
                """);

        assertThat(parsed.getProblems()).isEmpty();
        TableModel t = (TableModel) parsed.getSchema().get(0);
        assertThat(t.getColumns().get(0).isAutoIncrement()).isTrue();
    }

    @Test
    @DisplayName("알 수 없는 키는 경고, 이름이 없는 테이블은 치명적 문제")
    void reportsProblemsWithoutThrowing() throws IOException {
        ParsedSchema parsed = parse("bad.yaml", """
                colour: blue
                tables:
                - table:
                    comment: no name here
                - view:
                    name: v
                """);

        assertThat(parsed.getSchema()).isEmpty();
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getLevel)
                .containsExactly(ProblemLevel.WARNING, ProblemLevel.FATAL, ProblemLevel.FATAL);
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getMessage).containsExactly(
                "unknown key 'colour'",
                "only [table] are allowed inside \"tables\" (found \"view\")",
                "no name given for table");
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getSourceName).containsOnly("bad.yaml");
    }

    @Test
    @DisplayName("문법 오류는 줄 번호와 함께 하나의 치명적 문제가 된다")
    void invalidYamlIsFatal() throws IOException {
        ParsedSchema parsed = parse("broken.yaml", "table:\n  name: [unclosed\n");

        assertThat(parsed.getSchema()).isEmpty();
        assertThat(parsed.getProblems()).singleElement().satisfies(p -> {
            assertThat(p.getLevel()).isEqualTo(ProblemLevel.FATAL);
            assertThat(p.getMessage()).startsWith("invalid file");
            assertThat(p.getSourcePosition()).startsWith("line ");
        });
    }

    @Test
    @DisplayName("JSON 파일도 읽는다")
    void parsesJson() throws IOException {
        ParsedSchema parsed = parse("01.json", """
                {"view": {"name": "active", "query": "SELECT * FROM a", "replace": true}}
                """);

        assertThat(parsed.getProblems()).isEmpty();
        ViewModel view = (ViewModel) parsed.getSchema().get(0);
        assertThat(view.isReplaceIfExists()).isTrue();
        assertThat(view.getSelectQuery().forPlatform("h2")).isPresent();
    }

    @Test
    @DisplayName("테이블 안의 변경은 테이블 타입을, 컬럼 안의 변경은 컬럼 타입을 기본으로 한다")
    void nestedChangesTakeEnclosingType() throws IOException {
        ParsedSchema parsed = parse("01.yaml", """
                table:
                  name: t
                  changes:
                  - change:
                      type: rename
                      was: old_t
                  columns:
                  - column:
                      name: c
                      changes:
                      - change:
                          type: sql
                          sql: UPDATE t SET c = 0
                  - change:
                      type: remove
                      schemaType: column
                      previousName: gone
                """);

        TableModel t = (TableModel) parsed.getSchema().get(0);
        assertThat(t.getChanges()).hasSize(1).first().isInstanceOfSatisfying(SchemaChange.class, c -> {
            assertThat(c.getChangeType()).isEqualTo(ChangeType.RENAME);
            assertThat(c.getObjectType()).isEqualTo(SchemaObjectType.TABLE);
            assertThat(c.getPreviousName()).isEqualTo("old_t");
        });
        assertThat(t.getColumns().get(0).getChanges()).singleElement()
                .isInstanceOfSatisfying(SqlChange.class, c -> assertThat(c.getObjectType()).isEqualTo(SchemaObjectType.COLUMN));
        // columns 목록에 change 래퍼는 허용되지 않는다
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getMessage)
                .containsExactly("only [column] are allowed inside \"columns\" (found \"change\")");
    }

    @Test
    @DisplayName("최상위 변경은 schemaType 이 있는 sql 변경이어야 한다")
    void topLevelChangesMustBeSql() throws IOException {
        ParsedSchema parsed = parse("00_changes.yaml", """
                changes:
                - change:
                    type: sql
                    schemaType: table
                    dialects:
                    - dialect:
                        platforms: mysql, mariadb
                        sql: DELETE FROM t
                - change:
                    type: sql
                    sql: DELETE FROM u
                - change:
                    type: remove
                    schemaType: table
                    previousName: t
                """);

        assertThat(parsed.getTopChanges()).singleElement().isInstanceOfSatisfying(SqlChange.class, c -> {
            assertThat(c.getSqlSet().forPlatform("mariadb")).isPresent();
            assertThat(c.getSqlSet().forPlatform("postgresql")).isEmpty();
        });
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getMessage).containsExactly(
                "top-level change requires a schemaType",
                "top-level changes must be sql changes, found remove");
    }

    @Test
    @DisplayName("요소에 적힌 error/warning/note 는 문제로 보고된다")
    void explicitProblems() throws IOException {
        ParsedSchema parsed = parse("01.yaml", """
                table:
                  name: t
                  note: kept for reporting
                  warning: to be dropped in 3.0
                """);

        assertThat(parsed.getSchema()).hasSize(1);
        assertThat(parsed.getProblems()).extracting(SchemaProblem::getLevel)
                .containsExactly(ProblemLevel.NOTE, ProblemLevel.WARNING);
    }

    @Test
    @DisplayName("빈 파일은 아무것도 만들지 않는다")
    void emptyFile() throws IOException {
        ParsedSchema parsed = parse("empty.yaml", "");

        assertThat(parsed.getSchema()).isEmpty();
        assertThat(parsed.getTopChanges()).isEmpty();
        assertThat(parsed.getProblems()).isEmpty();
    }

    @Test
    void recognizesSchemaFiles() {
        assertThat(SchemaFileParser.isSchemaFile("01_price.YAML")).isTrue();
        assertThat(SchemaFileParser.isSchemaFile("a.yml")).isTrue();
        assertThat(SchemaFileParser.isSchemaFile("a.json")).isTrue();
        assertThat(SchemaFileParser.isSchemaFile("README.md")).isFalse();
    }
}
