package org.sqlver.loader;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlver.model.ColumnModel;
import org.sqlver.model.ConstraintModel;
import org.sqlver.model.Order;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.TableModel;
import org.sqlver.model.ViewModel;
import org.sqlver.model.change.Change;
import org.sqlver.model.change.ChangeType;
import org.sqlver.model.change.SchemaChange;
import org.sqlver.model.change.SqlChange;
import org.sqlver.model.sql.SqlSet;
import org.sqlver.model.sql.SqlString;
import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaProblem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads one YAML or JSON schema file into tables, views and top-level changes.
 *
 * <p>Keys are matched after removing spaces, {@code '_'} and {@code '-'} and lower-casing, so
 * {@code autoIncrement}, {@code auto_increment} and {@code Auto Increment} are the same key.
 * Mistakes in the file never throw: an unknown key is a warning, a structural mistake is fatal
 * for the element it occurs in and the element is skipped.
 */
public class SchemaFileParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaFileParser.class);

    public static final Set<String> EXTENSIONS = Set.of(".yaml", ".yml", ".json");

    private static final Set<String> SQL_KEYS = Set.of("statement", "sql", "query", "execute");
    private static final String DEFAULT_SYNTAX = "native";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final OrderSequencer sequencer;

    public SchemaFileParser(OrderSequencer sequencer) {
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
    }

    public static boolean isSchemaFile(String fileName) {
        String lower = fileName.trim().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    /**
     * Reads and parses a file. A file that cannot be read or is not valid YAML/JSON yields a single
     * fatal problem.
     *
     * @param sourceName name the problems and orders refer to the file by
     */
    public ParsedSchema parse(Path file, String sourceName) {
        ObjectMapper mapper = sourceName.toLowerCase(Locale.ROOT).endsWith(".json") ? jsonMapper : yamlMapper;
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            SchemaProblem.SchemaProblemBuilder problem = SchemaProblem.builder()
                    .level(ProblemLevel.FATAL)
                    .sourceName(sourceName)
                    .message("invalid file: " + e.getOriginalMessage());
            if (loc != null && loc.getLineNr() > 0) {
                problem.sourceLine(loc.getLineNr()).sourceColumn(loc.getColumnNr() > 0 ? loc.getColumnNr() : null);
            }
            return ParsedSchema.builder().problem(problem.build()).build();
        } catch (IOException e) {
            return ParsedSchema.builder()
                    .problem(SchemaProblem.of(ProblemLevel.FATAL, sourceName, "cannot read file: " + e.getMessage()))
                    .build();
        }
        return parse(sourceName, root);
    }

    /**
     * Converts an already parsed document.
     */
    public ParsedSchema parse(String sourceName, JsonNode root) {
        FileContext ctx = new FileContext(sourceName);
        sequencer.sourceRank(sourceName);
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOGGER.debug("{} is empty", sourceName);
            return ctx.result.build();
        }
        if (!root.isObject()) {
            ctx.problem(ProblemLevel.FATAL, "top level must be an object, found " + root.getNodeType());
            return ctx.result.build();
        }

        forEachField(root, (key, val) -> {
            switch (key) {
                case "table" -> addObject(ctx, parseTable(ctx, val));
                case "tables" -> elements(ctx, key, val, "table").forEach(v -> addObject(ctx, parseTable(ctx, v)));
                case "view" -> addObject(ctx, parseView(ctx, val));
                case "views" -> elements(ctx, key, val, "view").forEach(v -> addObject(ctx, parseView(ctx, v)));
                case "change" -> addTopChange(ctx, parseTopChange(ctx, val));
                case "changes" -> elements(ctx, key, val, "change").forEach(v -> addTopChange(ctx, parseTopChange(ctx, v)));
                default -> ctx.unknownKey(key);
            }
        });
        ParsedSchema ret = ctx.result.build();
        LOGGER.debug("Parsed {}: {} objects, {} top-level changes, {} problems",
                sourceName, ret.getSchema().size(), ret.getTopChanges().size(), ret.getProblems().size());
        return ret;
    }

    private static void addObject(FileContext ctx, SchemaObject obj) {
        if (obj != null) {
            ctx.result.schemaObject(obj);
        }
    }

    private static void addTopChange(FileContext ctx, Change change) {
        if (change != null) {
            ctx.result.topChange(change);
        }
    }

    // ----------------------------------------------------------------------
    // tables and views

    private TableModel parseTable(FileContext ctx, JsonNode node) {
        if (!ctx.requireObject("table", node)) {
            return null;
        }
        Common common = new Common(sequencer.next(ctx.sourceName, 0));
        TableModel.TableModelBuilder table = TableModel.builder();
        String[] names = new String[3];

        forEachField(node, (key, val) -> {
            if (parseCommon(ctx, common, key, val, 0, false)) {
                return;
            }
            switch (key) {
                case "name", "tablename" -> names[2] = text(ctx, key, val);
                case "catalog", "catalogname" -> names[0] = text(ctx, key, val);
                case "schema", "schemaname" -> names[1] = text(ctx, key, val);
                case "space", "tablespace" -> table.tableSpace(text(ctx, key, val));
                case "column" -> addIfPresent(parseColumn(ctx, val, 1), table::column);
                case "columns" -> elements(ctx, key, val, "column")
                        .forEach(v -> addIfPresent(parseColumn(ctx, v, 1), table::column));
                case "constraint" -> addIfPresent(parseConstraint(ctx, val, 1, null), table::constraint);
                case "constraints" -> elements(ctx, key, val, "constraint")
                        .forEach(v -> addIfPresent(parseConstraint(ctx, v, 1, null), table::constraint));
                case "change" -> addIfPresent(parseChange(ctx, val, 1, SchemaObjectType.TABLE), table::change);
                case "changes" -> elements(ctx, key, val, "change")
                        .forEach(v -> addIfPresent(parseChange(ctx, v, 1, SchemaObjectType.TABLE), table::change));
                default -> ctx.unknownKey(key);
            }
        });

        if (names[2] == null || names[2].isBlank()) {
            ctx.problem(ProblemLevel.FATAL, "no name given for table");
            return null;
        }
        try {
            return table
                    .catalogName(names[0])
                    .schemaName(names[1])
                    .name(names[2])
                    .comment(common.comment)
                    .order(common.finish(label(names)))
                    .build();
        } catch (IllegalArgumentException e) {
            ctx.problem(ProblemLevel.FATAL, "invalid table '" + names[2] + "': " + e.getMessage());
            return null;
        }
    }

    private ViewModel parseView(FileContext ctx, JsonNode node) {
        if (!ctx.requireObject("view", node)) {
            return null;
        }
        Common common = new Common(sequencer.next(ctx.sourceName, 0));
        ViewModel.ViewModelBuilder view = ViewModel.builder();
        String[] names = new String[3];
        List<SqlString> query = new ArrayList<>();

        forEachField(node, (key, val) -> {
            if (parseCommon(ctx, common, key, val, 0, false)) {
                return;
            }
            if (SQL_KEYS.contains(key)) {
                addIfPresent(universal(ctx, key, val), query::add);
                return;
            }
            switch (key) {
                case "name", "viewname" -> names[2] = text(ctx, key, val);
                case "catalog", "catalogname" -> names[0] = text(ctx, key, val);
                case "schema", "schemaname" -> names[1] = text(ctx, key, val);
                case "replace", "replaceifexists" -> view.replaceIfExists(bool(ctx, key, val));
                case "dialects" -> query.addAll(dialects(ctx, key, val));
                case "column" -> addIfPresent(parseColumn(ctx, val, 1), view::column);
                case "columns" -> elements(ctx, key, val, "column")
                        .forEach(v -> addIfPresent(parseColumn(ctx, v, 1), view::column));
                case "constraint" -> addIfPresent(parseConstraint(ctx, val, 1, null), view::constraint);
                case "constraints" -> elements(ctx, key, val, "constraint")
                        .forEach(v -> addIfPresent(parseConstraint(ctx, v, 1, null), view::constraint));
                case "change" -> addIfPresent(parseChange(ctx, val, 1, SchemaObjectType.VIEW), view::change);
                case "changes" -> elements(ctx, key, val, "change")
                        .forEach(v -> addIfPresent(parseChange(ctx, v, 1, SchemaObjectType.VIEW), view::change));
                default -> ctx.unknownKey(key);
            }
        });

        if (names[2] == null || names[2].isBlank()) {
            ctx.problem(ProblemLevel.FATAL, "no name given for view");
            return null;
        }
        if (query.isEmpty()) {
            ctx.problem(ProblemLevel.FATAL, "view '" + names[2] + "' requires a query or dialects");
            return null;
        }
        try {
            return view
                    .catalogName(names[0])
                    .schemaName(names[1])
                    .name(names[2])
                    .selectQuery(new SqlSet(query))
                    .comment(common.comment)
                    .order(common.finish(label(names)))
                    .build();
        } catch (IllegalArgumentException e) {
            ctx.problem(ProblemLevel.FATAL, "invalid view '" + names[2] + "': " + e.getMessage());
            return null;
        }
    }

    // 다른 order 의 before/after 에서 참조할 이름: 비어있지 않은 부분만 연결
    private static String label(String[] names) {
        return Stream.of(names)
                .filter(n -> n != null && !n.isBlank())
                .collect(Collectors.joining("."));
    }

    // ----------------------------------------------------------------------
    // columns and constraints

    private ColumnModel parseColumn(FileContext ctx, JsonNode node, int depth) {
        if (!ctx.requireObject("column", node)) {
            return null;
        }
        Common common = new Common(sequencer.next(ctx.sourceName, depth));
        ColumnModel.ColumnModelBuilder column = ColumnModel.builder();
        String[] name = new String[1];
        List<JsonNode> constraintNodes = new ArrayList<>();

        forEachField(node, (key, val) -> {
            if (parseCommon(ctx, common, key, val, depth, true)) {
                return;
            }
            switch (key) {
                case "name" -> name[0] = text(ctx, key, val);
                case "type", "valuetype" -> column.valueType(text(ctx, key, val));
                case "datatype" -> column.dataType(text(ctx, key, val));
                case "default", "defaultvalue" -> column.defaultValue(text(ctx, key, val));
                case "remarks" -> common.comment = text(ctx, key, val);
                case "before", "beforecolumn" -> column.beforeColumn(text(ctx, key, val));
                case "after", "aftercolumn" -> column.afterColumn(text(ctx, key, val));
                case "autoincrement" -> column.autoIncrement(bool(ctx, key, val));
                // 컬럼 이름을 알아야 하므로 제약조건은 나중에 처리
                case "constraint" -> constraintNodes.add(val);
                case "constraints" -> constraintNodes.addAll(elements(ctx, key, val, "constraint"));
                case "change" -> addIfPresent(parseChange(ctx, val, depth + 1, SchemaObjectType.COLUMN), column::change);
                case "changes" -> elements(ctx, key, val, "change")
                        .forEach(v -> addIfPresent(parseChange(ctx, v, depth + 1, SchemaObjectType.COLUMN), column::change));
                default -> ctx.unknownKey(key);
            }
        });

        if (name[0] == null || name[0].isBlank()) {
            ctx.problem(ProblemLevel.FATAL, "no name given for column");
            return null;
        }
        for (JsonNode c : constraintNodes) {
            addIfPresent(parseConstraint(ctx, c, depth + 1, name[0]), column::constraint);
        }
        try {
            return column
                    .name(name[0])
                    .comment(common.comment)
                    .order(common.finish(null))
                    .build();
        } catch (IllegalArgumentException e) {
            ctx.problem(ProblemLevel.FATAL, "invalid column '" + name[0] + "': " + e.getMessage());
            return null;
        }
    }

    /**
     * @param columnName enclosing column, the default column list of the constraint
     */
    private ConstraintModel parseConstraint(FileContext ctx, JsonNode node, int depth, String columnName) {
        if (!ctx.requireObject("constraint", node)) {
            return null;
        }
        Common common = new Common(sequencer.next(ctx.sourceName, depth));
        ConstraintModel.ConstraintModelBuilder constraint = ConstraintModel.builder();
        String[] type = new String[1];
        List<String> columns = new ArrayList<>();
        List<SqlString> sql = new ArrayList<>();
        Map<String, Object> details = new LinkedHashMap<>();

        forEachField(node, (key, val) -> {
            if (parseCommon(ctx, common, key, val, depth, false)) {
                return;
            }
            switch (key) {
                case "type", "constrainttype" -> type[0] = text(ctx, key, val);
                case "name" -> constraint.name(text(ctx, key, val));
                case "columns" -> columns.addAll(columnNames(ctx, key, val));
                case "dialects" -> sql.addAll(dialects(ctx, key, val));
                case "sql", "value" -> addIfPresent(universal(ctx, key, val), sql::add);
                case "change" -> addIfPresent(parseChange(ctx, val, depth + 1, SchemaObjectType.CONSTRAINT), constraint::change);
                case "changes" -> elements(ctx, key, val, "change")
                        .forEach(v -> addIfPresent(parseChange(ctx, v, depth + 1, SchemaObjectType.CONSTRAINT), constraint::change));
                default -> {
                    if (val.isValueNode() && !val.isNull()) {
                        details.put(key, val.isNumber() ? val.numberValue() : val.asText());
                    } else {
                        ctx.unknownKey(key);
                    }
                }
            }
        });

        if (type[0] == null || type[0].isBlank()) {
            ctx.problem(ProblemLevel.FATAL, "no constraint type given");
            return null;
        }
        if (columns.isEmpty() && columnName != null) {
            columns.add(columnName);
        }
        try {
            return constraint
                    .constraintType(type[0])
                    .columnNames(columns)
                    .details(details)
                    .sql(sql.isEmpty() ? null : new SqlSet(sql))
                    .comment(common.comment)
                    .order(common.finish(null))
                    .build();
        } catch (IllegalArgumentException e) {
            ctx.problem(ProblemLevel.FATAL, e.getMessage());
            return null;
        }
    }

    private List<String> columnNames(FileContext ctx, String key, JsonNode val) {
        if (val.isTextual()) {
            return splitList(val.asText());
        }
        if (!val.isArray()) {
            ctx.problem(ProblemLevel.FATAL, "\"" + key + "\" does not contain a list, but " + val);
            return List.of();
        }
        List<String> ret = new ArrayList<>();
        for (JsonNode item : val) {
            if (item.isObject()) {
                // {column: NAME} 형식
                forEachField(item, (k, v) -> {
                    if ("column".equals(k)) {
                        ret.add(text(ctx, k, v));
                    } else {
                        ctx.problem(ProblemLevel.FATAL, "only [column] are allowed inside \"" + key + "\" (found \"" + k + "\")");
                    }
                });
            } else {
                ret.add(text(ctx, key, item));
            }
        }
        return ret;
    }

    // ----------------------------------------------------------------------
    // changes

    private Change parseTopChange(FileContext ctx, JsonNode node) {
        Change change = parseChange(ctx, node, 0, null);
        if (change == null) {
            return null;
        }
        if (!(change instanceof SqlChange)) {
            ctx.problem(ProblemLevel.FATAL, "top-level changes must be sql changes, found " + change.getChangeType().displayName());
            return null;
        }
        return change;
    }

    /**
     * @param defaultType type of the enclosing object; {@code null} for a top-level change, which
     *                    must name its schema type
     */
    private Change parseChange(FileContext ctx, JsonNode node, int depth, SchemaObjectType defaultType) {
        if (!ctx.requireObject("change", node)) {
            return null;
        }
        Common common = new Common(sequencer.next(ctx.sourceName, depth));
        String[] changeType = new String[1];
        String[] schemaType = new String[1];
        String[] previousName = new String[1];
        List<String> affects = new ArrayList<>();
        List<SqlString> sql = new ArrayList<>();

        forEachField(node, (key, val) -> {
            if (parseCommon(ctx, common, key, val, depth, false)) {
                return;
            }
            if (SQL_KEYS.contains(key)) {
                addIfPresent(universal(ctx, key, val), sql::add);
                return;
            }
            switch (key) {
                case "change", "changetype", "type" -> changeType[0] = text(ctx, key, val);
                case "schema", "schematype" -> schemaType[0] = text(ctx, key, val);
                case "previousname", "previously", "fromname", "was" -> previousName[0] = text(ctx, key, val);
                case "affects" -> affects.addAll(strings(ctx, key, val));
                case "dialects" -> sql.addAll(dialects(ctx, key, val));
                default -> ctx.unknownKey(key);
            }
        });

        if (changeType[0] == null) {
            ctx.problem(ProblemLevel.FATAL, "no change type given");
            return null;
        }
        try {
            ChangeType kind = ChangeType.fromName(changeType[0]);
            SchemaObjectType objectType;
            if (schemaType[0] != null) {
                objectType = SchemaObjectType.fromName(schemaType[0]);
            } else if (defaultType != null) {
                objectType = defaultType;
            } else {
                ctx.problem(ProblemLevel.FATAL, "top-level change requires a schemaType");
                return null;
            }
            Order order = common.finish(null);

            if (kind == ChangeType.SQL) {
                if (sql.isEmpty()) {
                    ctx.problem(ProblemLevel.FATAL, "requires 'sql' or 'dialects' key for sql change");
                    return null;
                }
                return SqlChange.builder()
                        .order(order)
                        .comment(common.comment)
                        .objectType(objectType)
                        .sqlSet(new SqlSet(sql))
                        .affects(affects)
                        .build();
            }
            if (!sql.isEmpty()) {
                ctx.problem(ProblemLevel.WARNING, "sql is ignored for " + kind.displayName() + " changes");
            }
            return SchemaChange.builder()
                    .order(order)
                    .comment(common.comment)
                    .objectType(objectType)
                    .changeType(kind)
                    .previousName(previousName[0])
                    .affects(affects)
                    .build();
        } catch (IllegalArgumentException e) {
            ctx.problem(ProblemLevel.FATAL, e.getMessage());
            return null;
        }
    }

    // ----------------------------------------------------------------------
    // sql

    private List<SqlString> dialects(FileContext ctx, String key, JsonNode val) {
        List<SqlString> ret = new ArrayList<>();
        for (JsonNode d : elements(ctx, key, val, "dialect")) {
            if (!ctx.requireObject("dialect", d)) {
                continue;
            }
            String[] syntax = {DEFAULT_SYNTAX};
            String[] sql = new String[1];
            List<String> platforms = new ArrayList<>();
            forEachField(d, (k, v) -> {
                switch (k) {
                    case "syntax" -> syntax[0] = text(ctx, k, v);
                    case "platforms", "platform" -> platforms.addAll(strings(ctx, k, v));
                    case "sql", "query", "statement", "execute" -> sql[0] = text(ctx, k, v);
                    default -> ctx.unknownKey(k);
                }
            });
            if (sql[0] == null || sql[0].isEmpty()) {
                ctx.problem(ProblemLevel.FATAL, "expected 'sql' item in dialect");
            } else if (platforms.isEmpty()) {
                ctx.problem(ProblemLevel.FATAL, "no platforms given for dialect");
            } else {
                ret.add(new SqlString(sql[0], syntax[0], platforms));
            }
        }
        return ret;
    }

    private SqlString universal(FileContext ctx, String key, JsonNode val) {
        String sql = text(ctx, key, val);
        if (sql == null || sql.isEmpty()) {
            ctx.problem(ProblemLevel.FATAL, "\"" + key + "\" must not be empty");
            return null;
        }
        return SqlString.universal(sql);
    }

    // ----------------------------------------------------------------------
    // shared element keys

    /**
     * Keys every element understands. {@code before} and {@code after} are order labels, except
     * for columns where they place the column; {@code orderBefore} and {@code orderAfter} always
     * are order labels.
     *
     * @return true when the key was handled
     */
    private boolean parseCommon(FileContext ctx, Common common, String key, JsonNode val, int depth,
                                boolean placementKeys) {
        switch (key) {
            case "comment" -> {
                String c = text(ctx, key, val);
                common.comment = c == null ? null : c.strip();
            }
            case "order" -> {
                Integer seq = integer(ctx, key, val);
                if (seq != null) {
                    Order explicit = sequencer.explicit(ctx.sourceName, depth, seq);
                    common.order = explicit;
                }
            }
            case "orderbefore" -> common.before.addAll(strings(ctx, key, val));
            case "orderafter" -> common.after.addAll(strings(ctx, key, val));
            case "before" -> {
                if (placementKeys) {
                    return false;
                }
                common.before.addAll(strings(ctx, key, val));
            }
            case "after" -> {
                if (placementKeys) {
                    return false;
                }
                common.after.addAll(strings(ctx, key, val));
            }
            case "error" -> ctx.problem(ProblemLevel.ERROR, text(ctx, key, val));
            case "warning" -> ctx.problem(ProblemLevel.WARNING, text(ctx, key, val));
            case "note" -> ctx.problem(ProblemLevel.NOTE, text(ctx, key, val));
            default -> {
                return false;
            }
        }
        return true;
    }

    private static final class Common {
        Order order;
        String comment;
        final List<String> before = new ArrayList<>();
        final List<String> after = new ArrayList<>();

        Common(Order order) {
            this.order = order;
        }

        Order finish(String label) {
            return order.toBuilder()
                    .label(label)
                    .occursBefore(before)
                    .occursAfter(after)
                    .build();
        }
    }

    // ----------------------------------------------------------------------
    // value conversion

    private static String text(FileContext ctx, String key, JsonNode val) {
        if (val == null || val.isNull()) {
            return null;
        }
        if (val.isTextual() || val.isNumber() || val.isBoolean()) {
            return val.asText();
        }
        ctx.problem(ProblemLevel.ERROR, key + " expected string value, found " + val);
        return val.toString();
    }

    private static Integer integer(FileContext ctx, String key, JsonNode val) {
        if (val.isIntegralNumber()) {
            return val.asInt();
        }
        if (val.isTextual() && val.asText().trim().matches("\\d+")) {
            return Integer.parseInt(val.asText().trim());
        }
        ctx.problem(ProblemLevel.ERROR, key + " expected int value, found " + val);
        return null;
    }

    private static boolean bool(FileContext ctx, String key, JsonNode val) {
        if (val.isBoolean()) {
            return val.asBoolean();
        }
        String s = val.asText().trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "true", "yes", "on", "1":
                return true;
            case "false", "no", "off", "0":
                return false;
            default:
                ctx.problem(ProblemLevel.ERROR, key + " expected boolean value, found " + val);
                return false;
        }
    }

    /** A list of strings, or one comma separated string. */
    private static List<String> strings(FileContext ctx, String key, JsonNode val) {
        if (val.isArray()) {
            List<String> ret = new ArrayList<>();
            for (JsonNode item : val) {
                String s = text(ctx, key, item);
                if (s != null) {
                    ret.add(s.trim());
                }
            }
            return ret;
        }
        String s = text(ctx, key, val);
        return s == null ? List.of() : splitList(s);
    }

    private static List<String> splitList(String s) {
        return Stream.of(s.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    /**
     * Unwraps a list of single-key objects such as {@code [{column: {...}}, {column: {...}}]}.
     */
    private static List<JsonNode> elements(FileContext ctx, String key, JsonNode val, String expected) {
        if (!val.isArray()) {
            ctx.problem(ProblemLevel.FATAL, "\"" + key + "\" does not contain a list, but " + val);
            return List.of();
        }
        List<JsonNode> ret = new ArrayList<>();
        for (JsonNode item : val) {
            if (!item.isObject()) {
                ctx.problem(ProblemLevel.FATAL, "\"" + key + "\" must contain " + expected + " objects, found " + item);
                continue;
            }
            forEachField(item, (k, v) -> {
                if (expected.equals(k)) {
                    ret.add(v);
                } else {
                    ctx.problem(ProblemLevel.FATAL,
                            "only [" + expected + "] are allowed inside \"" + key + "\" (found \"" + k + "\")");
                }
            });
        }
        return ret;
    }

    static String stripKey(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c != ' ' && c != '\r' && c != '\n' && c != '\t' && c != '_' && c != '-') {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    private static void forEachField(JsonNode node, FieldHandler handler) {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            handler.handle(stripKey(e.getKey()), e.getValue());
        }
    }

    private static <T> void addIfPresent(T value, Consumer<T> sink) {
        if (value != null) {
            sink.accept(value);
        }
    }

    @FunctionalInterface
    private interface FieldHandler {
        void handle(String key, JsonNode value);
    }

    /**
     * Per-file parse state.
     */
    private static final class FileContext {
        final String sourceName;
        final ParsedSchema.ParsedSchemaBuilder result = ParsedSchema.builder();

        FileContext(String sourceName) {
            this.sourceName = sourceName;
        }

        void problem(ProblemLevel level, String message) {
            result.problem(SchemaProblem.of(level, sourceName, message));
        }

        void unknownKey(String key) {
            problem(ProblemLevel.WARNING, "unknown key '" + key + "'");
        }

        boolean requireObject(String what, JsonNode node) {
            if (node == null || !node.isObject()) {
                problem(ProblemLevel.FATAL, what + " must be an object, found " + (node == null ? "nothing" : node));
                return false;
            }
            return true;
        }
    }
}
