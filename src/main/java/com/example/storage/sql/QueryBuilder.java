package com.example.storage.sql;

import com.example.storage.dialect.DatabaseDialect;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.SchemaChange;
import com.example.storage.model.TableDefinition;
import com.example.storage.schema.TypeNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders DML as {@link SqlStatement}s and DDL as plain statements.
 * <p>
 * Every identifier is quoted, so columns named {@code limit}, {@code order} or
 * {@code user} work in every clause. Values are never inlined: they are coerced
 * by {@link ValueCoercer} and bound as {@code ?} placeholders.
 */
public class QueryBuilder {

    private final DatabaseDialect dialect;
    private final TypeNormalizer normalizer;
    private final ValueCoercer coercer;

    public QueryBuilder(DatabaseDialect dialect) {
        this(dialect, new ValueCoercer());
    }

    public QueryBuilder(DatabaseDialect dialect, ValueCoercer coercer) {
        this.dialect = dialect;
        this.normalizer = dialect.normalizer();
        this.coercer = coercer;
    }

    public DatabaseDialect getDialect() {
        return dialect;
    }

    // ==================== DML ====================

    public SqlStatement insert(TableDefinition table, Map<String, Object> values) {
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        values.forEach((name, value) -> {
            ColumnDefinition col = column(table, name);
            columns.add(quote(col.getName()));
            placeholders.add(placeholder(col));
            params.add(coercer.coerce(table.getQualifiedName(), col, value));
        });
        String sql = "INSERT INTO " + qualified(table) + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", placeholders) + ")";
        return new SqlStatement(sql, params);
    }

    public SqlStatement update(TableDefinition table, Map<String, Object> values, List<Condition> where) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("UPDATE of " + table.getQualifiedName() + " without columns");
        }
        List<Object> params = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        values.forEach((name, value) -> {
            ColumnDefinition col = column(table, name);
            assignments.add(quote(col.getName()) + " = " + placeholder(col));
            params.add(coercer.coerce(table.getQualifiedName(), col, value));
        });
        String sql = "UPDATE " + qualified(table) + " SET " + String.join(", ", assignments)
                + whereClause(table, where, params);
        return new SqlStatement(sql, params);
    }

    public SqlStatement delete(TableDefinition table, List<Condition> where) {
        List<Object> params = new ArrayList<>();
        String sql = "DELETE FROM " + qualified(table) + whereClause(table, where, params);
        return new SqlStatement(sql, params);
    }

    public SqlStatement select(TableDefinition table, List<Condition> where, List<String> orderBy,
                               Integer limit, Integer offset) {
        return select(table, where, orderBy, limit, offset, false);
    }

    public SqlStatement select(TableDefinition table, List<Condition> where, List<String> orderBy,
                               Integer limit, Integer offset, boolean forUpdate) {
        List<Object> params = new ArrayList<>();
        String columns = table.getColumns().stream()
                .map(c -> quote(c.getName()))
                .collect(Collectors.joining(", "));
        StringBuilder sql = new StringBuilder("SELECT ").append(columns)
                .append(" FROM ").append(qualified(table))
                .append(whereClause(table, where, params));
        if (orderBy != null && !orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(orderBy.stream()
                    .map(name -> quote(column(table, name).getName()))
                    .collect(Collectors.joining(", ")));
        }
        if (limit != null) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }
        if (offset != null && offset > 0) {
            sql.append(" OFFSET ?");
            params.add(offset);
        }
        if (forUpdate) {
            sql.append(" FOR UPDATE");
        }
        return new SqlStatement(sql.toString(), params);
    }

    public SqlStatement count(TableDefinition table, List<Condition> where) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + qualified(table) + whereClause(table, where, params);
        return new SqlStatement(sql, params);
    }

    private String whereClause(TableDefinition table, List<Condition> where, List<Object> params) {
        if (where == null || where.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (Condition condition : where) {
            ColumnDefinition col = column(table, condition.getColumn());
            String name = quote(col.getName());
            switch (condition.getOperator()) {
                case EQ -> {
                    parts.add(name + " = " + placeholder(col));
                    params.add(coercer.coerce(table.getQualifiedName(), col, condition.getValue()));
                }
                case IS_NULL -> parts.add(name + " IS NULL");
                case VALID_AT -> {
                    ColumnDefinition validTo = column(table, Condition.VALID_TO);
                    String to = quote(validTo.getName());
                    parts.add(name + " <= ? AND (" + to + " IS NULL OR " + to + " > ?)");
                    Object instant = coercer.coerce(table.getQualifiedName(), col, condition.getValue());
                    params.add(instant);
                    params.add(instant);
                }
            }
        }
        return " WHERE " + String.join(" AND ", parts);
    }

    private String placeholder(ColumnDefinition col) {
        return col.getType() == LogicalType.JSON ? dialect.jsonPlaceholder() : "?";
    }

    private ColumnDefinition column(TableDefinition table, String name) {
        return table.findColumn(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown column " + name + " on table " + table.getQualifiedName()));
    }

    // ==================== DDL ====================

    public List<String> render(SchemaChange change) {
        TableDefinition table = change.getTable();
        return switch (change.getType()) {
            case ADD_TABLE -> createTable(table);
            case DROP_TABLE -> List.of(dropTable(table));
            case ADD_COLUMN -> addColumn(table, change.getColumn());
            case DROP_COLUMN -> List.of(dropColumn(table, change.getColumn()));
            case ALTER_COLUMN -> alterColumn(table, change.getPreviousColumn(), change.getColumn());
            case ADD_INDEX -> change.isReplacing()
                    ? List.of(dropIndex(table, change.getIndex()), createIndex(table, change.getIndex()))
                    : List.of(createIndex(table, change.getIndex()));
            case DROP_INDEX -> List.of(dropIndex(table, change.getIndex()));
        };
    }

    public List<String> createTable(TableDefinition table) {
        List<String> statements = new ArrayList<>();
        if (!"public".equalsIgnoreCase(table.getSchema())) {
            statements.add("CREATE SCHEMA IF NOT EXISTS " + quote(table.getSchema()));
        }
        List<String> definitions = table.getColumns().stream()
                .map(col -> columnSql(table, col))
                .collect(Collectors.toList());
        if (!table.getPrimaryKeys().isEmpty()) {
            definitions.add("PRIMARY KEY (" + table.getPrimaryKeys().stream()
                    .map(this::quote)
                    .collect(Collectors.joining(", ")) + ")");
        }
        statements.add("CREATE TABLE IF NOT EXISTS " + qualified(table) + " (\n    "
                + String.join(",\n    ", definitions) + "\n)");
        for (IndexDefinition index : table.getIndexes()) {
            statements.add(createIndex(table, index));
        }
        return statements;
    }

    public String createIndex(TableDefinition table, IndexDefinition index) {
        StringBuilder sql = new StringBuilder("CREATE ");
        if (index.isUnique()) {
            sql.append("UNIQUE ");
        }
        sql.append("INDEX IF NOT EXISTS ").append(quote(index.getName()))
                .append(" ON ").append(qualified(table))
                .append(dialect.indexMethodClause(index.getMethod()))
                .append(" (")
                .append(index.getColumns().stream().map(this::quote).collect(Collectors.joining(", ")))
                .append(")");
        if (index.isPartial() && dialect.supportsPartialIndexes()) {
            sql.append(" WHERE ").append(index.getPredicate().trim());
        }
        return sql.toString();
    }

    public String dropIndex(TableDefinition table, IndexDefinition index) {
        return "DROP INDEX IF EXISTS " + dialect.quoteQualified(table.getSchema(), index.getName());
    }

    /**
     * A NOT NULL column without a default is added nullable first and tightened
     * afterwards, so the statement fails loudly on a populated table instead of
     * needing a rewrite.
     */
    public List<String> addColumn(TableDefinition table, ColumnDefinition column) {
        String prefix = "ALTER TABLE " + qualified(table);
        if (!column.isNullable() && column.getDefaultValue() == null) {
            ColumnDefinition relaxed = column.toBuilder().nullable(true).build();
            return List.of(
                    prefix + " ADD COLUMN IF NOT EXISTS " + columnSql(table, relaxed),
                    prefix + " ALTER COLUMN " + quote(column.getName()) + " SET NOT NULL");
        }
        return List.of(prefix + " ADD COLUMN IF NOT EXISTS " + columnSql(table, column));
    }

    public String dropColumn(TableDefinition table, ColumnDefinition column) {
        return "ALTER TABLE " + qualified(table) + " DROP COLUMN IF EXISTS " + quote(column.getName());
    }

    public List<String> alterColumn(TableDefinition table, ColumnDefinition previous, ColumnDefinition column) {
        String prefix = "ALTER TABLE " + qualified(table) + " ALTER COLUMN " + quote(column.getName());
        ColumnDefinition from = normalizer.normalizeColumn(previous);
        ColumnDefinition to = normalizer.normalizeColumn(dialect.resolve(table.getQualifiedName(), column));
        List<String> statements = new ArrayList<>();
        if (!Objects.equals(from.getNativeType(), to.getNativeType())) {
            statements.add(prefix + " SET DATA TYPE " + to.getNativeType());
        }
        if (!Objects.equals(from.getDefaultValue(), to.getDefaultValue())) {
            statements.add(column.getDefaultValue() == null
                    ? prefix + " DROP DEFAULT"
                    : prefix + " SET DEFAULT " + column.getDefaultValue());
        }
        if (from.isNullable() && !to.isNullable()) {
            if (column.getDefaultValue() != null) {
                statements.add("UPDATE " + qualified(table) + " SET " + quote(column.getName()) + " = "
                        + column.getDefaultValue() + " WHERE " + quote(column.getName()) + " IS NULL");
            }
            statements.add(prefix + " SET NOT NULL");
        } else if (!from.isNullable() && to.isNullable()) {
            statements.add(prefix + " DROP NOT NULL");
        }
        return statements;
    }

    public String dropTable(TableDefinition table) {
        return "DROP TABLE IF EXISTS " + qualified(table);
    }

    private String columnSql(TableDefinition table, ColumnDefinition column) {
        ColumnDefinition resolved = dialect.resolve(table.getQualifiedName(), column);
        StringBuilder sql = new StringBuilder(quote(resolved.getName()))
                .append(' ').append(resolved.getNativeType());
        if (resolved.getDefaultValue() != null) {
            sql.append(" DEFAULT ").append(resolved.getDefaultValue());
        }
        if (!resolved.isNullable()) {
            sql.append(" NOT NULL");
        }
        return sql.toString();
    }

    private String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    private String qualified(TableDefinition table) {
        return dialect.quoteQualified(table.getSchema(), table.getName());
    }
}
