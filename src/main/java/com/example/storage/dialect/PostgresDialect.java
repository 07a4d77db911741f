package com.example.storage.dialect;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class PostgresDialect implements DatabaseDialect {

    private static final String INDEX_QUERY = """
            SELECT ic.relname AS index_name, pg_get_indexdef(ix.indexrelid) AS index_def
            FROM pg_index ix
            JOIN pg_class ic ON ic.oid = ix.indexrelid
            JOIN pg_class tc ON tc.oid = ix.indrelid
            JOIN pg_namespace n ON n.oid = tc.relnamespace
            WHERE n.nspname = ? AND tc.relname = ? AND NOT ix.indisprimary
            ORDER BY ic.relname""";

    private static final Pattern INDEX_HEAD =
            Pattern.compile("^CREATE (UNIQUE )?INDEX (\\S+) ON (\\S+) USING (\\w+) \\(", Pattern.CASE_INSENSITIVE);

    private static final Set<String> SIZED_TYPES =
            Set.of("varchar", "character varying", "bpchar", "char", "character");
    private static final Set<String> PRECISION_TYPES = Set.of("numeric", "decimal");

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String getColumnTypeSql(ColumnDefinition col) {
        return switch (col.getType()) {
            case STRING -> "VARCHAR(" + (col.getMaxLength() != null ? col.getMaxLength() : 255) + ")";
            case TEXT -> "TEXT";
            case SMALLINT -> "SMALLINT";
            case INTEGER -> "INTEGER";
            case BIGINT -> "BIGINT";
            case DECIMAL -> "DECIMAL(" + (col.getPrecision() != null ? col.getPrecision() : 19) + ","
                    + (col.getScale() != null ? col.getScale() : 4) + ")";
            case FLOAT -> "DOUBLE PRECISION";
            case BOOLEAN -> "BOOLEAN";
            case DATE -> "DATE";
            case TIMESTAMP -> "TIMESTAMP WITH TIME ZONE";
            case JSON -> jsonType();
            case UUID -> "UUID";
            case BINARY -> "BYTEA";
            case ARRAY -> null;
        };
    }

    protected String jsonType() {
        return "JSONB";
    }

    @Override
    public boolean supportsPartialIndexes() {
        return true;
    }

    @Override
    public String indexMethodClause(String method) {
        return method == null ? "" : " USING " + method;
    }

    @Override
    public String jsonPlaceholder() {
        return "CAST(? AS JSONB)";
    }

    @Override
    public String nativeTypeOf(String typeName, int columnSize, int decimalDigits) {
        String lower = typeName.toLowerCase(Locale.ROOT);
        if (lower.startsWith("_")) {
            return lower.substring(1) + "[]";
        }
        if (SIZED_TYPES.contains(lower) && columnSize > 0 && columnSize < Integer.MAX_VALUE) {
            return typeName + "(" + columnSize + ")";
        }
        if (PRECISION_TYPES.contains(lower) && columnSize > 0 && columnSize <= 1000) {
            return typeName + "(" + columnSize + "," + decimalDigits + ")";
        }
        return typeName;
    }

    @Override
    public List<IndexDefinition> introspectIndexes(Connection conn, String schema, String table) throws SQLException {
        List<IndexDefinition> indexes = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(INDEX_QUERY)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    IndexDefinition index = parseIndexDef(table, rs.getString("index_def"));
                    if (index != null) {
                        indexes.add(index.toBuilder().name(rs.getString("index_name")).build());
                    }
                }
            }
        }
        return indexes;
    }

    /**
     * Parses {@code pg_get_indexdef} output, e.g.
     * {@code CREATE UNIQUE INDEX idx ON public.t USING btree (id) WHERE (valid_to IS NULL)}.
     * Returns null for shapes it does not understand.
     */
    static IndexDefinition parseIndexDef(String table, String definition) {
        Matcher m = INDEX_HEAD.matcher(definition);
        if (!m.find()) {
            return null;
        }
        int open = m.end() - 1;
        int close = matchingParen(definition, open);
        if (close < 0) {
            return null;
        }
        List<String> columns = Arrays.stream(definition.substring(open + 1, close).split(","))
                .map(String::trim)
                .map(PostgresDialect::unquote)
                .collect(Collectors.toList());
        String rest = definition.substring(close + 1).trim();
        String predicate = null;
        if (rest.regionMatches(true, 0, "WHERE ", 0, 6)) {
            predicate = rest.substring(6).trim();
        }
        return IndexDefinition.builder()
                .name(unquote(m.group(2)))
                .tableName(table)
                .columns(columns)
                .unique(m.group(1) != null)
                .method(m.group(4).toLowerCase(Locale.ROOT))
                .predicate(predicate)
                .build();
    }

    private static int matchingParen(String value, int open) {
        int depth = 0;
        boolean inLiteral = false;
        for (int i = open; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            } else if (!inLiteral && c == '(') {
                depth++;
            } else if (!inLiteral && c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static String unquote(String identifier) {
        if (identifier.length() >= 2 && identifier.startsWith("\"") && identifier.endsWith("\"")) {
            return identifier.substring(1, identifier.length() - 1).replace("\"\"", "\"");
        }
        return identifier;
    }
}
