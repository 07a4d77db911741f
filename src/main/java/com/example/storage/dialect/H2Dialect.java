package com.example.storage.dialect;

import com.example.storage.model.IndexDefinition;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * H2 in PostgreSQL compatibility mode ({@code MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE}),
 * used for tests and embedded runs.
 * <p>
 * H2 has no partial indexes: unique partial indexes are left out entirely (a plain
 * unique index would reject every second version of a record) and non-unique ones
 * are created without their predicate.
 */
public class H2Dialect extends PostgresDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    protected String jsonType() {
        return "JSON";
    }

    @Override
    public boolean supportsPartialIndexes() {
        return false;
    }

    @Override
    public String indexMethodClause(String method) {
        return "";
    }

    @Override
    public String jsonPlaceholder() {
        return "? FORMAT JSON";
    }

    @Override
    public String nativeTypeOf(String typeName, int columnSize, int decimalDigits) {
        String upper = typeName.toUpperCase(Locale.ROOT);
        if ((upper.equals("CHARACTER VARYING") || upper.equals("CHARACTER")) && columnSize > 0) {
            return upper + "(" + columnSize + ")";
        }
        if ((upper.equals("NUMERIC") || upper.equals("DECIMAL")) && columnSize > 0) {
            return upper + "(" + columnSize + "," + decimalDigits + ")";
        }
        return upper;
    }

    @Override
    public List<IndexDefinition> supportedIndexes(List<IndexDefinition> indexes) {
        return indexes.stream()
                .filter(i -> !(i.isUnique() && i.isPartial()))
                .map(i -> i.isPartial() ? i.toBuilder().predicate(null).build() : i)
                .collect(Collectors.toList());
    }

    @Override
    public List<IndexDefinition> introspectIndexes(Connection conn, String schema, String table) throws SQLException {
        Map<String, Boolean> unique = new LinkedHashMap<>();
        Map<String, TreeMap<Short, String>> columns = new LinkedHashMap<>();
        DatabaseMetaData metaData = conn.getMetaData();
        try (ResultSet rs = metaData.getIndexInfo(conn.getCatalog(), schema, table, false, false)) {
            while (rs.next()) {
                String indexName = rs.getString("INDEX_NAME");
                if (indexName == null || indexName.toLowerCase(Locale.ROOT).startsWith("primary_key")) {
                    continue;
                }
                unique.put(indexName, !rs.getBoolean("NON_UNIQUE"));
                columns.computeIfAbsent(indexName, k -> new TreeMap<>())
                        .put(rs.getShort("ORDINAL_POSITION"), rs.getString("COLUMN_NAME"));
            }
        }
        List<IndexDefinition> indexes = new ArrayList<>();
        unique.forEach((indexName, isUnique) -> indexes.add(IndexDefinition.builder()
                .name(indexName)
                .tableName(table)
                .columns(new ArrayList<>(columns.get(indexName).values()))
                .unique(isUnique)
                .build()));
        return indexes;
    }
}
