package com.example.storage.schema;

import com.example.storage.dialect.DatabaseDialect;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;
import com.example.storage.model.TableDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

@Slf4j
public class SchemaIntrospector {

    private final JdbcTemplate jdbcTemplate;
    private final DatabaseDialect dialect;
    private final List<String> ignoredTablePrefixes;

    public SchemaIntrospector(JdbcTemplate jdbcTemplate, DatabaseDialect dialect, List<String> ignoredTablePrefixes) {
        this.jdbcTemplate = jdbcTemplate;
        this.dialect = dialect;
        this.ignoredTablePrefixes = ignoredTablePrefixes.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Every table of the given schemas, read over one connection.
     */
    public List<TableDefinition> introspect(Collection<String> schemas) {
        List<TableDefinition> tables = jdbcTemplate.execute((ConnectionCallback<List<TableDefinition>>) conn -> {
            List<TableDefinition> found = new ArrayList<>();
            DatabaseMetaData metaData = conn.getMetaData();
            for (String schema : schemas) {
                for (String table : listTables(metaData, conn.getCatalog(), schema)) {
                    found.add(readTable(conn, metaData, schema, table));
                }
            }
            return found;
        });
        log.debug("Introspected {} tables in schemas {}", tables.size(), schemas);
        return tables;
    }

    private List<String> listTables(DatabaseMetaData metaData, String catalog, String schema) throws SQLException {
        List<String> names = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(catalog, schema, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (schema.equalsIgnoreCase(rs.getString("TABLE_SCHEM")) && !isIgnored(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private boolean isIgnored(String table) {
        String lower = table.toLowerCase(Locale.ROOT);
        return ignoredTablePrefixes.stream().anyMatch(lower::startsWith);
    }

    private TableDefinition readTable(Connection conn, DatabaseMetaData metaData, String schema, String table)
            throws SQLException {
        TableDefinition.TableDefinitionBuilder builder = TableDefinition.builder().schema(schema).name(table);
        try (ResultSet rs = metaData.getColumns(conn.getCatalog(), schema, table, "%")) {
            while (rs.next()) {
                if (table.equals(rs.getString("TABLE_NAME")) && schema.equalsIgnoreCase(rs.getString("TABLE_SCHEM"))) {
                    builder.column(mapColumn(rs));
                }
            }
        }
        TreeMap<Short, String> primaryKey = new TreeMap<>();
        try (ResultSet rs = metaData.getPrimaryKeys(conn.getCatalog(), schema, table)) {
            while (rs.next()) {
                primaryKey.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        builder.primaryKeys(primaryKey.values());
        List<IndexDefinition> indexes = dialect.introspectIndexes(conn, schema, table);
        builder.indexes(indexes);
        return builder.build();
    }

    private ColumnDefinition mapColumn(ResultSet rs) throws SQLException {
        int size = rs.getInt("COLUMN_SIZE");
        int digits = rs.getInt("DECIMAL_DIGITS");
        return ColumnDefinition.builder()
                .name(rs.getString("COLUMN_NAME"))
                .type(mapSqlType(rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME")))
                .nativeType(dialect.nativeTypeOf(rs.getString("TYPE_NAME"), size, digits))
                .defaultValue(rs.getString("COLUMN_DEF"))
                .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                .build();
    }

    private LogicalType mapSqlType(int sqlType, String typeName) {
        String lower = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
        if (lower.startsWith("json")) {
            return LogicalType.JSON;
        }
        if (lower.equals("uuid")) {
            return LogicalType.UUID;
        }
        return switch (sqlType) {
            case Types.SMALLINT, Types.TINYINT -> LogicalType.SMALLINT;
            case Types.INTEGER -> LogicalType.INTEGER;
            case Types.BIGINT -> LogicalType.BIGINT;
            case Types.DECIMAL, Types.NUMERIC -> LogicalType.DECIMAL;
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> LogicalType.FLOAT;
            case Types.BOOLEAN, Types.BIT -> LogicalType.BOOLEAN;
            case Types.DATE -> LogicalType.DATE;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> LogicalType.TIMESTAMP;
            case Types.CLOB, Types.LONGVARCHAR -> LogicalType.TEXT;
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> LogicalType.BINARY;
            case Types.ARRAY -> LogicalType.ARRAY;
            default -> LogicalType.STRING;
        };
    }
}
