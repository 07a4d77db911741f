package com.example.storage.dialect;

import com.example.storage.error.UnsupportedTypeException;
import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.schema.TypeNormalizer;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Everything that differs between the engines the storage layer runs on:
 * type spelling, identifier quoting, index capabilities and index introspection.
 */
public interface DatabaseDialect {

    String name();

    /** Native type for a logical type, or null when the dialect has no mapping. */
    String getColumnTypeSql(ColumnDefinition col);

    default String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    default String quoteQualified(String schema, String name) {
        return schema == null ? quoteIdentifier(name) : quoteIdentifier(schema) + "." + quoteIdentifier(name);
    }

    boolean supportsPartialIndexes();

    /** Clause between the table and the column list of CREATE INDEX, e.g. {@code USING btree}. */
    String indexMethodClause(String method);

    /** Placeholder that binds a JSON document passed as a string. */
    String jsonPlaceholder();

    /** Secondary indexes of a table, primary key excluded. */
    List<IndexDefinition> introspectIndexes(Connection conn, String schema, String table) throws SQLException;

    /** Native type string for a catalog column as reported by {@code DatabaseMetaData#getColumns}. */
    String nativeTypeOf(String typeName, int columnSize, int decimalDigits);

    default TypeNormalizer normalizer() {
        return new TypeNormalizer(supportsPartialIndexes());
    }

    /** Indexes of a declaration reduced to what this engine can create. */
    default List<IndexDefinition> supportedIndexes(List<IndexDefinition> indexes) {
        return indexes;
    }

    /** Fills in the native type of a column declared with a logical type only. */
    default ColumnDefinition resolve(String table, ColumnDefinition col) {
        if (col.getNativeType() != null) {
            return col;
        }
        String sqlType = getColumnTypeSql(col);
        if (sqlType == null) {
            throw new UnsupportedTypeException(table, col.getName(), col.getType(), name());
        }
        return col.toBuilder().nativeType(sqlType).build();
    }
}
