package com.example.storage.schema;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.LogicalType;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical spelling of types, defaults and index predicates, so that a declared
 * schema and the catalog's description of the same schema compare as equal.
 * <p>
 * Every method is pure and idempotent: {@code normalize(normalize(x)) == normalize(x)}.
 */
public class TypeNormalizer {

    private static final Map<String, String> TYPE_ALIASES = Map.ofEntries(
            Map.entry("FLOAT8", "DOUBLE PRECISION"),
            Map.entry("DOUBLE", "DOUBLE PRECISION"),
            Map.entry("DOUBLE PRECISION", "DOUBLE PRECISION"),
            Map.entry("FLOAT", "DOUBLE PRECISION"),
            Map.entry("FLOAT4", "REAL"),
            Map.entry("REAL", "REAL"),
            Map.entry("INT", "INTEGER"),
            Map.entry("INT4", "INTEGER"),
            Map.entry("INTEGER", "INTEGER"),
            Map.entry("INT8", "BIGINT"),
            Map.entry("BIGINT", "BIGINT"),
            Map.entry("INT2", "SMALLINT"),
            Map.entry("SMALLINT", "SMALLINT"),
            Map.entry("BOOL", "BOOLEAN"),
            Map.entry("BOOLEAN", "BOOLEAN"),
            Map.entry("VARCHAR", "VARCHAR"),
            Map.entry("CHARACTER VARYING", "VARCHAR"),
            Map.entry("CHAR", "CHAR"),
            Map.entry("CHARACTER", "CHAR"),
            Map.entry("BPCHAR", "CHAR"),
            Map.entry("DECIMAL", "NUMERIC"),
            Map.entry("NUMERIC", "NUMERIC"),
            Map.entry("TIMESTAMPTZ", "TIMESTAMP WITH TIME ZONE"),
            Map.entry("TIMESTAMP WITH TIME ZONE", "TIMESTAMP WITH TIME ZONE"),
            Map.entry("TIMESTAMP WITHOUT TIME ZONE", "TIMESTAMP"),
            Map.entry("TEXT", "TEXT"),
            Map.entry("CLOB", "TEXT"),
            Map.entry("CHARACTER LARGE OBJECT", "TEXT"),
            Map.entry("BYTEA", "BYTEA"),
            Map.entry("VARBINARY", "BYTEA"),
            Map.entry("BINARY VARYING", "BYTEA"),
            Map.entry("BLOB", "BYTEA"),
            Map.entry("BINARY LARGE OBJECT", "BYTEA"));

    private static final Set<String> FALSE_LITERALS = Set.of("f", "0", "false", "'f'", "'0'", "'false'");
    private static final Set<String> TRUE_LITERALS = Set.of("t", "1", "true", "'t'", "'1'", "'true'");
    private static final Set<String> NOW_FUNCTIONS = Set.of(
            "now()", "current_timestamp", "current_timestamp()", "transaction_timestamp()");

    private static final Set<String> PREDICATE_KEYWORDS = Set.of(
            "IS", "NOT", "NULL", "AND", "OR", "IN", "LIKE", "ILIKE", "BETWEEN", "TRUE", "FALSE",
            "ANY", "ALL", "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "DISTINCT", "FROM");

    private static final Pattern TYPE_PATTERN =
            Pattern.compile("^([A-Z][A-Z0-9_ ]*?)\\s*(\\([^)]*\\))?\\s*((?:\\[\\])*)$");
    private static final Pattern TRAILING_CAST =
            Pattern.compile("::[a-zA-Z_][a-zA-Z0-9_ ]*(\\(\\s*\\d+(\\s*,\\s*\\d+)?\\s*\\))?(\\[\\])*$");

    private final boolean partialIndexes;

    public TypeNormalizer() {
        this(true);
    }

    /**
     * @param partialIndexes false for engines without partial indexes; predicates then normalize to null
     */
    public TypeNormalizer(boolean partialIndexes) {
        this.partialIndexes = partialIndexes;
    }

    public String normalizeNativeType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String upper = raw.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        Matcher m = TYPE_PATTERN.matcher(upper);
        if (!m.matches()) {
            return upper;
        }
        String base = m.group(1).trim();
        String params = m.group(2) == null ? "" : m.group(2).replaceAll("\\s+", "");
        String arraySuffix = m.group(3) == null ? "" : m.group(3);
        String canonical = TYPE_ALIASES.getOrDefault(base, base);
        if (canonical.equals("DOUBLE PRECISION") && base.equals("FLOAT")) {
            params = "";
        }
        return canonical + params + arraySuffix;
    }

    public String normalizeDefault(String raw, LogicalType type, String nativeType) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = collapseWhitespace(raw.trim());
        value = stripOuterParens(value);
        String previous;
        do {
            previous = value;
            value = TRAILING_CAST.matcher(value).replaceFirst("").trim();
            value = stripOuterParens(value);
        } while (!value.equals(previous));

        String lower = value.toLowerCase(Locale.ROOT);
        if (isBoolean(type, nativeType)) {
            if (FALSE_LITERALS.contains(lower)) {
                return "FALSE";
            }
            if (TRUE_LITERALS.contains(lower)) {
                return "TRUE";
            }
        }
        if (NOW_FUNCTIONS.contains(lower)) {
            return "CURRENT_TIMESTAMP";
        }
        if (lower.equals("null")) {
            return null;
        }
        return upperOutsideLiterals(value);
    }

    /**
     * Trims, collapses whitespace outside string literals and strips balanced outer
     * parenthesis pairs that wrap the whole expression. Keywords are upper-cased and
     * unquoted identifiers lower-cased outside literals. Inner groups are kept, so
     * {@code (a IS NULL) AND (b = 1)} is left as it is.
     */
    public String normalizePredicate(String raw) {
        if (raw == null) {
            return null;
        }
        String value = collapseWhitespace(raw.trim());
        value = stripOuterParens(value);
        return value.isEmpty() ? null : canonicalWordCase(value);
    }

    public ColumnDefinition normalizeColumn(ColumnDefinition column) {
        String nativeType = normalizeNativeType(column.getNativeType());
        return column.toBuilder()
                .nativeType(nativeType)
                .defaultValue(normalizeDefault(column.getDefaultValue(), column.getType(), nativeType))
                .build();
    }

    public IndexDefinition normalizeIndex(IndexDefinition index) {
        List<String> columns = index.getColumns().stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        return index.toBuilder()
                .clearColumns()
                .columns(columns)
                .method(index.getMethod() == null ? "btree" : index.getMethod().trim().toLowerCase(Locale.ROOT))
                .predicate(partialIndexes ? normalizePredicate(index.getPredicate()) : null)
                .build();
    }

    public boolean sameColumn(ColumnDefinition left, ColumnDefinition right) {
        if (!left.getName().equalsIgnoreCase(right.getName())) {
            return false;
        }
        ColumnDefinition a = normalizeColumn(left);
        ColumnDefinition b = normalizeColumn(right);
        return Objects.equals(a.getNativeType(), b.getNativeType())
                && Objects.equals(a.getDefaultValue(), b.getDefaultValue())
                && a.isNullable() == b.isNullable();
    }

    public boolean sameIndex(IndexDefinition left, IndexDefinition right) {
        IndexDefinition a = normalizeIndex(left);
        IndexDefinition b = normalizeIndex(right);
        return a.getColumns().equals(b.getColumns())
                && a.isUnique() == b.isUnique()
                && Objects.equals(a.getMethod(), b.getMethod())
                && Objects.equals(a.getPredicate(), b.getPredicate());
    }

    public boolean supportsPartialIndexes() {
        return partialIndexes;
    }

    private boolean isBoolean(LogicalType type, String nativeType) {
        return type == LogicalType.BOOLEAN || "BOOLEAN".equals(normalizeNativeType(nativeType));
    }

    static String stripOuterParens(String expression) {
        String value = expression.trim();
        while (value.length() >= 2 && value.charAt(0) == '(' && closingParen(value, 0) == value.length() - 1) {
            value = value.substring(1, value.length() - 1).trim();
        }
        return value;
    }

    /** Index of the parenthesis closing the one at {@code open}, ignoring string literals; -1 if unbalanced. */
    private static int closingParen(String value, int open) {
        int depth = 0;
        boolean inLiteral = false;
        for (int i = open; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            } else if (!inLiteral && c == '(') {
                depth++;
            } else if (!inLiteral && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // '' inside a literal toggles twice, which keeps the escaped quote inside the literal
    private static String collapseWhitespace(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean inLiteral = false;
        boolean pendingSpace = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            }
            if (!inLiteral && Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace && sb.length() > 0) {
                sb.append(' ');
            }
            pendingSpace = false;
            sb.append(c);
        }
        return sb.toString();
    }

    // words inside 'literals' and "quoted identifiers" keep their case
    private static String canonicalWordCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\'' || c == '"') {
                int end = value.indexOf(c, i + 1);
                while (end > 0 && end + 1 < value.length() && value.charAt(end + 1) == c) {
                    end = value.indexOf(c, end + 2);
                }
                end = end < 0 ? value.length() : end + 1;
                sb.append(value, i, end);
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i;
                while (end < value.length()
                        && (Character.isLetterOrDigit(value.charAt(end)) || value.charAt(end) == '_')) {
                    end++;
                }
                String word = value.substring(i, end).toUpperCase(Locale.ROOT);
                sb.append(PREDICATE_KEYWORDS.contains(word) ? word : word.toLowerCase(Locale.ROOT));
                i = end;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static String upperOutsideLiterals(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean inLiteral = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            }
            sb.append(inLiteral || c == '\'' ? c : Character.toUpperCase(c));
        }
        return sb.toString();
    }
}
