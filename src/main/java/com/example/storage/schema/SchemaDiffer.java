package com.example.storage.schema;

import com.example.storage.model.ColumnDefinition;
import com.example.storage.model.IndexDefinition;
import com.example.storage.model.SchemaChange;
import com.example.storage.model.TableDefinition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Computes the structural changes that turn the live schema into the declared one.
 * <p>
 * Output is sorted by table, then {@link com.example.storage.model.ChangeType} order,
 * then column or index name, so identical inputs always produce identical plans.
 * Drops are reported as candidates; whether they run is the caller's decision.
 */
public class SchemaDiffer {

    private static final Comparator<SchemaChange> ORDER = Comparator
            .comparing((SchemaChange c) -> c.getTable().key())
            .thenComparing(SchemaChange::getType)
            .thenComparing(c -> c.subjectName().toLowerCase(Locale.ROOT));

    private static final Pattern SIZED = Pattern.compile("^([A-Z ]+)\\((\\d+)(?:,(\\d+))?\\)$");
    private static final List<String> INTEGER_RANK = List.of("SMALLINT", "INTEGER", "BIGINT");
    private static final Set<String> UNBOUNDED_TEXT = Set.of("TEXT");

    private final TypeNormalizer normalizer;

    public SchemaDiffer(TypeNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<SchemaChange> diff(List<TableDefinition> declared, List<TableDefinition> introspected) {
        Map<String, TableDefinition> live = byKey(introspected, TableDefinition::key);
        Map<String, TableDefinition> wanted = byKey(declared, TableDefinition::key);

        List<SchemaChange> changes = new ArrayList<>();
        for (TableDefinition table : wanted.values()) {
            TableDefinition current = live.get(table.key());
            if (current == null) {
                changes.add(SchemaChange.addTable(table));
            } else {
                diffTable(table, current, changes);
            }
        }
        for (TableDefinition table : live.values()) {
            if (!wanted.containsKey(table.key())) {
                changes.add(SchemaChange.dropTable(table));
            }
        }
        changes.sort(ORDER);
        return changes;
    }

    private void diffTable(TableDefinition declared, TableDefinition live, List<SchemaChange> changes) {
        Map<String, ColumnDefinition> liveColumns = byKey(live.getColumns(), c -> lower(c.getName()));
        Map<String, ColumnDefinition> declaredColumns = byKey(declared.getColumns(), c -> lower(c.getName()));

        for (ColumnDefinition column : declared.getColumns()) {
            ColumnDefinition existing = liveColumns.get(lower(column.getName()));
            if (existing == null) {
                changes.add(SchemaChange.addColumn(declared, column));
            } else if (!normalizer.sameColumn(column, existing)) {
                changes.add(SchemaChange.alterColumn(declared, existing, column, blockedReason(existing, column)));
            }
        }
        for (ColumnDefinition column : live.getColumns()) {
            if (!declaredColumns.containsKey(lower(column.getName()))) {
                changes.add(SchemaChange.dropColumn(declared, column));
            }
        }

        Map<String, IndexDefinition> liveIndexes = byKey(live.getIndexes(), i -> lower(i.getName()));
        Map<String, IndexDefinition> declaredIndexes = byKey(declared.getIndexes(), i -> lower(i.getName()));
        for (IndexDefinition index : declared.getIndexes()) {
            IndexDefinition existing = liveIndexes.get(lower(index.getName()));
            if (existing == null) {
                changes.add(SchemaChange.addIndex(declared, index, false));
            } else if (!normalizer.sameIndex(index, existing)) {
                changes.add(SchemaChange.addIndex(declared, index, true));
            }
        }
        for (IndexDefinition index : live.getIndexes()) {
            if (!declaredIndexes.containsKey(lower(index.getName()))) {
                changes.add(SchemaChange.dropIndex(declared, index));
            }
        }
    }

    /**
     * Null when the alteration can run as plain DDL, otherwise the reason it needs
     * a manual migration.
     */
    String blockedReason(ColumnDefinition live, ColumnDefinition declared) {
        String from = normalizer.normalizeNativeType(live.getNativeType());
        String to = normalizer.normalizeNativeType(declared.getNativeType());
        if (from != null && to != null && !from.equals(to) && !isWidening(from, to)) {
            return "type change from " + from + " to " + to + " requires data migration";
        }
        if (live.isNullable() && !declared.isNullable() && declared.getDefaultValue() == null) {
            return "column becomes NOT NULL without a default to backfill existing rows";
        }
        return null;
    }

    boolean isWidening(String from, String to) {
        int fromRank = INTEGER_RANK.indexOf(from);
        int toRank = INTEGER_RANK.indexOf(to);
        if (fromRank >= 0 && toRank >= 0) {
            return toRank > fromRank;
        }
        if (fromRank >= 0 && to.startsWith("NUMERIC")) {
            return true;
        }
        if (from.equals("REAL") && to.equals("DOUBLE PRECISION")) {
            return true;
        }
        Matcher f = SIZED.matcher(from);
        if (!f.matches()) {
            return false;
        }
        String fromBase = f.group(1);
        int fromSize = Integer.parseInt(f.group(2));
        if ((fromBase.equals("VARCHAR") || fromBase.equals("CHAR")) && UNBOUNDED_TEXT.contains(to)) {
            return true;
        }
        Matcher t = SIZED.matcher(to);
        if (!t.matches()) {
            return false;
        }
        String toBase = t.group(1);
        int toSize = Integer.parseInt(t.group(2));
        if ((fromBase.equals("VARCHAR") || fromBase.equals("CHAR")) && toBase.equals("VARCHAR")) {
            return toSize >= fromSize;
        }
        if (fromBase.equals("NUMERIC") && toBase.equals("NUMERIC")) {
            int fromScale = f.group(3) == null ? 0 : Integer.parseInt(f.group(3));
            int toScale = t.group(3) == null ? 0 : Integer.parseInt(t.group(3));
            return toScale >= fromScale && (toSize - toScale) >= (fromSize - fromScale);
        }
        return false;
    }

    private static <T> Map<String, T> byKey(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.toMap(key, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
