package com.tony.nflStats.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.*;

/**
 * Table de statistiques : colonnes ordonnées + lignes (colonne -> valeur).
 * Immuable : chaque opération renvoie une nouvelle table.
 */
@Getter
public class StatTable {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    // Message explicatif quand la table est vide "par construction" (filtre saison...)
    private final String diagnostic;

    public StatTable(List<String> columns, List<Map<String, Object>> rows) {
        this(columns, rows, null);
    }

    private StatTable(List<String> columns, List<Map<String, Object>> rows, String diagnostic) {
        this.columns = List.copyOf(new LinkedHashSet<>(columns));
        List<Map<String, Object>> normalized = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String column : this.columns) {
                copy.put(column, row.get(column));
            }
            normalized.add(Collections.unmodifiableMap(copy));
        }
        this.rows = Collections.unmodifiableList(normalized);
        this.diagnostic = diagnostic;
    }

    public static StatTable empty(String diagnostic) {
        return new StatTable(List.of(), List.of(), diagnostic);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        rows.forEach(row -> values.add(row.get(column)));
        return values;
    }

    /**
     * Première ligne dont les colonnes données ont exactement les valeurs données.
     */
    public Optional<Map<String, Object>> findRow(Map<String, ?> keyValues) {
        return rows.stream()
                .filter(row -> keyValues.entrySet().stream()
                        .allMatch(e -> Objects.equals(row.get(e.getKey()), e.getValue())))
                .findFirst();
    }

    /**
     * Jointure gauche sur les clés : toutes les lignes de gauche sont conservées,
     * les colonnes de droite absentes valent null.
     */
    public StatTable leftJoin(StatTable right, List<String> keys) {
        List<String> added = right.columns.stream()
                .filter(c -> !keys.contains(c) && !columns.contains(c))
                .toList();

        Map<List<Object>, Map<String, Object>> index = new HashMap<>();
        for (Map<String, Object> row : right.rows) {
            index.putIfAbsent(keyOf(row, keys), row);
        }

        List<String> joinedColumns = new ArrayList<>(columns);
        joinedColumns.addAll(added);

        List<Map<String, Object>> joined = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> merged = new LinkedHashMap<>(row);
            Map<String, Object> match = index.get(keyOf(row, keys));
            for (String column : added) {
                merged.put(column, match != null ? match.get(column) : null);
            }
            joined.add(merged);
        }
        return new StatTable(joinedColumns, joined, diagnostic);
    }

    /**
     * Réordonne les colonnes ; les colonnes inconnues de la table sont ignorées,
     * celles non citées sont supprimées.
     */
    public StatTable select(List<String> orderedColumns) {
        List<String> kept = orderedColumns.stream().filter(columns::contains).toList();
        return new StatTable(kept, rows, diagnostic);
    }

    /**
     * Tri croissant sur les clés (null en dernier).
     */
    public StatTable sortBy(List<String> keys) {
        Comparator<Map<String, Object>> comparator = (a, b) -> 0;
        for (String key : keys) {
            comparator = comparator.thenComparing(row -> row.get(key), StatTable::compareValues);
        }
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return new StatTable(columns, sorted, diagnostic);
    }

    private static List<Object> keyOf(Map<String, Object> row, List<String> keys) {
        List<Object> key = new ArrayList<>(keys.size());
        keys.forEach(k -> key.add(row.get(k)));
        return key;
    }

    // Clés de tri : nombres (saison, semaine) ou texte (identifiants)
    private static int compareValues(Object a, Object b) {
        if (a == null && b == null) return 0;
        if (a == null) return 1;
        if (b == null) return -1;
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        return a.toString().compareTo(b.toString());
    }
}
