package com.tony.nflStats.repository;

import com.tony.nflStats.model.StatTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Upsert par lots d'une table en mémoire : INSERT … ON CONFLICT (clés) DO UPDATE.
 * Les schémas sont créés en dehors de l'application.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class UpsertWriter {

    static final int BATCH_SIZE = 1000;

    // Les noms de table et de colonnes sont concaténés dans le SQL
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    private final JdbcTemplate jdbc;

    /**
     * @param updateColumns colonnes mises à jour en cas de conflit (vide = DO NOTHING)
     * @return nombre de lignes envoyées
     */
    public int upsert(String tableName, StatTable table, List<String> keys, List<String> updateColumns) {
        if (table.isEmpty()) {
            log.info("Table {} : rien à écrire", tableName);
            return 0;
        }

        checkIdentifier(tableName);
        List<String> columns = table.getColumns();
        columns.forEach(UpsertWriter::checkIdentifier);
        if (!columns.containsAll(keys)) {
            throw new IllegalArgumentException("Colonnes clés absentes de " + tableName + " : " + keys);
        }
        if (!columns.containsAll(updateColumns)) {
            throw new IllegalArgumentException("Colonnes à mettre à jour absentes de " + tableName + " : " + updateColumns);
        }

        String sql = upsertSql(tableName, columns, keys, updateColumns);
        List<Object[]> args = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            args.add(columns.stream().map(row::get).toArray());
        }

        jdbc.batchUpdate(sql, args, BATCH_SIZE, (ps, values) -> {
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) ps.setNull(i + 1, Types.NULL);
                else ps.setObject(i + 1, values[i]);
            }
        });

        log.info("✅ {} : {} lignes upsertées", tableName, args.size());
        return args.size();
    }

    static String upsertSql(String tableName, List<String> columns, List<String> keys, List<String> updateColumns) {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String updates = updateColumns.stream()
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(", "));

        String sql = "INSERT INTO " + tableName + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")"
                + " ON CONFLICT (" + String.join(", ", keys) + ")";
        return updates.isEmpty() ? sql + " DO NOTHING" : sql + " DO UPDATE SET " + updates;
    }

    private static void checkIdentifier(String identifier) {
        if (!SAFE_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Identifiant SQL invalide : " + identifier);
        }
    }
}
