package com.tony.nflStats.service;

import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.StatTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Statistiques EPA / CPOE / taux de réussite calculées directement sur le play-by-play.
 * Chaque extracteur renvoie une table indexée par les clés de regroupement demandées.
 */
@Service
@Slf4j
public class PlayByPlayStatsService {

    private static final Set<String> PASS_PLAY_TYPES = Set.of("pass", "qb_spike");
    private static final Set<String> RUSH_PLAY_TYPES = Set.of("run", "qb_kneel");

    static final String PLAYER_ID = "player_id";
    static final String TEAM = "team";

    public StatTable passingStats(List<Play> plays, List<String> groupKeys) {
        return extract(plays, groupKeys,
                p -> PASS_PLAY_TYPES.contains(p.getPlayType()),
                Play::getPasserPlayerId,
                List.of("passing_epa", "passing_cpoe", "passing_success_rate"),
                group -> Arrays.asList(
                        sum(group, Play::getQbEpa),
                        mean(group, Play::getCpoe),
                        mean(group, p -> asDouble(p.getSuccess()))));
    }

    public StatTable rushingStats(List<Play> plays, List<String> groupKeys) {
        return extract(plays, groupKeys,
                p -> RUSH_PLAY_TYPES.contains(p.getPlayType()),
                Play::getRusherPlayerId,
                List.of("rushing_epa"),
                group -> Arrays.asList(sum(group, Play::getEpa)));
    }

    public StatTable receivingStats(List<Play> plays, List<String> groupKeys) {
        return extract(plays, groupKeys,
                p -> !isBlank(p.getReceiverPlayerId()),
                Play::getReceiverPlayerId,
                List.of("receiving_epa"),
                group -> Arrays.asList(sum(group, Play::getEpa)));
    }

    /**
     * Dropbacks : le joueur crédité est le coureur sur un scramble, le passeur sinon.
     */
    public StatTable dropbackStats(List<Play> plays, List<String> groupKeys) {
        Function<Play, String> dropbackPlayer = p -> isOne(p.getQbScramble())
                ? p.getRusherPlayerId()
                : p.getPasserPlayerId();

        return extract(plays, groupKeys,
                p -> isOne(p.getIsDropback() != null ? p.getIsDropback() : p.getQbDropback()),
                dropbackPlayer,
                List.of("dropbacks", "dropback_epa", "dropback_success_rate", "epa_per_dropback"),
                group -> Arrays.asList(
                        (int) group.stream().filter(p -> dropbackPlayer.apply(p) != null).count(),
                        sum(group, Play::getQbEpa),
                        mean(group, p -> asDouble(p.getSuccess())),
                        mean(group, Play::getQbEpa)));
    }

    public StatTable scrambleStats(List<Play> plays, List<String> groupKeys) {
        return extract(plays, groupKeys,
                p -> isOne(p.getQbScramble()),
                Play::getRusherPlayerId,
                List.of("scrambles", "scramble_epa", "epa_per_scramble", "scramble_success_rate"),
                group -> Arrays.asList(
                        group.size(),
                        sum(group, Play::getQbEpa),
                        // Ici une valeur manquante rend la moyenne nulle
                        meanWithoutSkippingNulls(group, Play::getQbEpa),
                        mean(group, p -> asDouble(p.getSuccess()))));
    }

    /**
     * Retire player_id et team des clés : ces deux colonnes sont fournies par l'action
     * elle-même (passeur / coureur / receveur, équipe en possession).
     */
    public static List<String> stripParticipantKeys(List<String> groupKeys) {
        return groupKeys.stream().filter(k -> !PLAYER_ID.equals(k) && !TEAM.equals(k)).toList();
    }

    // --- Moteur commun ---
    private StatTable extract(List<Play> plays,
                              List<String> groupKeys,
                              Predicate<Play> filter,
                              Function<Play, String> participant,
                              List<String> metricColumns,
                              Function<List<Play>, List<?>> metrics) {
        Map<List<Object>, List<Play>> groups = new LinkedHashMap<>();
        for (Play play : plays) {
            if (!filter.test(play)) continue;

            List<Object> key = groupKey(play, participant.apply(play), groupKeys);
            if (key == null) continue;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(play);
        }

        List<String> columns = new ArrayList<>(groupKeys);
        columns.addAll(metricColumns);

        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < groupKeys.size(); i++) {
                row.put(groupKeys.get(i), key.get(i));
            }
            List<?> values = metrics.apply(group);
            for (int i = 0; i < metricColumns.size(); i++) {
                row.put(metricColumns.get(i), values.get(i));
            }
            rows.add(row);
        });
        log.debug("Extraction {} : {} groupes", metricColumns.get(0), rows.size());
        return new StatTable(columns, rows);
    }

    // Valeurs des clés pour une action ; null si l'une manque (groupe ignoré)
    private static List<Object> groupKey(Play play, String playerId, List<String> groupKeys) {
        Map<String, Object> view = new HashMap<>();
        for (String column : stripParticipantKeys(groupKeys)) {
            view.put(column, playColumn(play, column));
        }
        view.put(PLAYER_ID, playerId);
        view.put(TEAM, play.getPosteam());

        List<Object> key = new ArrayList<>(groupKeys.size());
        for (String column : groupKeys) {
            Object value = view.get(column);
            if (value == null || (value instanceof String && ((String) value).isBlank())) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    private static Object playColumn(Play play, String column) {
        return switch (column) {
            case "season" -> play.getSeason();
            case "week" -> play.getWeek();
            case "game_id" -> play.getGameId();
            case "season_type" -> play.getSeasonType();
            default -> throw new IllegalArgumentException("Clé de regroupement inconnue : " + column);
        };
    }

    // --- Agrégations ---
    static double sum(List<Play> group, Function<Play, Double> field) {
        return StatUtils.sum(nonNull(group, field));
    }

    static Double mean(List<Play> group, Function<Play, Double> field) {
        double[] values = nonNull(group, field);
        return values.length == 0 ? null : StatUtils.mean(values);
    }

    static Double meanWithoutSkippingNulls(List<Play> group, Function<Play, Double> field) {
        double[] values = nonNull(group, field);
        return values.length < group.size() || values.length == 0 ? null : StatUtils.mean(values);
    }

    private static double[] nonNull(List<Play> group, Function<Play, Double> field) {
        return group.stream().map(field).filter(Objects::nonNull).mapToDouble(Double::doubleValue).toArray();
    }

    private static Double asDouble(Integer value) {
        return value == null ? null : value.doubleValue();
    }

    private static boolean isOne(Integer flag) {
        return flag != null && flag == 1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
