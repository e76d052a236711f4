package com.tony.nflStats.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatTableTest {

    private static final List<String> KEYS = List.of("season", "player_id");

    @Test
    void leftJoinShouldKeepAllLeftRows() {
        StatTable left = new StatTable(List.of("season", "player_id", "attempts"), List.of(
                Map.of("season", 2015, "player_id", "QB1", "attempts", 30),
                Map.of("season", 2015, "player_id", "QB2", "attempts", 12)));
        StatTable right = new StatTable(List.of("season", "player_id", "passing_epa"), List.of(
                Map.of("season", 2015, "player_id", "QB1", "passing_epa", 4.2),
                Map.of("season", 2015, "player_id", "QB9", "passing_epa", -1.0)));

        StatTable joined = left.leftJoin(right, KEYS);

        assertThat(joined.getColumns()).containsExactly("season", "player_id", "attempts", "passing_epa");
        assertThat(joined.size()).isEqualTo(2);
        assertThat(joined.column("passing_epa")).containsExactly(4.2, null);
    }

    @Test
    void sortByShouldPutNullsLast() {
        Map<String, Object> noSeason = new HashMap<>();
        noSeason.put("season", null);
        noSeason.put("player_id", "A");
        StatTable table = new StatTable(KEYS, List.of(
                Map.of("season", 2016, "player_id", "B"),
                noSeason,
                Map.of("season", 2015, "player_id", "C"),
                Map.of("season", 2015, "player_id", "A")));

        StatTable sorted = table.sortBy(KEYS);

        assertThat(sorted.column("player_id")).containsExactly("A", "C", "B", "A");
        assertThat(sorted.column("season")).containsExactly(2015, 2015, 2016, null);
    }

    @Test
    void sortByShouldCompareMixedNumericTypesByValue() {
        StatTable table = new StatTable(List.of("week", "player_id"), List.of(
                Map.of("week", 10L, "player_id", "A"),
                Map.of("week", 2, "player_id", "B"),
                Map.of("week", 9.5, "player_id", "C")));

        StatTable sorted = table.sortBy(List.of("week"));

        assertThat(sorted.column("player_id")).containsExactly("B", "C", "A");
    }

    @Test
    void selectShouldReorderAndDrop() {
        StatTable table = new StatTable(List.of("a", "b", "c"), List.of(Map.of("a", 1, "b", 2, "c", 3)));

        StatTable selected = table.select(List.of("c", "unknown", "a"));

        assertThat(selected.getColumns()).containsExactly("c", "a");
        assertThat(selected.getRows().get(0)).containsOnlyKeys("c", "a");
    }

    @Test
    void findRowShouldMatchAllGivenValues() {
        StatTable table = new StatTable(KEYS, List.of(
                Map.of("season", 2015, "player_id", "QB1"),
                Map.of("season", 2016, "player_id", "QB1")));

        assertThat(table.findRow(Map.of("player_id", "QB1", "season", 2016)).orElseThrow().get("season"))
                .isEqualTo(2016);
        assertThat(table.findRow(Map.of("player_id", "QB2"))).isEmpty();
    }

    @Test
    void missingColumnsShouldBeNullAndDiagnosticKept() {
        StatTable table = new StatTable(Arrays.asList("season", "games"), List.of(Map.of("season", 2015)));

        assertThat(table.getRows().get(0)).containsEntry("games", null);
        assertThat(StatTable.empty("vide").getDiagnostic()).isEqualTo("vide");
        assertThat(StatTable.empty("vide").isEmpty()).isTrue();
    }
}
