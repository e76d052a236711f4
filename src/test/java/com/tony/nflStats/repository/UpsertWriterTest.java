package com.tony.nflStats.repository;

import com.tony.nflStats.model.StatTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpsertWriterTest {

    @Mock
    private JdbcTemplate jdbc;

    @InjectMocks
    private UpsertWriter writer;

    @Captor
    private ArgumentCaptor<Collection<Object[]>> argsCaptor;

    @Test
    void upsertSqlShouldUpdateRequestedColumns() {
        String sql = UpsertWriter.upsertSql("player_season_stats",
                List.of("season", "player_id", "attempts", "passing_yards"),
                List.of("season", "player_id"),
                List.of("attempts", "passing_yards"));

        assertThat(sql).isEqualTo("INSERT INTO player_season_stats (season, player_id, attempts, passing_yards)"
                + " VALUES (?, ?, ?, ?) ON CONFLICT (season, player_id)"
                + " DO UPDATE SET attempts = EXCLUDED.attempts, passing_yards = EXCLUDED.passing_yards");
        assertThat(UpsertWriter.upsertSql("t", List.of("season", "team"), List.of("season", "team"), List.of()))
                .endsWith("ON CONFLICT (season, team) DO NOTHING");
    }

    @Test
    void emptyTableShouldNotTouchDatabase() {
        int written = writer.upsert("games", StatTable.empty("vide"), List.of("game_id"), List.of());

        assertThat(written).isZero();
        verifyNoInteractions(jdbc);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBatchRowsInColumnOrderWithNulls() {
        // ARRANGE
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("game_id", "2015_01_PIT_NE");
        withNull.put("away_score", null);
        withNull.put("home_score", 28);
        StatTable table = new StatTable(List.of("game_id", "away_score", "home_score"), List.of(withNull));

        // ACT
        int written = writer.upsert("games", table, List.of("game_id"), List.of("away_score", "home_score"));

        // ASSERT
        assertThat(written).isEqualTo(1);
        verify(jdbc, times(1)).batchUpdate(
                eq("INSERT INTO games (game_id, away_score, home_score) VALUES (?, ?, ?)"
                        + " ON CONFLICT (game_id) DO UPDATE SET away_score = EXCLUDED.away_score,"
                        + " home_score = EXCLUDED.home_score"),
                argsCaptor.capture(),
                eq(1000),
                any(ParameterizedPreparedStatementSetter.class));
        assertThat(argsCaptor.getValue()).containsExactly(new Object[]{"2015_01_PIT_NE", null, 28});
    }

    @Test
    void shouldRejectUnsafeIdentifiers() {
        StatTable table = new StatTable(List.of("season", "team", "x; DROP TABLE plays"),
                List.of(Map.of("season", 2015, "team", "NE")));

        assertThatThrownBy(() -> writer.upsert("team_season_stats", table, List.of("season", "team"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        StatTable safe = new StatTable(List.of("team"), List.of(Map.of("team", "NE")));
        assertThatThrownBy(() -> writer.upsert("teams; --", safe, List.of("team"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbc);
    }

    @Test
    void shouldRejectMissingKeyOrUpdateColumns() {
        StatTable table = new StatTable(List.of("season", "attempts"), List.of(Map.of("season", 2015, "attempts", 3)));

        assertThatThrownBy(() -> writer.upsert("player_season_stats", table, List.of("season", "player_id"), List.of("attempts")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.upsert("player_season_stats", table, List.of("season"), List.of("targets")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbc);
    }
}
