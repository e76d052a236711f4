package com.tony.nflStats.repository;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.model.StatType;
import com.tony.nflStats.model.SummaryLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatTableWriterTest {

    @Mock
    private UpsertWriter upsertWriter;

    @InjectMocks
    private StatTableWriter writer;

    @Test
    void tableNameShouldCombineTypeAndLevel() {
        assertThat(StatTableWriter.tableName(StatType.PLAYER, SummaryLevel.SEASON)).isEqualTo("player_season_stats");
        assertThat(StatTableWriter.tableName(StatType.TEAM, SummaryLevel.WEEK)).isEqualTo("team_week_stats");
    }

    @Test
    void shouldKeyOnGroupingColumnsAndUpdateTheRest() {
        // ARRANGE
        StatTable table = new StatTable(List.of("season", "week", "game_id", "team", "attempts", "passing_yards"),
                List.of(Map.of("season", 2015, "week", 1, "game_id", "G1", "team", "NE",
                        "attempts", 40, "passing_yards", 310)));
        when(upsertWriter.upsert(any(), any(), any(), any())).thenReturn(1);

        // ACT
        int written = writer.write(table, StatType.TEAM, SummaryLevel.WEEK);

        // ASSERT
        assertThat(written).isEqualTo(1);
        verify(upsertWriter, times(1)).upsert("team_week_stats", table,
                List.of("season", "week", "game_id", "team"), List.of("attempts", "passing_yards"));
    }
}
