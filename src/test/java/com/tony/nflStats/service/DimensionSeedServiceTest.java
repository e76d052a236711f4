package com.tony.nflStats.service;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.repository.UpsertWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DimensionSeedServiceTest {

    @Mock private SeasonDataLoader dataLoader;
    @Spy private DimensionCleaner cleaner = new DimensionCleaner();
    @Mock private UpsertWriter upsertWriter;

    @InjectMocks
    private DimensionSeedService seedService;

    @Test
    void seed_ShouldUpsertDimensionsInForeignKeyOrder() {
        // ARRANGE
        when(dataLoader.loadGames(List.of(2016))).thenReturn(List.of(
                Map.of("game_id", "2016_01_LA_SF", "season", "2016", "home_team", "SF", "away_team", "LA",
                        "home_score", "28", "away_score", "0")));
        when(dataLoader.loadReference("ids")).thenReturn(List.of(
                Map.of("gsis_id", "00-0033106", "pfr_id", "GoffJa00", "height", "76", "weight", "217")));
        when(dataLoader.loadReference("teams")).thenReturn(List.of(Map.of("team_abbr", "SF")));
        when(dataLoader.loadReference("players")).thenReturn(List.of(Map.of("gsis_id", "00-0033106", "team_abbr", "LA")));
        when(dataLoader.loadSnapCounts(List.of(2016))).thenReturn(List.of(
                Map.of("game_id", "2016_01_LA_SF", "pfr_player_id", "GoffJa00", "position", "QB", "offense_snaps", "60")));
        when(upsertWriter.upsert(anyString(), any(StatTable.class), anyList(), anyList())).thenReturn(1);

        // ACT
        String report = seedService.seed(List.of(2016));

        // ASSERT
        assertThat(report).isEqualTo("1 équipes, 1 joueurs, 1 matchs, 1 snap counts");
        InOrder order = inOrder(upsertWriter);
        order.verify(upsertWriter).upsert(eq("teams"), any(StatTable.class), eq(List.of("team_abbr")), anyList());
        order.verify(upsertWriter).upsert(eq("players"), any(StatTable.class), eq(List.of("gsis_id")),
                eq(List.of("status", "team_abbr")));
        order.verify(upsertWriter).upsert(eq("games"), any(StatTable.class), eq(List.of("game_id")),
                eq(List.of("away_score", "home_score")));
        order.verify(upsertWriter).upsert(eq("snap_counts"), any(StatTable.class), eq(List.of("gsis_id", "game_id")),
                eq(List.of("offense_snaps", "offense_pct")));
    }

    @Test
    void seed_BeforeSnapCountEraShouldNotReadSnapCounts() {
        when(dataLoader.loadGames(List.of(2005))).thenReturn(List.of());
        when(dataLoader.loadReference(anyString())).thenReturn(List.of());

        seedService.seed(List.of(2005));

        verify(dataLoader, never()).loadSnapCounts(any());
    }
}
