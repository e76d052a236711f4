package com.tony.nflStats.service;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.repository.UpsertWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Alimentation des tables de dimension (teams, players, games, snap_counts),
 * dans l'ordre des clés étrangères.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DimensionSeedService {

    // Pas de snap counts publiés avant 2012
    static final int SNAP_COUNTS_FIRST_SEASON = 2012;

    private final SeasonDataLoader dataLoader;
    private final DimensionCleaner cleaner;
    private final UpsertWriter upsertWriter;

    public String seed(List<Integer> seasons) {
        log.info("🚀 Dimensions des saisons {}...", seasons);

        StatTable games = cleaner.cleanGames(dataLoader.loadGames(seasons));
        List<Map<String, String>> ids = dataLoader.loadReference("ids");
        StatTable teams = cleaner.cleanTeams(dataLoader.loadReference("teams"), games);
        StatTable players = cleaner.cleanPlayers(dataLoader.loadReference("players"), ids);

        List<Integer> snapSeasons = seasons.stream().filter(s -> s >= SNAP_COUNTS_FIRST_SEASON).toList();
        StatTable snapCounts;
        if (snapSeasons.isEmpty()) {
            log.info("Snap counts : aucune saison à partir de {}", SNAP_COUNTS_FIRST_SEASON);
            snapCounts = StatTable.empty(null);
        } else {
            snapCounts = cleaner.cleanSnapCounts(dataLoader.loadSnapCounts(snapSeasons), ids);
        }

        int teamCount = upsertWriter.upsert("teams", teams, List.of("team_abbr"),
                DimensionCleaner.TEAM_COLUMNS.subList(1, DimensionCleaner.TEAM_COLUMNS.size()));
        int playerCount = upsertWriter.upsert("players", players, List.of("gsis_id"), List.of("status", "team_abbr"));
        int gameCount = upsertWriter.upsert("games", games, List.of("game_id"), List.of("away_score", "home_score"));
        int snapCount = upsertWriter.upsert("snap_counts", snapCounts, List.of("gsis_id", "game_id"),
                List.of("offense_snaps", "offense_pct"));

        return String.format("%d équipes, %d joueurs, %d matchs, %d snap counts",
                teamCount, playerCount, gameCount, snapCount);
    }
}
