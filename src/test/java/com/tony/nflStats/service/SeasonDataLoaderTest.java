package com.tony.nflStats.service;

import com.tony.nflStats.config.StatsProperties;
import com.tony.nflStats.model.EnrichedEvent;
import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.StatEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeasonDataLoaderTest {

    @TempDir
    Path dataDir;

    private SeasonDataLoader loader;

    @BeforeEach
    void setUp() {
        StatsProperties properties = new StatsProperties();
        properties.setDataDir(dataDir.toString());
        loader = new SeasonDataLoader(properties, new SeasonCalendar());
    }

    @Test
    void shouldReadPlayByPlayRowsAsMaps() throws IOException {
        write("pbp", 2015, """
                play_id,game_id,season,posteam
                1,2015_01_PIT_NE,2015,NE
                2,2015_01_PIT_NE,2015,PIT
                """);

        List<Map<String, String>> rows = loader.loadPlays(List.of(2015));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1)).containsEntry("play_id", "2").containsEntry("posteam", "PIT");
    }

    @Test
    void shouldReadStatEventsAndNormalizeTeams() throws IOException {
        write("playstats", 2016, """
                season,week,game_id,play_id,gsis_player_id,player_name,team_abbr,stat_id,yards
                2016,1,2016_01_LA_SF,35,00-0031234,J.Goff,LAR,15,12
                2016,1,2016_01_LA_SF,35,,,SF,4,0
                """);

        List<StatEvent> events = loader.loadStatEvents(List.of(2016));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).getTeam()).isEqualTo("LA");
        assertThat(events.get(0).getPlayId()).isEqualTo(35L);
        assertThat(events.get(0).getStatId()).isEqualTo(15);
        assertThat(events.get(0).getYards()).isEqualTo(12);
        assertThat(events.get(1).getTeam()).isEqualTo("SF");
    }

    @Test
    @DisplayName("NA dans playstats : valeur manquante, la ligne est conservée")
    void missingMarkersShouldBecomeNull() throws IOException {
        write("playstats", 2016, """
                season,week,game_id,play_id,gsis_player_id,player_name,team_abbr,stat_id,yards
                2016,1,2016_01_LA_SF,35,NA,NA,SF,4,0
                2016,1,2016_01_LA_SF,35,00-0033106,J.Goff,LA,15,NA
                """);

        List<StatEvent> events = loader.loadStatEvents(List.of(2016));

        assertThat(events).hasSize(2);
        assertThat(events.get(0).getPlayerId()).isNull();
        assertThat(events.get(0).getPlayerName()).isNull();
        assertThat(events.get(1).getYards()).isNull();
        assertThat(events.get(1).getStatId()).isEqualTo(15);
    }

    @Test
    void loadedTeamEventShouldBeKeyedToTeamAfterEnrichment() throws IOException {
        write("playstats", 2016, """
                season,week,game_id,play_id,gsis_player_id,player_name,team_abbr,stat_id,yards
                2016,1,2016_01_LA_SF,35,NA,NA,SF,4,0
                2016,1,2016_01_LA_SF,35,00-0033106,J.Goff,LA,15,NA
                """);
        Play play = Fixtures.play(2016, 1, "2016_01_LA_SF", 35, "pass", "SF", "LA");

        List<EnrichedEvent> enriched = new EventFlagEnricher()
                .enrich(List.of(play), loader.loadStatEvents(List.of(2016)), List.of(2016));

        assertThat(enriched).extracting(EnrichedEvent::getPlayerId)
                .containsExactly(StatEvent.TEAM_PLAYER_ID, "00-0033106");
        assertThat(enriched.get(1).isComp()).isTrue();
        assertThat(enriched.get(1).getPassYards()).isZero();
    }

    @Test
    void seasonAfterMostRecentShouldBeRejected() {
        int nextSeason = new SeasonCalendar().mostRecentSeason() + 1;

        assertThatThrownBy(() -> loader.loadPlays(List.of(nextSeason)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReadGamesAndSnapCountsPerSeason() throws IOException {
        write("games", 2015, """
                game_id,season,home_team,away_team
                2015_01_PIT_NE,2015,NE,PIT
                """);
        write("games", 2016, """
                game_id,season,home_team,away_team
                2016_01_LA_SF,2016,SF,LA
                """);
        write("snap_counts", 2016, """
                game_id,pfr_player_id,position,offense_snaps
                2016_01_LA_SF,GoffJa00,QB,60
                """);

        assertThat(loader.loadGames(List.of(2015, 2016)))
                .extracting(row -> row.get("game_id"))
                .containsExactly("2015_01_PIT_NE", "2016_01_LA_SF");
        assertThat(loader.loadSnapCounts(List.of(2016))).singleElement()
                .satisfies(row -> assertThat(row).containsEntry("offense_snaps", "60"));
    }

    @Test
    void shouldReadReferenceFiles() throws IOException {
        Path dir = Files.createDirectories(dataDir.resolve("ids"));
        Files.writeString(dir.resolve("ids.csv"), """
                gsis_id,pfr_id,height,weight
                00-0033106,GoffJa00,76,217
                """);

        assertThat(loader.loadReference("ids")).singleElement()
                .satisfies(row -> assertThat(row).containsEntry("pfr_id", "GoffJa00"));
        assertThatThrownBy(() -> loader.loadReference("players"))
                .isInstanceOf(MissingSourceDataException.class)
                .hasMessageContaining("players.csv");
    }

    @Test
    void missingFileShouldRaiseMissingSourceData() {
        assertThatThrownBy(() -> loader.loadPlays(List.of(2020)))
                .isInstanceOf(MissingSourceDataException.class)
                .hasMessageContaining("2020");
    }

    @Test
    void seasonBeforeFirstShouldBeRejected() {
        assertThatThrownBy(() -> loader.loadStatEvents(List.of(1998)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("PBP data only available from 1999 onwards");
    }

    private void write(String kind, int season, String content) throws IOException {
        Path dir = Files.createDirectories(dataDir.resolve(kind));
        Files.writeString(dir.resolve(kind + "_" + season + ".csv"), content);
    }
}
