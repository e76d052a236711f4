package com.tony.nflStats.service;

import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.StatEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jeux de données minimaux pour les tests du pipeline.
 */
final class Fixtures {

    private Fixtures() {
    }

    static Play play(int season, int week, String gameId, long playId, String playType, String posteam, String defteam) {
        Play play = new Play();
        play.setSeason(season);
        play.setWeek(week);
        play.setGameId(gameId);
        play.setPlayId(playId);
        play.setSeasonType("REG");
        play.setPlayType(playType);
        play.setPosteam(posteam);
        play.setDefteam(defteam);
        play.setSpecial(0);
        play.setQbDropback(0);
        play.setQbScramble(0);
        play.setSuccess(0);
        return play;
    }

    static StatEvent event(int season, int week, String gameId, long playId,
                           String playerId, String team, int statId, int yards) {
        return StatEvent.builder()
                .season(season)
                .week(week)
                .gameId(gameId)
                .playId(playId)
                .playerId(playerId)
                .playerName(playerId == null ? null : "Player " + playerId)
                .team(team)
                .statId(statId)
                .yards(yards)
                .build();
    }

    /**
     * Ligne brute telle que lue dans le fichier play-by-play (valeurs texte).
     */
    static Map<String, Object> rawPlay(int season, int week, String gameId, long playId, String playType) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("play_id", String.valueOf(playId));
        row.put("game_id", gameId);
        row.put("season", String.valueOf(season));
        row.put("week", String.valueOf(week));
        row.put("season_type", "REG");
        row.put("home_team", "NE");
        row.put("away_team", "PIT");
        row.put("posteam", "NE");
        row.put("defteam", "PIT");
        row.put("down", "1");
        row.put("play_type", playType);
        row.put("score_differential", "0");
        row.put("yardline_100", "75");
        row.put("qb_dropback", "pass".equals(playType) ? "1" : "0");
        row.put("qb_scramble", "0");
        row.put("success", "1");
        row.put("special", "0");
        row.put("epa", "0.5");
        row.put("qb_epa", "0.5");
        row.put("cpoe", "NA");
        row.put("passer_player_id", "pass".equals(playType) ? "QB1" : "NA");
        row.put("rusher_player_id", "run".equals(playType) ? "RB1" : "NA");
        row.put("receiver_player_id", "NA");
        return row;
    }
}
