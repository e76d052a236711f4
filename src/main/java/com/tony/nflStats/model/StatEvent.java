package com.tony.nflStats.model;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvCustomBindByName;
import com.tony.nflStats.model.csv.NullableIntegerConverter;
import com.tony.nflStats.model.csv.NullableTextConverter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Une statistique élémentaire enregistrée sur une action (fichier "playstats").
 * Plusieurs événements par action : un par joueur et par code stat_id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StatEvent {

    // Joueur absent = événement d'équipe
    public static final String TEAM_PLAYER_ID = "TEAM";

    @CsvBindByName(column = "season") private Integer season;
    @CsvBindByName(column = "week") private Integer week;
    @CsvBindByName(column = "game_id") private String gameId;
    @CsvBindByName(column = "play_id") private Long playId;
    // "NA" = valeur manquante dans le flux
    @CsvCustomBindByName(column = "gsis_player_id", converter = NullableTextConverter.class)
    private String playerId;
    @CsvCustomBindByName(column = "player_name", converter = NullableTextConverter.class)
    private String playerName;
    @CsvCustomBindByName(column = "team_abbr", converter = NullableTextConverter.class)
    private String team;
    @CsvBindByName(column = "stat_id") private Integer statId;
    @CsvCustomBindByName(column = "yards", converter = NullableIntegerConverter.class)
    private Integer yards;
}
