package com.tony.nflStats.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.util.Set;

/**
 * Événement stat enrichi : drapeaux dérivés du stat_id, contexte de l'action
 * et totaux équipe (dénominateurs des parts de ciblage).
 */
@Entity
@Table(name = "playstats")
@IdClass(PlayStatId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedEvent implements Persistable<PlayStatId> {

    @Id
    private Integer season;
    @Id
    private Long playId;
    @Id
    private String gameId;
    @Id
    private String playerId;
    @Id
    private Integer statId;

    private Integer week;
    private String playerName;
    private String team;
    private int yards;

    // --- Contexte de l'action ---
    @Column(name = "off_team")
    private String offenseTeam;
    @Column(name = "def_team")
    private String defenseTeam;
    private int special;
    private String seasonType;

    // Codes relevés sur la même action (joueur / équipe)
    @Transient
    private Set<Integer> playerPlayCodes;
    @Transient
    private Set<Integer> teamPlayCodes;

    private int teamPlayAirYards;
    private int teamGameTargets;
    private int teamGameAirYards;

    // --- Drapeaux issus du stat_id ---
    @Column(name = "is_comp") private boolean comp;
    @Column(name = "is_att") private boolean att;
    @Column(name = "is_pass_td") private boolean passTd;
    @Column(name = "is_int") private boolean interception;
    @Column(name = "is_sack") private boolean sack;
    @Column(name = "is_air_yards") private boolean airYardsEvent;
    @Column(name = "qb_target") private boolean qbTarget;
    @Column(name = "is_carry") private boolean carry;
    @Column(name = "is_rush_yards") private boolean rushYardsEvent;
    @Column(name = "is_rush_td") private boolean rushTd;
    @Column(name = "is_rec") private boolean rec;
    @Column(name = "is_target") private boolean target;
    @Column(name = "is_rec_yards") private boolean recYardsEvent;
    @Column(name = "is_rec_td") private boolean recTd;
    @Column(name = "is_yac") private boolean yacEvent;
    @Column(name = "is_pass_2pt") private boolean pass2pt;
    @Column(name = "is_rush_2pt") private boolean rush2pt;
    @Column(name = "is_rec_2pt") private boolean rec2pt;

    // --- Drapeaux composés (codes co-occurrents sur l'action) ---
    @Column(name = "has_fumble") private boolean fumbleOnPlay;
    @Column(name = "has_fumble_lost") private boolean fumbleLostOnPlay;
    @Column(name = "has_rush_first_down") private boolean rushFirstDownOnPlay;
    @Column(name = "has_pass_first_down") private boolean passFirstDownOnPlay;
    @Column(name = "is_sack_fumble") private boolean sackFumble;
    @Column(name = "is_sack_fumble_lost") private boolean sackFumbleLost;
    @Column(name = "is_rush_fumble") private boolean rushFumble;
    @Column(name = "is_rush_fumble_lost") private boolean rushFumbleLost;
    @Column(name = "is_rec_fumble") private boolean recFumble;
    @Column(name = "is_rec_fumble_lost") private boolean recFumbleLost;
    @Column(name = "is_rush_first_down") private boolean rushFirstDown;
    @Column(name = "is_pass_first_down") private boolean passFirstDown;
    @Column(name = "is_rec_first_down") private boolean recFirstDown;
    @Column(name = "is_special_td") private boolean specialTd;

    // --- Yards ventilés par catégorie (0 si le drapeau porteur est faux) ---
    private int passYards;
    private int sackYards;
    private int airYards;
    private int airYardsComplete;
    private int rushYards;
    private int recYards;
    private int yac;

    @Override
    @JsonIgnore
    public PlayStatId getId() {
        return new PlayStatId(season, playId, gameId, playerId, statId);
    }

    @Override
    @JsonIgnore
    public boolean isNew() {
        return true;
    }
}
