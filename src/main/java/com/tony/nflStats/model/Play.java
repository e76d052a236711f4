package com.tony.nflStats.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * Une action (un "down") du play-by-play, après nettoyage.
 * Les noms JSON suivent les colonnes du flux source (snake_case).
 */
@Entity
@Table(name = "plays")
@IdClass(PlayId.class)
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Play implements Persistable<PlayId> {

    // --- Identifiants ---
    @Id
    private Integer season;
    @Id
    private Long playId;
    @Id
    private String gameId;

    private Integer week;
    private String seasonType;

    // --- Équipes ---
    private String homeTeam;
    private String awayTeam;
    private String posteam;
    private String defteam;

    // --- Situation : temps ---
    private String gameDate;
    private Integer qtr;
    private Double gameSecondsRemaining;
    private Double halfSecondsRemaining;
    private String timeOfDay;

    // --- Situation : terrain ---
    private Integer down; // null hors tentatives (kickoff, PAT...)
    private Double ydstogo;
    @JsonProperty("yardline_100")
    @Column(name = "yardline_100")
    private Double yardline100;
    private Integer goalToGo;

    // --- Situation : score ---
    private Double scoreDifferential;
    private Double posteamScore;
    private Double defteamScore;
    private Double totalHomeScore;
    private Double totalAwayScore;

    // --- Classification ---
    private String playType;
    private Integer shotgun;
    private Integer noHuddle;
    private Integer qbDropback;
    private Integer qbScramble;
    private Integer qbKneel;
    private Integer qbSpike;
    private String passLength;
    private String passLocation;
    private String runLocation;
    private String runGap;

    // --- Performance ---
    private Double epa;
    private Double qbEpa;
    private Double wp;
    private Double wpa;
    private Double airYards;
    private Double yardsAfterCatch;
    private Double cpoe;
    private Integer success;
    private Double xpass;

    // --- Issues de l'action ---
    private Integer firstDownRush;
    private Integer firstDownPass;
    private Integer firstDown;
    private Integer rushAttempt;
    private Integer passAttempt;
    private Integer completePass;
    private Integer incompletePass;
    private Integer sack;
    private Integer touchdown;
    private Integer interception;
    private Integer fumble;
    private Integer fumbleLost;
    private Integer passTouchdown;
    private Integer rushTouchdown;

    // --- Joueurs impliqués ---
    private String passerPlayerId;
    private String passerPlayerName;
    private Double passingYards;
    private String rusherPlayerId;
    private String rusherPlayerName;
    private Double rushingYards;
    private String receiverPlayerId;
    private String receiverPlayerName;
    private Double receivingYards;

    // --- Match ---
    private String stadium;
    private String roof;
    private String surface;
    private Double temp;
    private Double wind;
    private Integer divGame;

    // --- Équipes spéciales ---
    private Integer special;
    private Integer specialTeamsPlay;

    // --- Indicateurs dérivés (0/1) ---
    private Integer isTrailing;
    private Integer isLeading;
    private Integer isRedZone;
    private Integer isEarlyDown;
    private Integer isLateDown;
    private Integer isLikelyPass;
    private Integer isDropback;
    private Integer isSuccess;

    @Override
    @JsonIgnore
    public PlayId getId() {
        return new PlayId(season, playId, gameId);
    }

    // Saisons vidées avant rechargement : persist direct, sans SELECT préalable
    @Override
    @JsonIgnore
    public boolean isNew() {
        return true;
    }
}
