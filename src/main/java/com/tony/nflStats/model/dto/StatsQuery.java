package com.tony.nflStats.model.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Paramètres d'un calcul de stats. Les codes sont validés à l'entrée du pipeline,
 * pas ici : un code inconnu doit échouer avant tout chargement de données.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatsQuery {
    @NotEmpty
    private List<Integer> seasons;
    private String summaryLevel = "season";
    private String statType = "player";
    private String seasonType = "REG";

    public StatsQuery(List<Integer> seasons) {
        this.seasons = seasons;
    }
}
