package com.tony.nflStats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "nfl.stats")
@Data
public class StatsProperties {
    // Racine des fichiers locaux : {dataDir}/pbp/pbp_2024.csv, {dataDir}/playstats/playstats_2024.csv
    private String dataDir = "data";

    // Le play-by-play n'existe pas avant 1999
    private int firstSeason = 1999;

    // Saisons chargées par le seed complet (vide = saison en cours uniquement)
    private List<Integer> seedSeasons = new ArrayList<>();

    // --- Job hebdomadaire ---
    private boolean refreshEnabled = false;
}
