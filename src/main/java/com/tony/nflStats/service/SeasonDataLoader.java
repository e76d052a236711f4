package com.tony.nflStats.service;

import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.bean.CsvToBean;
import com.opencsv.bean.CsvToBeanBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.tony.nflStats.config.StatsProperties;
import com.tony.nflStats.model.StatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lecture des fichiers locaux : saisonniers (play-by-play, playstats, matchs, snap counts)
 * et de référence (joueurs, équipes, identifiants).
 * Le téléchargement et la mise en cache des fichiers se font en amont.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonDataLoader {

    private final StatsProperties properties;
    private final SeasonCalendar seasonCalendar;

    /**
     * Lignes brutes du play-by-play, une map colonne -> valeur par action.
     */
    public List<Map<String, String>> loadPlays(List<Integer> seasons) {
        return loadSeasonRows("pbp", seasons);
    }

    /**
     * Calendrier et résultats des matchs ({dataDir}/games/games_{saison}.csv).
     */
    public List<Map<String, String>> loadGames(List<Integer> seasons) {
        return loadSeasonRows("games", seasons);
    }

    public List<Map<String, String>> loadSnapCounts(List<Integer> seasons) {
        return loadSeasonRows("snap_counts", seasons);
    }

    /**
     * Fichiers de référence sans saison : players, teams, ids ({dataDir}/{kind}/{kind}.csv).
     */
    public List<Map<String, String>> loadReference(String kind) {
        Path file = Path.of(properties.getDataDir(), kind, kind + ".csv");
        if (!Files.exists(file)) {
            throw new MissingSourceDataException("Fichier de référence introuvable : " + file);
        }
        List<Map<String, String>> rows = readRows(file);
        log.info("📥 {} : {} lignes", kind, rows.size());
        return rows;
    }

    /**
     * Événements playstats, codes équipes normalisés.
     */
    public List<StatEvent> loadStatEvents(List<Integer> seasons) {
        checkSeasons(seasons);
        List<StatEvent> events = new ArrayList<>();

        for (Integer season : seasons) {
            Path file = seasonFile("playstats", season);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                CsvToBean<StatEvent> csvToBean = new CsvToBeanBuilder<StatEvent>(reader)
                        .withType(StatEvent.class)
                        .withSeparator(',')
                        .withIgnoreLeadingWhiteSpace(true)
                        .withThrowExceptions(false)
                        .build();
                List<StatEvent> parsed = csvToBean.parse();
                if (!csvToBean.getCapturedExceptions().isEmpty()) {
                    log.warn("⚠️ playstats {} : {} lignes illisibles ignorées",
                            season, csvToBean.getCapturedExceptions().size());
                }
                parsed.forEach(e -> e.setTeam(TeamAbbreviations.normalizeStatTeam(e.getTeam())));
                events.addAll(parsed);
                log.info("📥 Playstats {} : {} événements", season, parsed.size());
            } catch (IOException e) {
                throw new MissingSourceDataException("Lecture impossible : " + file, e);
            }
        }
        return events;
    }

    private List<Map<String, String>> loadSeasonRows(String kind, List<Integer> seasons) {
        checkSeasons(seasons);
        List<Map<String, String>> rows = new ArrayList<>();

        for (Integer season : seasons) {
            List<Map<String, String>> seasonRows = readRows(seasonFile(kind, season));
            log.info("📥 {} {} : {} lignes", kind, season, seasonRows.size());
            rows.addAll(seasonRows);
        }
        return rows;
    }

    private List<Map<String, String>> readRows(Path file) {
        List<Map<String, String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReaderHeaderAware csv = new CSVReaderHeaderAware(reader)) {
            Map<String, String> row;
            while ((row = csv.readMap()) != null) {
                rows.add(row);
            }
        } catch (IOException | CsvValidationException e) {
            throw new MissingSourceDataException("Lecture impossible : " + file, e);
        }
        return rows;
    }

    private void checkSeasons(List<Integer> seasons) {
        seasonCalendar.checkSeasons(seasons, properties.getFirstSeason());
    }

    private Path seasonFile(String kind, int season) {
        Path file = Path.of(properties.getDataDir(), kind, kind + "_" + season + ".csv");
        if (!Files.exists(file)) {
            throw new MissingSourceDataException("Fichier introuvable pour la saison " + season + " : " + file);
        }
        return file;
    }
}
