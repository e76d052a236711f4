package com.tony.nflStats.repository;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.model.StatType;
import com.tony.nflStats.model.SummaryLevel;
import com.tony.nflStats.service.StatsCalculationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Upsert d'une table de stats calculée dans {stat_type}_{summary_level}_stats
 * (ex. player_season_stats), clés = clés de regroupement.
 */
@Repository
@RequiredArgsConstructor
public class StatTableWriter {

    private final UpsertWriter upsertWriter;

    public static String tableName(StatType statType, SummaryLevel summaryLevel) {
        return statType.getCode() + "_" + summaryLevel.getCode() + "_stats";
    }

    /**
     * @return nombre de lignes envoyées
     */
    public int write(StatTable table, StatType statType, SummaryLevel summaryLevel) {
        List<String> keys = StatsCalculationService.groupingKeys(summaryLevel, statType);
        List<String> updateColumns = table.getColumns().stream().filter(c -> !keys.contains(c)).toList();
        return upsertWriter.upsert(tableName(statType, summaryLevel), table, keys, updateColumns);
    }
}
