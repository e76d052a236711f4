package com.tony.nflStats.repository;

import com.tony.nflStats.model.EnrichedEvent;
import com.tony.nflStats.model.PlayStatId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;

public interface PlayStatRepository extends JpaRepository<EnrichedEvent, PlayStatId> {

    long countBySeason(Integer season);

    @Modifying
    @Query("delete from EnrichedEvent e where e.season in :seasons")
    int deleteBySeasonIn(@Param("seasons") Collection<Integer> seasons);
}
