package com.tony.nflStats.repository;

import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.PlayId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;

public interface PlayRepository extends JpaRepository<Play, PlayId> {

    long countBySeason(Integer season);

    // Suppression en masse, sans charger les entités
    @Modifying
    @Query("delete from Play p where p.season in :seasons")
    int deleteBySeasonIn(@Param("seasons") Collection<Integer> seasons);
}
