package com.newswebsite.repository;

import com.newswebsite.entity.FestivalHighlight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FestivalHighlightRepository extends JpaRepository<FestivalHighlight, Long>, JpaSpecificationExecutor<FestivalHighlight> {

    List<FestivalHighlight> findByIsActiveTrueOrderByDisplayOrderAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE FestivalHighlight h SET h.isActive = CASE WHEN h.isActive = true THEN false ELSE true END, " +
           "h.updatedAt = :now WHERE h.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);
}
