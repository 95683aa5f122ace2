package com.newswebsite.repository;

import com.newswebsite.entity.FestivalEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface FestivalEventRepository extends JpaRepository<FestivalEvent, Long>, JpaSpecificationExecutor<FestivalEvent> {

    List<FestivalEvent> findByIsActiveTrueAndDateGreaterThanEqualOrderByDateAsc(LocalDateTime now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE FestivalEvent e SET e.isActive = CASE WHEN e.isActive = true THEN false ELSE true END, " +
           "e.updatedAt = :now WHERE e.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);
}
