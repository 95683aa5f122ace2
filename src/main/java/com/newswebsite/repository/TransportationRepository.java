package com.newswebsite.repository;

import com.newswebsite.entity.Transportation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TransportationRepository extends JpaRepository<Transportation, Long>, JpaSpecificationExecutor<Transportation> {

    List<Transportation> findByIsActiveTrueOrderByDisplayOrderAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Transportation t SET t.isActive = CASE WHEN t.isActive = true THEN false ELSE true END, " +
           "t.updatedAt = :now WHERE t.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);
}
