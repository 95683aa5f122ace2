package com.newswebsite.repository;

import com.newswebsite.entity.News;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface NewsRepository extends JpaRepository<News, Long>, JpaSpecificationExecutor<News> {

    List<News> findByIsActiveTrueAndIsTrendingTrueOrderByCreatedAtDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE News n SET n.isActive = CASE WHEN n.isActive = true THEN false ELSE true END, " +
           "n.updatedAt = :now WHERE n.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE News n SET n.isTrending = CASE WHEN n.isTrending = true THEN false ELSE true END, " +
           "n.updatedAt = :now WHERE n.id = :id")
    int toggleTrending(@Param("id") Long id, @Param("now") LocalDateTime now);
}
