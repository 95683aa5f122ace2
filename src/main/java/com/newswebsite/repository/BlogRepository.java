package com.newswebsite.repository;

import com.newswebsite.entity.Blog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface BlogRepository extends JpaRepository<Blog, Long>, JpaSpecificationExecutor<Blog> {

    List<Blog> findByIsActiveTrueAndIsFeaturedTrueOrderByCreatedAtDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Blog b SET b.isActive = CASE WHEN b.isActive = true THEN false ELSE true END, " +
           "b.updatedAt = :now WHERE b.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Blog b SET b.isFeatured = CASE WHEN b.isFeatured = true THEN false ELSE true END, " +
           "b.updatedAt = :now WHERE b.id = :id")
    int toggleFeatured(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Blog b SET b.author = null WHERE b.author.id = :userId")
    int clearAuthor(@Param("userId") Long userId);
}
