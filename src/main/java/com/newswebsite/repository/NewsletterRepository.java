package com.newswebsite.repository;

import com.newswebsite.entity.Newsletter;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface NewsletterRepository extends JpaRepository<Newsletter, Long> {

    Optional<Newsletter> findByEmail(String email);

    Page<Newsletter> findByIsActiveTrue(Pageable pageable);

    long countByIsActiveTrue();

    long countByIsActiveTrueAndCreatedAtGreaterThanEqual(LocalDateTime since);
}
