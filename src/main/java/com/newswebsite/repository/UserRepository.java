package com.newswebsite.repository;

import com.newswebsite.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long>, JpaSpecificationExecutor<User> {

    Optional<User> findByEmail(String email);

    boolean existsByEmailAndIdNot(String email, Long id);

    Optional<User> findFirstByEmailAndVerificationTokenAndVerificationTokenExpiresAfter(
            String email, String verificationToken, LocalDateTime now);

    Optional<User> findFirstByResetPasswordTokenAndResetPasswordExpiresAfter(
            String resetPasswordToken, LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.isActive = CASE WHEN u.isActive = true THEN false ELSE true END, " +
           "u.updatedAt = :now WHERE u.id = :id")
    int toggleActive(@Param("id") Long id, @Param("now") LocalDateTime now);
}
