package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * @author Planorama Team
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Find user by ID with pessimistic write lock.
     * Serializes template writes of one organizer.
     *
     * @param userId User ID
     * @return Optional containing the locked user if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.userId = :userId")
    Optional<User> findByIdForUpdate(@Param("userId") String userId);

    /**
     * Point the organizer's default at a template. Replaces any previous default in the same
     * statement, so there is never more than one.
     *
     * @param userId Organizer ID
     * @param templateId Template ID
     * @return Number of rows updated
     */
    @Modifying
    @Query("UPDATE User u SET u.defaultEmailTemplateId = :templateId, u.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE u.userId = :userId")
    int setDefaultEmailTemplate(@Param("userId") String userId, @Param("templateId") String templateId);

    /**
     * Clear the organizer's default only if it still points at {@code templateId}.
     *
     * @param userId Organizer ID
     * @param templateId Template ID
     * @return Number of rows updated (0 if the default pointed elsewhere)
     */
    @Modifying
    @Query("UPDATE User u SET u.defaultEmailTemplateId = NULL, u.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE u.userId = :userId AND u.defaultEmailTemplateId = :templateId")
    int clearDefaultEmailTemplate(@Param("userId") String userId, @Param("templateId") String templateId);
}
