package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.InvitationToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for InvitationToken entity.
 *
 * @author Planorama Team
 */
@Repository
public interface InvitationTokenRepository extends JpaRepository<InvitationToken, String> {

    /**
     * Resolve the secret from an invitation link.
     *
     * @param token Hex secret
     * @return Optional containing the invitation if found
     */
    Optional<InvitationToken> findByToken(String token);

    boolean existsByToken(String token);

    /**
     * All invitations of an event, newest first.
     *
     * @param eventId Event ID
     * @return List of invitations
     */
    List<InvitationToken> findByEventIdOrderByCreatedAtDesc(String eventId);

    /**
     * Link every not-yet-linked invitation sent to {@code email} to the account that now owns it.
     * Called once at signup.
     *
     * @param email Normalized email
     * @param userId Account ID
     * @return Number of invitations linked
     */
    @Transactional
    @Modifying
    @Query("UPDATE InvitationToken t SET t.inviteeUserId = :userId, t.updatedAt = CURRENT_TIMESTAMP " +
           "WHERE t.email = :email AND t.inviteeUserId IS NULL")
    int linkInviteeAccount(@Param("email") String email, @Param("userId") String userId);

    /**
     * Overwrite the display name with the one a guest submitted.
     *
     * @param tokenId Token ID
     * @param name Trimmed guest name
     * @return Number of rows updated
     */
    @Modifying
    @Query("UPDATE InvitationToken t SET t.name = :name, t.updatedAt = CURRENT_TIMESTAMP WHERE t.tokenId = :tokenId")
    int updateName(@Param("tokenId") String tokenId, @Param("name") String name);
}
