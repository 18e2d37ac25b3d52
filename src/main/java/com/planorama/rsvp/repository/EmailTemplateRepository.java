package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.EmailTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for EmailTemplate entity.
 *
 * @author Planorama Team
 */
@Repository
public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, String> {

    Optional<EmailTemplate> findByOrganizerIdAndEventId(String organizerId, String eventId);

    /**
     * Organizer-level template (not tied to an event).
     */
    Optional<EmailTemplate> findFirstByOrganizerIdAndEventIdIsNull(String organizerId);

    Optional<EmailTemplate> findByTemplateIdAndOrganizerId(String templateId, String organizerId);
}
