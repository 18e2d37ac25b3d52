package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.EmailTemplate;
import com.planorama.rsvp.domain.model.TemplateStyle;
import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.repository.EmailTemplateRepository;
import com.planorama.rsvp.repository.EventRepository;
import com.planorama.rsvp.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Service for organizer email templates.
 *
 * Resolution order for an event: the event's own template, then the organizer's default
 * ({@link User#getDefaultEmailTemplateId()}), then {@link TemplateStyle#defaults()}.
 *
 * @author Planorama Team
 */
@Service
public class EmailTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(EmailTemplateService.class);

    private final EmailTemplateRepository templateRepository;
    private final UserRepository userRepository;
    private final EventRepository eventRepository;

    public EmailTemplateService(
            EmailTemplateRepository templateRepository,
            UserRepository userRepository,
            EventRepository eventRepository
    ) {
        this.templateRepository = templateRepository;
        this.userRepository = userRepository;
        this.eventRepository = eventRepository;
    }

    /**
     * Styling that applies to an organizer's invitations for an event.
     *
     * @param organizerId Organizer user ID
     * @param eventId Event ID, or null for the organizer-wide styling
     * @return Resolved styling, never null
     */
    @Transactional(readOnly = true)
    public TemplateStyle resolveTemplate(String organizerId, String eventId) {
        String defaultTemplateId = userRepository.findById(organizerId)
                .map(User::getDefaultEmailTemplateId)
                .orElse(null);

        if (eventId != null && !eventId.isBlank()) {
            Optional<EmailTemplate> eventTemplate = templateRepository.findByOrganizerIdAndEventId(organizerId, eventId);
            if (eventTemplate.isPresent()) {
                EmailTemplate template = eventTemplate.get();
                return TemplateStyle.from(template, template.getTemplateId().equals(defaultTemplateId));
            }
        }

        if (defaultTemplateId != null) {
            Optional<EmailTemplate> defaultTemplate =
                    templateRepository.findByTemplateIdAndOrganizerId(defaultTemplateId, organizerId);
            if (defaultTemplate.isPresent()) {
                return TemplateStyle.from(defaultTemplate.get(), true);
            }
        }

        logger.debug("No template for organizer: {}, event: {}; using built-in defaults", organizerId, eventId);
        return TemplateStyle.defaults();
    }

    /**
     * Create or replace the organizer's template for an event, or their organizer-level template.
     *
     * The organizer row is locked for the duration, which serializes template writes per organizer
     * and keeps a single organizer-level template.
     *
     * @param organizerId Organizer user ID
     * @param fields Submitted styling (unset optional fields take the built-in defaults)
     * @param eventId Owned event ID, or null for the organizer-level template
     * @param makeDefault true points the organizer's default at this template; otherwise the default
     *                    is cleared if it pointed here
     * @return Saved styling
     * @throws ResourceNotFoundException if the event is not owned by the organizer
     */
    @Transactional
    public TemplateStyle saveTemplate(String organizerId, EmailTemplate fields, String eventId, Boolean makeDefault) {
        userRepository.findByIdForUpdate(organizerId)
                .orElseThrow(() -> new ResourceNotFoundException("User", organizerId));

        String targetEventId = eventId != null && !eventId.isBlank() ? eventId : null;
        if (targetEventId != null) {
            eventRepository.findByEventIdAndCreatedBy(targetEventId, organizerId)
                    .orElseThrow(() -> new ResourceNotFoundException("Event", targetEventId));
        }

        Optional<EmailTemplate> current = targetEventId != null
                ? templateRepository.findByOrganizerIdAndEventId(organizerId, targetEventId)
                : templateRepository.findFirstByOrganizerIdAndEventIdIsNull(organizerId);

        EmailTemplate template = current.orElseGet(() -> EmailTemplate.builder()
                .organizerId(organizerId)
                .eventId(targetEventId)
                .build());
        applyFields(template, fields);

        EmailTemplate saved = templateRepository.save(template);

        boolean isDefault = Boolean.TRUE.equals(makeDefault);
        if (isDefault) {
            userRepository.setDefaultEmailTemplate(organizerId, saved.getTemplateId());
        } else {
            userRepository.clearDefaultEmailTemplate(organizerId, saved.getTemplateId());
        }

        logger.info("Saved email template: {} for organizer: {}, event: {}, default: {}",
                saved.getTemplateId(), organizerId, targetEventId, isDefault);

        return TemplateStyle.from(saved, isDefault);
    }

    private void applyFields(EmailTemplate template, EmailTemplate fields) {
        template.setLogoUrl(orDefault(fields.getLogoUrl(), ""));
        template.setHostName(fields.getHostName());
        template.setPrimaryColor(fields.getPrimaryColor());
        template.setSecondaryColor(fields.getSecondaryColor());
        template.setTextColor(orDefault(fields.getTextColor(), TemplateStyle.DEFAULT_TEXT_COLOR));
        template.setEventDetailsBackgroundColor(
                orDefault(fields.getEventDetailsBackgroundColor(), TemplateStyle.DEFAULT_DETAILS_BACKGROUND_COLOR));
        template.setFontFamily(fields.getFontFamily());
        template.setHeaderText(fields.getHeaderText());
        template.setSampleEventTitle(orDefault(fields.getSampleEventTitle(), TemplateStyle.DEFAULT_SAMPLE_EVENT_TITLE));
        template.setFooterText(fields.getFooterText());
        template.setButtonText(orDefault(fields.getButtonText(), TemplateStyle.DEFAULT_BUTTON_TEXT));
        template.setButtonRadius(orDefault(fields.getButtonRadius(), TemplateStyle.DEFAULT_BUTTON_RADIUS));
        template.setShowEmojis(fields.getShowEmojis() == null || fields.getShowEmojis());
        template.setDescriptionText(orDefault(fields.getDescriptionText(), TemplateStyle.DEFAULT_DESCRIPTION_TEXT));
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
