package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.TemplateStyle;
import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.exception.FieldValidationException;
import com.planorama.rsvp.exception.NotificationDeliveryException;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.infrastructure.messaging.RsvpEventPublisher;
import com.planorama.rsvp.infrastructure.messaging.events.RsvpDomainEvent;
import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import com.planorama.rsvp.infrastructure.notification.InvitationEmailRenderer;
import com.planorama.rsvp.infrastructure.notification.NotificationDispatcher;
import com.planorama.rsvp.infrastructure.notification.OutboundEmail;
import com.planorama.rsvp.repository.EventRepository;
import com.planorama.rsvp.repository.InvitationTokenRepository;
import com.planorama.rsvp.repository.RsvpRepository;
import com.planorama.rsvp.repository.UserRepository;
import com.planorama.rsvp.security.InvitationSecretGenerator;
import com.planorama.rsvp.service.result.InvitationDetails;
import com.planorama.rsvp.service.result.InvitationResult;
import com.planorama.rsvp.service.result.InviteePage;
import com.planorama.rsvp.service.result.InviteeView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for invitation tokens: issuing them, emailing them and listing invitees with their responses.
 *
 * @author Planorama Team
 */
@Service
public class InvitationService {

    private static final Logger logger = LoggerFactory.getLogger(InvitationService.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final String STATUS_PENDING = "pending";

    private final EventRepository eventRepository;
    private final InvitationTokenRepository tokenRepository;
    private final RsvpRepository rsvpRepository;
    private final UserRepository userRepository;
    private final EmailTemplateService templateService;
    private final InvitationEmailRenderer emailRenderer;
    private final NotificationDispatcher notificationDispatcher;
    private final RsvpEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;

    public InvitationService(
            EventRepository eventRepository,
            InvitationTokenRepository tokenRepository,
            RsvpRepository rsvpRepository,
            UserRepository userRepository,
            EmailTemplateService templateService,
            InvitationEmailRenderer emailRenderer,
            NotificationDispatcher notificationDispatcher,
            RsvpEventPublisher eventPublisher,
            CloudWatchMetricsService metricsService
    ) {
        this.eventRepository = eventRepository;
        this.tokenRepository = tokenRepository;
        this.rsvpRepository = rsvpRepository;
        this.userRepository = userRepository;
        this.templateService = templateService;
        this.emailRenderer = emailRenderer;
        this.notificationDispatcher = notificationDispatcher;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Issue an invitation for an owned event and email it.
     *
     * The token is committed before any email work starts. A missing transport or a failed send
     * only turns {@code emailSent} false; the invitation stays valid either way.
     *
     * @param organizerId Organizer user ID
     * @param eventId Event ID
     * @param email Invitee email (normalized before storing)
     * @param name Optional display name
     * @return Saved invitation and the email outcome
     * @throws ResourceNotFoundException if the event is not owned by the organizer
     */
    public InvitationResult createInvitation(String organizerId, String eventId, String email, String name) {
        Event event = requireOwnedEvent(organizerId, eventId);

        String normalizedEmail = User.normalizeEmail(email);
        if (normalizedEmail == null || normalizedEmail.isEmpty()) {
            throw new FieldValidationException("email", "Invalid email address");
        }

        String inviteeUserId = userRepository.findByEmail(normalizedEmail)
                .map(User::getUserId)
                .orElse(null);

        InvitationToken token = InvitationToken.builder()
                .eventId(eventId)
                .email(normalizedEmail)
                .name(name != null && !name.isBlank() ? name.trim() : null)
                .token(InvitationSecretGenerator.generateUnique(tokenRepository::existsByToken))
                .inviteeUserId(inviteeUserId)
                .build();

        InvitationToken saved = tokenRepository.save(token);
        if (inviteeUserId == null) {
            // Account may have signed up between the lookup and the insert
            inviteeUserId = userRepository.findByEmail(normalizedEmail)
                    .map(User::getUserId)
                    .orElse(null);
            if (inviteeUserId != null) {
                tokenRepository.linkInviteeAccount(normalizedEmail, inviteeUserId);
                saved.setInviteeUserId(inviteeUserId);
            }
        }
        logger.info("Invitation created - event: {}, token: {}, linked account: {}",
                eventId, saved.getTokenId(), inviteeUserId != null);

        eventPublisher.publish(RsvpDomainEvent.invitationCreated(saved));

        boolean emailSent = sendInvitationEmail(organizerId, event, saved);
        metricsService.recordInvitationCreated(emailSent);

        return new InvitationResult(saved, emailSent);
    }

    private boolean sendInvitationEmail(String organizerId, Event event, InvitationToken token) {
        if (!notificationDispatcher.isConfigured()) {
            logger.info("Email transport not configured, invitation {} not emailed", token.getTokenId());
            return false;
        }

        try {
            TemplateStyle style = templateService.resolveTemplate(organizerId, event.getEventId());
            String inviteLink = emailRenderer.buildInviteLink(event.getEventId(), token.getToken());
            OutboundEmail email = emailRenderer.renderInvitation(token.getEmail(), event, style, inviteLink);

            notificationDispatcher.send(email);
            metricsService.recordEmailDispatch("invitation", true);
            return true;

        } catch (NotificationDeliveryException e) {
            logger.warn("Failed to send invitation email for token: {} - {}", token.getTokenId(), e.getMessage());
            metricsService.recordEmailDispatch("invitation", false);
            return false;
        } catch (RuntimeException e) {
            logger.warn("Failed to prepare invitation email for token: {}", token.getTokenId(), e);
            metricsService.recordEmailDispatch("invitation", false);
            return false;
        }
    }

    /**
     * Invitations of an owned event with their resolved responses, filtered and paginated.
     *
     * Resolution per invitation: its token response, otherwise the response of the linked account
     * ({@link InvitationToken#getInviteeUserId()}), otherwise pending.
     *
     * @param organizerId Organizer user ID
     * @param eventId Event ID
     * @param page 1-based page, defaults to {@value #DEFAULT_PAGE} when null or non-positive
     * @param limit Page size, defaults to {@value #DEFAULT_LIMIT} when null or non-positive
     * @param search Case-insensitive substring matched against email and name
     * @param statusFilter going, maybe, not-going or pending
     * @return Requested page
     */
    @Transactional(readOnly = true)
    public InviteePage listInvitees(
            String organizerId,
            String eventId,
            Integer page,
            Integer limit,
            String search,
            String statusFilter
    ) {
        requireOwnedEvent(organizerId, eventId);

        int effectivePage = page == null || page < 1 ? DEFAULT_PAGE : page;
        int effectiveLimit = limit == null || limit < 1 ? DEFAULT_LIMIT : limit;

        List<InvitationToken> tokens = tokenRepository.findByEventIdOrderByCreatedAtDesc(eventId);

        if (search != null && !search.isEmpty()) {
            String needle = search.toLowerCase(Locale.ROOT);
            tokens = tokens.stream()
                    .filter(t -> contains(t.getEmail(), needle) || contains(t.getName(), needle))
                    .collect(Collectors.toList());
        }

        List<InviteeView> invitees = resolveResponses(eventId, tokens);

        if (statusFilter != null && !statusFilter.isEmpty()) {
            invitees = invitees.stream()
                    .filter(invitee -> matchesStatus(invitee, statusFilter))
                    .collect(Collectors.toList());
        }

        int total = invitees.size();
        int from = (int) Math.min((long) (effectivePage - 1) * effectiveLimit, total);
        int to = Math.min(from + effectiveLimit, total);

        return new InviteePage(new ArrayList<>(invitees.subList(from, to)), effectivePage, effectiveLimit, total);
    }

    private List<InviteeView> resolveResponses(String eventId, List<InvitationToken> tokens) {
        if (tokens.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> tokenIds = tokens.stream().map(InvitationToken::getTokenId).collect(Collectors.toList());
        Map<String, Rsvp> tokenResponses = rsvpRepository.findByEventIdAndTokenIdIn(eventId, tokenIds).stream()
                .collect(Collectors.toMap(Rsvp::getTokenId, Function.identity()));

        List<String> userIds = tokens.stream()
                .map(InvitationToken::getInviteeUserId)
                .filter(id -> id != null)
                .distinct()
                .collect(Collectors.toList());
        Map<String, Rsvp> userResponses = userIds.isEmpty()
                ? Collections.emptyMap()
                : rsvpRepository.findByEventIdAndUserIdIn(eventId, userIds).stream()
                        .collect(Collectors.toMap(Rsvp::getUserId, Function.identity()));

        List<InviteeView> invitees = new ArrayList<>(tokens.size());
        for (InvitationToken token : tokens) {
            Rsvp response = tokenResponses.get(token.getTokenId());
            if (response == null && token.getInviteeUserId() != null) {
                response = userResponses.get(token.getInviteeUserId());
            }
            invitees.add(response == null
                    ? InviteeView.pending(token)
                    : new InviteeView(token, response.getStatus(), response.getCompanions()));
        }
        return invitees;
    }

    private static boolean matchesStatus(InviteeView invitee, String statusFilter) {
        if (STATUS_PENDING.equals(statusFilter)) {
            return invitee.isPending();
        }
        return !invitee.isPending() && invitee.getRsvpStatus().getValue().equals(statusFilter);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    /**
     * Event and invitee details behind an invitation link.
     *
     * @param token Invitation secret
     * @return Invitation with its event
     * @throws ResourceNotFoundException if the token or its event does not exist
     */
    @Transactional(readOnly = true)
    public InvitationDetails getInvitationByToken(String token) {
        InvitationToken invitation = tokenRepository.findByToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation", token));
        Event event = eventRepository.findById(invitation.getEventId())
                .orElseThrow(() -> new ResourceNotFoundException("Event", invitation.getEventId()));
        return new InvitationDetails(invitation, event);
    }

    private Event requireOwnedEvent(String organizerId, String eventId) {
        return eventRepository.findByEventIdAndCreatedBy(eventId, organizerId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }
}
