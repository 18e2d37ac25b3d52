package com.planorama.rsvp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Planorama RSVP service.
 *
 * System Overview:
 * - Organizers create events with a fixed attendee capacity
 * - Each invitee receives a unique token link by email
 * - Guests respond through the token (create-once), organizers through their account (upsert)
 * - Token admissions are serialized per event so capacity is never overshot
 *
 * Architecture:
 * - API Layer: REST controllers with validation and JWT authentication
 * - Service Layer: admission engine, invitations, events, email templates
 * - Data Access Layer: JPA repositories on PostgreSQL with pessimistic row locks
 * - Infrastructure Layer: Redis rate limiting, Kafka domain events, SMTP, CloudWatch metrics
 *
 * @author Planorama Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class PlanoramaRsvpApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanoramaRsvpApplication.class, args);
    }
}
