package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.EmailTemplate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for saving an email template.
 * Without eventId the organizer-level template is saved.
 *
 * @author Planorama Team
 */
public class EmailTemplateRequest {

    private String eventId;

    @Pattern(regexp = "^$|^https?://\\S+$", message = "Logo URL must be an http(s) URL")
    @Size(max = 2048, message = "Logo URL too long")
    private String logoUrl;

    @NotBlank(message = "Host name is required")
    @Size(max = 100, message = "Host name too long")
    private String hostName;

    @NotNull(message = "Primary color is required")
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Invalid color format")
    private String primaryColor;

    @NotNull(message = "Secondary color is required")
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Invalid color format")
    private String secondaryColor;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Invalid color format")
    private String textColor;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Invalid color format")
    private String eventDetailsBackgroundColor;

    @NotBlank(message = "Font family is required")
    @Size(max = 200, message = "Font family too long")
    private String fontFamily;

    @NotNull(message = "Header text is required")
    @Size(max = 200, message = "Header text too long")
    private String headerText;

    @Size(max = 200, message = "Sample event title too long")
    private String sampleEventTitle;

    @NotNull(message = "Footer text is required")
    @Size(max = 500, message = "Footer text too long")
    private String footerText;

    @Size(max = 100, message = "Button text too long")
    private String buttonText;

    @Pattern(regexp = "^\\d{1,3}$", message = "Button radius must be a number of pixels")
    private String buttonRadius;

    private Boolean showEmojis;

    @Size(max = 1000, message = "Description text too long")
    private String descriptionText;

    private Boolean isDefault;

    public EmailTemplateRequest() {
    }

    /**
     * Unsaved template carrying the submitted styling fields.
     */
    public EmailTemplate toTemplate() {
        return EmailTemplate.builder()
                .logoUrl(logoUrl)
                .hostName(hostName)
                .primaryColor(primaryColor)
                .secondaryColor(secondaryColor)
                .textColor(textColor)
                .eventDetailsBackgroundColor(eventDetailsBackgroundColor)
                .fontFamily(fontFamily)
                .headerText(headerText)
                .sampleEventTitle(sampleEventTitle)
                .footerText(footerText)
                .buttonText(buttonText)
                .buttonRadius(buttonRadius)
                .showEmojis(showEmojis)
                .descriptionText(descriptionText)
                .build();
    }

    // Getters and setters
    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public void setLogoUrl(String logoUrl) {
        this.logoUrl = logoUrl;
    }

    public String getHostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName;
    }

    public String getPrimaryColor() {
        return primaryColor;
    }

    public void setPrimaryColor(String primaryColor) {
        this.primaryColor = primaryColor;
    }

    public String getSecondaryColor() {
        return secondaryColor;
    }

    public void setSecondaryColor(String secondaryColor) {
        this.secondaryColor = secondaryColor;
    }

    public String getTextColor() {
        return textColor;
    }

    public void setTextColor(String textColor) {
        this.textColor = textColor;
    }

    public String getEventDetailsBackgroundColor() {
        return eventDetailsBackgroundColor;
    }

    public void setEventDetailsBackgroundColor(String eventDetailsBackgroundColor) {
        this.eventDetailsBackgroundColor = eventDetailsBackgroundColor;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public String getHeaderText() {
        return headerText;
    }

    public void setHeaderText(String headerText) {
        this.headerText = headerText;
    }

    public String getSampleEventTitle() {
        return sampleEventTitle;
    }

    public void setSampleEventTitle(String sampleEventTitle) {
        this.sampleEventTitle = sampleEventTitle;
    }

    public String getFooterText() {
        return footerText;
    }

    public void setFooterText(String footerText) {
        this.footerText = footerText;
    }

    public String getButtonText() {
        return buttonText;
    }

    public void setButtonText(String buttonText) {
        this.buttonText = buttonText;
    }

    public String getButtonRadius() {
        return buttonRadius;
    }

    public void setButtonRadius(String buttonRadius) {
        this.buttonRadius = buttonRadius;
    }

    public Boolean getShowEmojis() {
        return showEmojis;
    }

    public void setShowEmojis(Boolean showEmojis) {
        this.showEmojis = showEmojis;
    }

    public String getDescriptionText() {
        return descriptionText;
    }

    public void setDescriptionText(String descriptionText) {
        this.descriptionText = descriptionText;
    }

    public Boolean getIsDefault() {
        return isDefault;
    }

    public void setIsDefault(Boolean isDefault) {
        this.isDefault = isDefault;
    }
}
