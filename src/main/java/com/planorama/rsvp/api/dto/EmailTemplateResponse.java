package com.planorama.rsvp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planorama.rsvp.domain.model.TemplateStyle;

/**
 * Response DTO for email template styling.
 * id and eventId are absent when the built-in defaults apply.
 *
 * @author Planorama Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailTemplateResponse {

    private String id;
    private String eventId;
    private String logoUrl;
    private String hostName;
    private String primaryColor;
    private String secondaryColor;
    private String textColor;
    private String eventDetailsBackgroundColor;
    private String fontFamily;
    private String headerText;
    private String sampleEventTitle;
    private String footerText;
    private String buttonText;
    private String buttonRadius;
    private Boolean showEmojis;
    private String descriptionText;
    private Boolean isDefault;

    public EmailTemplateResponse() {
    }

    public static EmailTemplateResponse fromStyle(TemplateStyle style) {
        EmailTemplateResponse response = new EmailTemplateResponse();
        response.setId(style.getTemplateId());
        response.setEventId(style.getEventId());
        response.setLogoUrl(style.getLogoUrl());
        response.setHostName(style.getHostName());
        response.setPrimaryColor(style.getPrimaryColor());
        response.setSecondaryColor(style.getSecondaryColor());
        response.setTextColor(style.getTextColor());
        response.setEventDetailsBackgroundColor(style.getEventDetailsBackgroundColor());
        response.setFontFamily(style.getFontFamily());
        response.setHeaderText(style.getHeaderText());
        response.setSampleEventTitle(style.getSampleEventTitle());
        response.setFooterText(style.getFooterText());
        response.setButtonText(style.getButtonText());
        response.setButtonRadius(style.getButtonRadius());
        response.setShowEmojis(style.isShowEmojis());
        response.setDescriptionText(style.getDescriptionText());
        response.setIsDefault(style.isDefault());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

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
