package com.planorama.rsvp.domain.model;

/**
 * Fully resolved invitation styling: every field is populated, falling back to the built-in
 * defaults wherever the stored template leaves a value empty.
 *
 * @author Planorama Team
 */
public class TemplateStyle {

    public static final String DEFAULT_PRIMARY_COLOR = "#4F46E5";
    public static final String DEFAULT_SECONDARY_COLOR = "#ffffff";
    public static final String DEFAULT_TEXT_COLOR = "#374151";
    public static final String DEFAULT_DETAILS_BACKGROUND_COLOR = "#f3f4f6";
    public static final String DEFAULT_FONT_FAMILY = "Arial, sans-serif";
    public static final String DEFAULT_HEADER_TEXT = "You're Invited!";
    public static final String DEFAULT_SAMPLE_EVENT_TITLE = "Join Us for an Amazing Event";
    public static final String DEFAULT_FOOTER_TEXT = "We look forward to seeing you!";
    public static final String DEFAULT_BUTTON_TEXT = "RSVP Now";
    public static final String DEFAULT_BUTTON_RADIUS = "8";
    public static final String DEFAULT_DESCRIPTION_TEXT =
            "Join us for an amazing event! This is a preview of how your invitation will look.";

    private String templateId;
    private String eventId;
    private boolean isDefault;
    private String logoUrl = "";
    private String hostName = "";
    private String primaryColor = DEFAULT_PRIMARY_COLOR;
    private String secondaryColor = DEFAULT_SECONDARY_COLOR;
    private String textColor = DEFAULT_TEXT_COLOR;
    private String eventDetailsBackgroundColor = DEFAULT_DETAILS_BACKGROUND_COLOR;
    private String fontFamily = DEFAULT_FONT_FAMILY;
    private String headerText = DEFAULT_HEADER_TEXT;
    private String sampleEventTitle = DEFAULT_SAMPLE_EVENT_TITLE;
    private String footerText = DEFAULT_FOOTER_TEXT;
    private String buttonText = DEFAULT_BUTTON_TEXT;
    private String buttonRadius = DEFAULT_BUTTON_RADIUS;
    private boolean showEmojis = true;
    private String descriptionText = DEFAULT_DESCRIPTION_TEXT;

    private TemplateStyle() {
    }

    /**
     * Built-in styling used when an organizer has no applicable template.
     */
    public static TemplateStyle defaults() {
        return new TemplateStyle();
    }

    public static TemplateStyle from(EmailTemplate template, boolean isDefault) {
        TemplateStyle style = new TemplateStyle();
        style.templateId = template.getTemplateId();
        style.eventId = template.getEventId();
        style.isDefault = isDefault;
        style.logoUrl = orDefault(template.getLogoUrl(), "");
        style.hostName = orDefault(template.getHostName(), "");
        style.primaryColor = orDefault(template.getPrimaryColor(), DEFAULT_PRIMARY_COLOR);
        style.secondaryColor = orDefault(template.getSecondaryColor(), DEFAULT_SECONDARY_COLOR);
        style.textColor = orDefault(template.getTextColor(), DEFAULT_TEXT_COLOR);
        style.eventDetailsBackgroundColor =
                orDefault(template.getEventDetailsBackgroundColor(), DEFAULT_DETAILS_BACKGROUND_COLOR);
        style.fontFamily = orDefault(template.getFontFamily(), DEFAULT_FONT_FAMILY);
        style.headerText = orDefault(template.getHeaderText(), DEFAULT_HEADER_TEXT);
        style.sampleEventTitle = orDefault(template.getSampleEventTitle(), DEFAULT_SAMPLE_EVENT_TITLE);
        style.footerText = orDefault(template.getFooterText(), DEFAULT_FOOTER_TEXT);
        style.buttonText = orDefault(template.getButtonText(), DEFAULT_BUTTON_TEXT);
        style.buttonRadius = orDefault(template.getButtonRadius(), DEFAULT_BUTTON_RADIUS);
        style.showEmojis = template.getShowEmojis() == null || template.getShowEmojis();
        style.descriptionText = template.getDescriptionText() != null ? template.getDescriptionText() : "";
        return style;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    public boolean isStored() {
        return templateId != null;
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getEventId() {
        return eventId;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public String getHostName() {
        return hostName;
    }

    public String getPrimaryColor() {
        return primaryColor;
    }

    public String getSecondaryColor() {
        return secondaryColor;
    }

    public String getTextColor() {
        return textColor;
    }

    public String getEventDetailsBackgroundColor() {
        return eventDetailsBackgroundColor;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public String getHeaderText() {
        return headerText;
    }

    public String getSampleEventTitle() {
        return sampleEventTitle;
    }

    public String getFooterText() {
        return footerText;
    }

    public String getButtonText() {
        return buttonText;
    }

    public String getButtonRadius() {
        return buttonRadius;
    }

    public boolean isShowEmojis() {
        return showEmojis;
    }

    public String getDescriptionText() {
        return descriptionText;
    }
}
