package com.presentos.core.config;

import com.presentos.core.model.HandlerKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Router configuration bound from {@code presentos.*}.
 * <p>
 * Built once at startup and handed to each pipeline component through its constructor.
 */
@Component
@ConfigurationProperties(prefix = "presentos")
public class RouterProperties {

    private String sourceTag = "presentos-router";
    private String fallbackEmail = "";
    private Notion notion = new Notion();
    private Handlers handlers = new Handlers();
    private Links links = new Links();

    public String getSourceTag() { return sourceTag; }
    public void setSourceTag(String sourceTag) { this.sourceTag = sourceTag; }
    public String getFallbackEmail() { return fallbackEmail; }
    public void setFallbackEmail(String fallbackEmail) { this.fallbackEmail = fallbackEmail; }
    public Notion getNotion() { return notion; }
    public void setNotion(Notion notion) { this.notion = notion; }
    public Handlers getHandlers() { return handlers; }
    public void setHandlers(Handlers handlers) { this.handlers = handlers; }
    public Links getLinks() { return links; }
    public void setLinks(Links links) { this.links = links; }

    public static class Notion {
        private String apiUrl = "https://api.notion.com/v1";
        private String token = "";
        private String databaseId = "";
        private String version = "2022-06-28";
        private int timeoutSeconds = 15;

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getDatabaseId() { return databaseId; }
        public void setDatabaseId(String databaseId) { this.databaseId = databaseId; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public boolean isConfigured() {
            return token != null && !token.isBlank() && databaseId != null && !databaseId.isBlank();
        }
    }

    public static class Handlers {
        // Timeouts absorb handler cold starts.
        private Handler calendar = new Handler(35);
        private Handler email = new Handler(20);
        private Handler research = new Handler(35);
        private Handler messaging = new Handler(6);
        private Handler experience = new Handler(10);

        public Handler getCalendar() { return calendar; }
        public void setCalendar(Handler calendar) { this.calendar = calendar; }
        public Handler getEmail() { return email; }
        public void setEmail(Handler email) { this.email = email; }
        public Handler getResearch() { return research; }
        public void setResearch(Handler research) { this.research = research; }
        public Handler getMessaging() { return messaging; }
        public void setMessaging(Handler messaging) { this.messaging = messaging; }
        public Handler getExperience() { return experience; }
        public void setExperience(Handler experience) { this.experience = experience; }

        public Handler forKind(HandlerKind kind) {
            return switch (kind) {
                case CALENDAR -> calendar;
                case EMAIL -> email;
                case RESEARCH -> research;
                case MESSAGING -> messaging;
                case EXPERIENCE -> experience;
            };
        }
    }

    public static class Handler {
        private String url = "";
        private int timeoutSeconds;

        public Handler() {
            this(10);
        }

        public Handler(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    public static class Links {
        private String emailBaseUrl = "https://mail.google.com/mail/u/0/#all/";

        public String getEmailBaseUrl() { return emailBaseUrl; }
        public void setEmailBaseUrl(String emailBaseUrl) { this.emailBaseUrl = emailBaseUrl; }
    }
}
