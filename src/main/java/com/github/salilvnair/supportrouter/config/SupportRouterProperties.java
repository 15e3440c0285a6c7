package com.github.salilvnair.supportrouter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "supportrouter")
@Getter
@Setter
public class SupportRouterProperties {

    private Cascade cascade = new Cascade();
    private Escalation escalation = new Escalation();
    private Lead lead = new Lead();
    private Knowledge knowledge = new Knowledge();
    private RemoteModel remoteModel = new RemoteModel();
    private Session session = new Session();
    private Tenants tenants = new Tenants();

    @Getter
    @Setter
    public static class Cascade {
        /** Local answers scoring below this count as unresolved. */
        private double confidenceFloor = 0.7d;
        private int historyWindow = 6;
        private int maxMessageLength = 2000;
        private int patternInputLimit = 500;
    }

    @Getter
    @Setter
    public static class Escalation {
        private int maxConversationTurns = 8;
        private int leadScoreCeiling = 5;
        private int angryTurns = 2;
        private boolean escalateCriticalFaults = true;
        /** Escalate fault reports triaged as high urgency, such as no heating. */
        private boolean escalateUrgentFaults = true;
    }

    @Getter
    @Setter
    public static class Lead {
        private int notifyThreshold = 4;
        private int repeatBonusHits = 2;
    }

    @Getter
    @Setter
    public static class Knowledge {
        private double minKeywordOverlap = 0.34d;
        private double semanticThreshold = 0.80d;
        private int groundingLimit = 3;
    }

    @Getter
    @Setter
    public static class RemoteModel {
        private Duration timeout = Duration.ofSeconds(12);
        private int poolSize = 8;
        /** Calls waiting for a pool thread; once full, further calls fail fast and use the fallback. */
        private int queueCapacity = 64;
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String chatModel = "gpt-4o-mini";
        private String embeddingModel = "text-embedding-3-small";
        private double temperature = 0.3d;
        /** Longer remote replies are cut back to the last whole sentence within this many characters. */
        private int maxReplyLength = 1200;
    }

    @Getter
    @Setter
    public static class Session {
        private Duration ttl = Duration.ofMinutes(60);
        private Duration reapInterval = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Tenants {
        /** Classpath folder holding one {@code <tenantId>.json} per tenant. */
        private String location = "supportrouter/tenants/";
    }
}
