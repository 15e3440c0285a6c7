package com.github.salilvnair.supportrouter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Structured reply handed back to the transport layer. Serialized with snake_case field names.
 */
@Builder
public record RouterResult(
        @JsonProperty("reply_text") String replyText,
        @JsonProperty("intent") Intent intent,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("sentiment") Sentiment sentiment,
        @JsonProperty("lead_score") int leadScore,
        @JsonProperty("action") RouterAction action,
        @JsonProperty("suggested_followups") List<String> suggestedFollowups,
        @JsonIgnore ReplySource replySource
) {

    public RouterResult {
        suggestedFollowups = suggestedFollowups == null ? List.of() : List.copyOf(suggestedFollowups);
    }
}
