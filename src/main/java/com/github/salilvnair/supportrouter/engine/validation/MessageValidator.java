package com.github.salilvnair.supportrouter.engine.validation;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.engine.exception.MessageValidationException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.TurnRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@Component
public class MessageValidator {

    private final SupportRouterProperties properties;

    /**
     * @throws MessageValidationException on the first problem found
     */
    public void validate(IncomingMessage message) {
        if (message == null || message.text() == null || message.text().isBlank()) {
            throw new MessageValidationException(SupportRouterErrorCode.EMPTY_MESSAGE);
        }
        int maxLength = properties.getCascade().getMaxMessageLength();
        if (message.text().length() > maxLength) {
            throw new MessageValidationException(
                    SupportRouterErrorCode.MESSAGE_TOO_LONG,
                    "Message text has " + message.text().length() + " characters, limit is " + maxLength
            ).withMetaData(Map.of("length", message.text().length(), "limit", maxLength));
        }
        if (message.sessionId() == null || message.sessionId().isBlank()) {
            throw new MessageValidationException(SupportRouterErrorCode.MISSING_SESSION_ID);
        }
        if (message.tenantId() == null || message.tenantId().isBlank()) {
            throw new MessageValidationException(SupportRouterErrorCode.MISSING_TENANT_ID);
        }
        validateHistory(message.history());
    }

    private static void validateHistory(List<TurnRecord> history) {
        for (int i = 0; i < history.size(); i++) {
            TurnRecord turn = history.get(i);
            if (turn == null || turn.role() == null || turn.text() == null) {
                throw new MessageValidationException(
                        SupportRouterErrorCode.INVALID_HISTORY,
                        "History turn " + i + " is missing its role or text"
                );
            }
        }
    }
}
