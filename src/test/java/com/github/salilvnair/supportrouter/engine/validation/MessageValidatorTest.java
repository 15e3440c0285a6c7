package com.github.salilvnair.supportrouter.engine.validation;

import com.github.salilvnair.supportrouter.engine.exception.MessageValidationException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.TurnRecord;
import com.github.salilvnair.supportrouter.model.TurnRole;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.supportrouter.support.RouterFixtures.NOW;
import static com.github.salilvnair.supportrouter.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.supportrouter.support.TestConstants.TEXT_GREETING;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageValidatorTest {

    private final MessageValidator validator = new MessageValidator(RouterFixtures.properties());

    @Test
    void acceptsWellFormedMessage() {
        IncomingMessage message = new IncomingMessage(TEXT_GREETING, SESSION_ID, TENANT_ACME,
                List.of(TurnRecord.user("Hej", NOW), TurnRecord.assistant("Hej!", NOW)));

        assertDoesNotThrow(() -> validator.validate(message));
    }

    @Test
    void blankTextIsEmptyMessage() {
        assertEquals(SupportRouterErrorCode.EMPTY_MESSAGE, codeOf(IncomingMessage.of("   ", SESSION_ID, TENANT_ACME)));
        assertEquals(SupportRouterErrorCode.EMPTY_MESSAGE, codeOf(null));
    }

    @Test
    void textOverLimitIsTooLong() {
        MessageValidationException e = assertThrows(MessageValidationException.class,
                () -> validator.validate(IncomingMessage.of("a".repeat(2001), SESSION_ID, TENANT_ACME)));

        assertEquals(SupportRouterErrorCode.MESSAGE_TOO_LONG, e.getCode());
        assertEquals(2000, e.getMetaData().get("limit"));
    }

    @Test
    void textAtLimitIsAccepted() {
        assertDoesNotThrow(() -> validator.validate(IncomingMessage.of("a".repeat(2000), SESSION_ID, TENANT_ACME)));
    }

    @Test
    void missingIdentifiersAreRejected() {
        assertEquals(SupportRouterErrorCode.MISSING_SESSION_ID, codeOf(IncomingMessage.of(TEXT_GREETING, " ", TENANT_ACME)));
        assertEquals(SupportRouterErrorCode.MISSING_TENANT_ID, codeOf(IncomingMessage.of(TEXT_GREETING, SESSION_ID, null)));
    }

    @Test
    void historyTurnWithoutTextIsInvalid() {
        IncomingMessage message = new IncomingMessage(TEXT_GREETING, SESSION_ID, TENANT_ACME,
                List.of(new TurnRecord(TurnRole.USER, null, NOW)));

        assertEquals(SupportRouterErrorCode.INVALID_HISTORY, codeOf(message));
    }

    private SupportRouterErrorCode codeOf(IncomingMessage message) {
        return assertThrows(MessageValidationException.class, () -> validator.validate(message)).getCode();
    }
}
