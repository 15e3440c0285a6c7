package com.github.salilvnair.supportrouter.fault;

import com.github.salilvnair.supportrouter.memory.FactExtractor;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.supportrouter.support.TestConstants.TEXT_NO_HEATING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FaultTriageServiceTest {

    private final FaultTriageService service = new FaultTriageService();

    @Test
    void missingHeatingIsHighUrgencyEvenWhenNotClassifiedAsFault() {
        FaultTriage triage = service.triage(TEXT_NO_HEATING, Intent.UNKNOWN, null, Map.of()).orElseThrow();

        assertEquals(FaultCategory.HEATING, triage.category());
        assertEquals(FaultUrgency.HIGH, triage.urgency());
        assertTrue(triage.urgency().requiresEscalation());
        assertEquals(List.of(FactExtractor.APARTMENT, FactExtractor.EMAIL, FactExtractor.PHONE), triage.missingFacts());
    }

    @Test
    void waterLeakIsCritical() {
        FaultTriage triage = service.triage("Vattenläcka i badrummet, det forsar vatten", Intent.FAULT_REPORT, null, Map.of())
                .orElseThrow();

        assertEquals(FaultCategory.WATER, triage.category());
        assertEquals(FaultUrgency.CRITICAL, triage.urgency());
    }

    @Test
    void ordinaryFaultOnlyAsksForWhatIsMissing() {
        FaultTriage triage = service.triage("Kranen i köket droppar", Intent.FAULT_REPORT, null,
                Map.of(FactExtractor.APARTMENT, "1203")).orElseThrow();

        assertEquals(FaultCategory.WATER, triage.category());
        assertEquals(FaultUrgency.MEDIUM, triage.urgency());
        assertFalse(triage.urgency().requiresEscalation());
        // no phone number is chased for a fault that can wait
        assertEquals(List.of(FactExtractor.EMAIL), triage.missingFacts());
    }

    @Test
    void emergencyPatternRaisesUrgency() {
        MatchResult lockout = new MatchResult("lockout", Intent.FAULT_REPORT, "Ring oss", 0.9, 1, Urgency.HIGH);

        FaultTriage triage = service.triage("Hjälp, jag är utelåst!", Intent.FAULT_REPORT, lockout,
                Map.of(FactExtractor.EMAIL, "anna@example.se", FactExtractor.PHONE, "0701234567")).orElseThrow();

        assertEquals(FaultCategory.SECURITY, triage.category());
        assertEquals(FaultUrgency.HIGH, triage.urgency());
        assertEquals(List.of(FactExtractor.APARTMENT), triage.missingFacts());
    }

    @Test
    void categoryWithMostDistinctTermsWins() {
        FaultTriage triage = service.triage("Diskmaskinen läcker och tvättmaskinen är trasig", Intent.FAULT_REPORT,
                null, Map.of()).orElseThrow();

        assertEquals(FaultCategory.APPLIANCE, triage.category());
    }

    @Test
    void faultWithoutRecognisedTermsIsOther() {
        FaultTriage triage = service.triage("Något är konstigt", Intent.FAULT_REPORT, null, Map.of()).orElseThrow();

        assertEquals(FaultCategory.OTHER, triage.category());
        assertEquals(FaultUrgency.LOW, triage.urgency());
    }

    @Test
    void messageThatIsNeitherFaultNorUrgentIsNotTriaged() {
        assertTrue(service.triage("Hur bokar jag tvättstugan?", Intent.BOOKING_REQUEST, null, Map.of()).isEmpty());
        assertTrue(service.triage("Do you have fire insurance?", Intent.UNKNOWN, null, Map.of()).isEmpty());
    }
}
