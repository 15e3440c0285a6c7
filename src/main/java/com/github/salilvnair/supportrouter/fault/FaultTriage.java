package com.github.salilvnair.supportrouter.fault;

import java.util.List;

/**
 * @param missingFacts {@code known_facts} keys staff still need before they can act, in the order
 *                     they should be asked for
 */
public record FaultTriage(FaultCategory category, FaultUrgency urgency, List<String> missingFacts) {

    public FaultTriage {
        missingFacts = missingFacts == null ? List.of() : List.copyOf(missingFacts);
    }
}
