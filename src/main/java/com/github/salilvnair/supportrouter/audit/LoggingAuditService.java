package com.github.salilvnair.supportrouter.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingAuditService implements AuditService {

    @Override
    public void audit(String stage, String sessionId, String payloadJson) {
        if (log.isDebugEnabled()) {
            log.debug("audit stage={} sessionId={} payload={}", stage, sessionId, payloadJson);
        }
    }
}
