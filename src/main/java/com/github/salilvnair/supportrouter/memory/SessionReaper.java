package com.github.salilvnair.supportrouter.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SessionReaper {

    private final ConversationMemory memory;

    @Scheduled(
            fixedDelayString = "${supportrouter.session.reap-interval:PT60S}",
            initialDelayString = "${supportrouter.session.reap-interval:PT60S}"
    )
    public void reap() {
        int removed = memory.reapExpired();
        if (removed > 0) {
            log.info("Reaped {} expired sessions, {} remaining", removed, memory.size());
        }
    }
}
