package com.github.salilvnair.supportrouter.engine.core;

import com.github.salilvnair.supportrouter.model.IncomingMessage;
import com.github.salilvnair.supportrouter.model.RouterResult;

public interface SupportRouter {

    /**
     * @throws com.github.salilvnair.supportrouter.engine.exception.MessageValidationException if the message is malformed
     * @throws com.github.salilvnair.supportrouter.engine.exception.TenantNotFoundException if the tenant is unknown
     * @throws com.github.salilvnair.supportrouter.engine.exception.RequestCancelledException if the calling thread is interrupted
     */
    RouterResult process(IncomingMessage message);

    /** Forgets everything about the session, escalation included. */
    void resetSession(String sessionId);
}
