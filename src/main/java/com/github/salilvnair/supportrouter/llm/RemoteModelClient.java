package com.github.salilvnair.supportrouter.llm;

import com.github.salilvnair.supportrouter.model.TurnRecord;

import java.util.List;

/**
 * Generative model provider. Implementations may be slow, rate limited or fail; they signal
 * failure by throwing {@link com.github.salilvnair.supportrouter.engine.exception.RemoteModelException}
 * or any other runtime exception.
 */
public interface RemoteModelClient {
    String generate(String prompt, String grounding, List<TurnRecord> history);
}
