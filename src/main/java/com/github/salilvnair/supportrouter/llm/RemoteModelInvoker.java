package com.github.salilvnair.supportrouter.llm;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.engine.exception.RemoteModelException;
import com.github.salilvnair.supportrouter.engine.exception.RequestCancelledException;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.model.TurnRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs remote model calls on a bounded pool and waits at most the configured timeout.
 * Every failure surfaces as {@link RemoteModelException}; an interrupted caller gets
 * {@link RequestCancelledException} with the interrupt flag restored.
 */
@Slf4j
@Component
public class RemoteModelInvoker {

    public static final String EXECUTOR_BEAN = "supportRouterRemoteModelExecutor";

    private final ObjectProvider<RemoteModelClient> remoteModelClient;
    private final ObjectProvider<EmbeddingClient> embeddingClient;
    private final ExecutorService executor;
    private final Duration timeout;

    public RemoteModelInvoker(ObjectProvider<RemoteModelClient> remoteModelClient,
                              ObjectProvider<EmbeddingClient> embeddingClient,
                              @Qualifier(EXECUTOR_BEAN) ExecutorService executor,
                              SupportRouterProperties properties) {
        this.remoteModelClient = remoteModelClient;
        this.embeddingClient = embeddingClient;
        this.executor = executor;
        this.timeout = properties.getRemoteModel().getTimeout();
    }

    public boolean isAvailable() {
        return remoteModelClient.getIfAvailable() != null;
    }

    public boolean supportsEmbeddings() {
        return embeddingClient.getIfAvailable() != null;
    }

    public String generate(String prompt, String grounding, List<TurnRecord> history) {
        RemoteModelClient client = remoteModelClient.getIfAvailable();
        if (client == null) {
            throw new RemoteModelException(SupportRouterErrorCode.REMOTE_MODEL_UNAVAILABLE);
        }
        String reply = call(() -> client.generate(prompt, grounding, history), "generate");
        if (reply == null || reply.isBlank()) {
            throw new RemoteModelException(SupportRouterErrorCode.REMOTE_MODEL_EMPTY_RESPONSE);
        }
        return reply.trim();
    }

    public Optional<float[]> embed(String text) {
        EmbeddingClient client = embeddingClient.getIfAvailable();
        if (client == null || text == null || text.isBlank()) {
            return Optional.empty();
        }
        float[] vector = call(() -> client.embed(text), "embed");
        return vector == null || vector.length == 0 ? Optional.empty() : Optional.of(vector);
    }

    private <T> T call(Callable<T> task, String operation) {
        Future<T> future;
        try {
            future = executor.submit(task);
        }
        catch (RejectedExecutionException e) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                    "Remote model pool rejected " + operation, e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Remote model {} timed out after {} ms", operation, timeout.toMillis());
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_TIMEOUT,
                    "Remote model " + operation + " timed out after " + timeout.toMillis() + " ms", e);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Interrupted while waiting for remote model " + operation, e);
        }
        catch (CancellationException e) {
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                    "Remote model " + operation + " was cancelled", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RemoteModelException remote) {
                throw remote;
            }
            throw new RemoteModelException(
                    SupportRouterErrorCode.REMOTE_MODEL_CALL_FAILED,
                    "Remote model " + operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
