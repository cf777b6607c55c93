package io.mcpgate.server.oauth;

import io.smallrye.mutiny.Uni;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/// One running OAuth callback listener.
///
/// The outcome is decided exactly once: by the first callback request, or by the timeout,
/// whichever comes first. Later attempts to complete are ignored.
///
/// @implNote Thread-safe. Completion races are settled by {@link CompletableFuture}.
public final class OAuthCallbackSession {

    /// Lifecycle of a session as seen by pollers.
    public enum Status {
        PENDING,
        COMPLETED,
        FAILED
    }

    private final CompletableFuture<OAuthCallbackResult> outcome = new CompletableFuture<>();
    private volatile int port;

    OAuthCallbackSession() {}

    /// Returns the bound listener port.
    ///
    /// @return port number, 0 only before the listener is bound
    public int port() {
        return port;
    }

    void bind(int boundPort) {
        this.port = boundPort;
    }

    /// Returns the redirect URI to register with the authorization server.
    ///
    /// @return `http://127.0.0.1:{port}/oauth/callback`
    public String redirectUri() {
        return "http://127.0.0.1:" + port + OAuthCallbackListener.CALLBACK_PATH;
    }

    /// Returns the outcome of the authorization.
    ///
    /// Cancelling a subscription does not cancel the session.
    ///
    /// @return Uni emitting the captured code, or failing with an OAuth {@link
    ///     io.mcpgate.server.mcp.McpException}
    public Uni<OAuthCallbackResult> result() {
        return Uni.createFrom().completionStage(outcome.copy());
    }

    public Status status() {
        if (!outcome.isDone()) {
            return Status.PENDING;
        }
        return outcome.isCompletedExceptionally() ? Status.FAILED : Status.COMPLETED;
    }

    /// Returns the captured code once the session completed successfully.
    ///
    /// @return captured result, empty while pending or after a failure
    public Optional<OAuthCallbackResult> completedResult() {
        return status() == Status.COMPLETED ? Optional.of(outcome.join()) : Optional.empty();
    }

    /// Returns the failure message once the session failed.
    ///
    /// @return failure message, empty while pending or after success
    public Optional<String> failureMessage() {
        if (status() != Status.FAILED) {
            return Optional.empty();
        }
        String message = outcome.handle((value, failure) -> unwrap(failure).getMessage()).join();
        return Optional.ofNullable(message);
    }

    boolean complete(OAuthCallbackResult result) {
        return outcome.complete(result);
    }

    boolean fail(Throwable failure) {
        return outcome.completeExceptionally(failure);
    }

    CompletableFuture<OAuthCallbackResult> outcome() {
        return outcome;
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
    }
}
