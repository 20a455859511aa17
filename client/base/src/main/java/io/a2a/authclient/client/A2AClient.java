package io.a2a.authclient.client;

import static io.a2a.authclient.util.Assert.checkNotNullParam;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.a2a.authclient.client.auth.AuthenticationException;
import io.a2a.authclient.client.auth.CredentialArtifact;
import io.a2a.authclient.client.auth.CredentialContext;
import io.a2a.authclient.client.auth.CredentialProvider;
import io.a2a.authclient.client.auth.config.AuthConfig;
import io.a2a.authclient.client.auth.config.ProviderSettings;
import io.a2a.authclient.client.transport.jsonrpc.JSONRPCRequestBuilder;
import io.a2a.authclient.client.transport.jsonrpc.JSONRPCTransport;
import io.a2a.authclient.client.transport.jsonrpc.RequestIdGenerator;
import io.a2a.authclient.client.transport.spi.ClientTransport;
import io.a2a.authclient.client.transport.spi.TransportRequest;
import io.a2a.authclient.spec.A2AClientCancelledException;
import io.a2a.authclient.spec.A2AClientException;
import io.a2a.authclient.spec.A2AClientProtocolException;
import io.a2a.authclient.spec.A2AClientTransportException;
import io.a2a.authclient.spec.A2AMethods;
import io.a2a.authclient.spec.A2AServerException;
import io.a2a.authclient.spec.JSONRPCError;
import io.a2a.authclient.spec.JSONRPCMessage;
import io.a2a.authclient.spec.JSONRPCRequest;
import io.a2a.authclient.spec.JSONRPCResponse;
import io.a2a.authclient.spec.Task;
import io.a2a.authclient.spec.TaskIdParams;
import io.a2a.authclient.spec.TaskQueryParams;
import io.a2a.authclient.spec.TaskSendParams;
import io.a2a.authclient.util.Assert;
import io.a2a.authclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the task methods of an A2A agent, authenticating every call with the scheme
 * selected in its {@link ClientConfig}.
 * <p>
 * Each call builds a JSON-RPC envelope, asks the credential provider for a credential,
 * attaches it, sends the request and checks that the response echoes the request id before
 * returning its result. Calls are independent of each other and the client keeps no task
 * state, so one instance can be shared by any number of threads.
 * <p>
 * Every operation comes in a blocking form, which throws the {@link A2AClientException}
 * describing the failure, and an asynchronous form, whose future completes exceptionally
 * with it. Cancelling such a future aborts the token exchange or HTTP request in progress.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * A2AClient client = new A2AClient("http://localhost:8080/", ClientConfig.builder()
 *         .apiKeyAuth("my-api-key")
 *         .build());
 * Task task = client.submitTask(new TaskSendParams("auth-test-task", A2A.toUserMessage("Hello")));
 * Task current = client.getTask(task.id());
 * }</pre>
 */
public class A2AClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AClient.class);

    private static final TypeReference<JSONRPCResponse<Task>> TASK_RESPONSE_REFERENCE = new TypeReference<>() {
    };

    private final String agentUrl;
    private final @Nullable CredentialProvider credentialProvider;
    private final ClientTransport transport;
    private final JSONRPCRequestBuilder requestBuilder;
    private final RequestIdGenerator requestIdGenerator;

    public A2AClient(String agentUrl) {
        this(agentUrl, ClientConfig.builder().build());
    }

    public A2AClient(String agentUrl, ClientConfig config) {
        this.agentUrl = Assert.checkNotBlankParam("agentUrl", agentUrl);
        checkNotNullParam("config", config);

        AuthConfig auth = config.getAuth();
        this.credentialProvider = auth == null ? null : auth.createProvider(
                new ProviderSettings(config.getClock(), config.getSkew(), config.getHttpClientBuilder()));
        ClientTransport configured = config.getTransport();
        this.transport = configured != null ? configured : new JSONRPCTransport(agentUrl, config.getHttpClientBuilder());
        this.requestBuilder = new JSONRPCRequestBuilder(agentUrl, config.getClock());
        this.requestIdGenerator = config.getRequestIdGenerator();
    }

    public String getAgentUrl() {
        return agentUrl;
    }

    /**
     * Sends a message to the agent as part of a task ({@code tasks/send}).
     *
     * @param params the task id and message
     * @return the task as returned by the agent
     * @throws A2AClientException if the call failed
     */
    public Task submitTask(TaskSendParams params) throws A2AClientException {
        return await(submitTaskAsync(params));
    }

    public Task submitTask(TaskSendParams params, Object requestId) throws A2AClientException {
        return await(submitTaskAsync(params, requestId));
    }

    public CompletableFuture<Task> submitTaskAsync(TaskSendParams params) {
        checkNotNullParam("params", params);
        return call(A2AMethods.SEND_TASK, params, requestIdGenerator.nextId(A2AMethods.SEND_TASK, params));
    }

    public CompletableFuture<Task> submitTaskAsync(TaskSendParams params, Object requestId) {
        checkNotNullParam("params", params);
        return call(A2AMethods.SEND_TASK, params, requestId);
    }

    /**
     * Retrieves the current state of a task ({@code tasks/get}).
     *
     * @param params the task id and optional history length
     * @return the task
     * @throws A2AClientException if the call failed
     */
    public Task getTask(TaskQueryParams params) throws A2AClientException {
        return await(getTaskAsync(params));
    }

    public Task getTask(String taskId) throws A2AClientException {
        return getTask(new TaskQueryParams(taskId));
    }

    public Task getTask(TaskQueryParams params, Object requestId) throws A2AClientException {
        return await(getTaskAsync(params, requestId));
    }

    public CompletableFuture<Task> getTaskAsync(TaskQueryParams params) {
        checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK, params, requestIdGenerator.nextId(A2AMethods.GET_TASK, params));
    }

    public CompletableFuture<Task> getTaskAsync(TaskQueryParams params, Object requestId) {
        checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK, params, requestId);
    }

    /**
     * Asks the agent to cancel a task ({@code tasks/cancel}).
     *
     * @param params the task id
     * @return the task in its state after the cancellation request
     * @throws A2AClientException if the call failed
     */
    public Task cancelTask(TaskIdParams params) throws A2AClientException {
        return await(cancelTaskAsync(params));
    }

    public Task cancelTask(String taskId) throws A2AClientException {
        return cancelTask(new TaskIdParams(taskId));
    }

    public Task cancelTask(TaskIdParams params, Object requestId) throws A2AClientException {
        return await(cancelTaskAsync(params, requestId));
    }

    public CompletableFuture<Task> cancelTaskAsync(TaskIdParams params) {
        checkNotNullParam("params", params);
        return call(A2AMethods.CANCEL_TASK, params, requestIdGenerator.nextId(A2AMethods.CANCEL_TASK, params));
    }

    public CompletableFuture<Task> cancelTaskAsync(TaskIdParams params, Object requestId) {
        checkNotNullParam("params", params);
        return call(A2AMethods.CANCEL_TASK, params, requestId);
    }

    private CompletableFuture<Task> call(String method, Object params, Object requestId) {
        checkNotNullParam("requestId", requestId);
        JSONRPCRequest envelope;
        try {
            envelope = requestBuilder.build(method, params, requestId);
        } catch (A2AClientException e) {
            return CompletableFuture.failedFuture(e);
        }
        LOGGER.debug("Calling {} on {} with request id {}", method, agentUrl, requestId);

        CompletableFuture<Task> result = new CompletableFuture<>();
        CompletableFuture<@Nullable CredentialArtifact> credential = produceCredential(method);
        AtomicReference<CompletableFuture<?>> inProgress = new AtomicReference<>(credential);

        credential
                .handle(new BiFunction<@Nullable CredentialArtifact, @Nullable Throwable, @Nullable CredentialArtifact>() {
                    @Override
                    public @Nullable CredentialArtifact apply(@Nullable CredentialArtifact artifact, @Nullable Throwable throwable) {
                        if (throwable != null) {
                            throw Utils.asCompletionException(toAuthenticationFailure(method, throwable));
                        }
                        return artifact;
                    }
                })
                .thenCompose(new Function<@Nullable CredentialArtifact, CompletionStage<String>>() {
                    @Override
                    public CompletionStage<String> apply(@Nullable CredentialArtifact artifact) {
                        if (result.isDone()) {
                            return CompletableFuture.failedFuture(new CancellationException());
                        }
                        TransportRequest request;
                        try {
                            request = requestBuilder.attach(envelope, artifact);
                        } catch (A2AClientException e) {
                            return CompletableFuture.failedFuture(e);
                        }
                        CompletableFuture<String> sent = dispatch(method, request);
                        inProgress.set(sent);
                        if (result.isCancelled()) {
                            sent.cancel(true);
                        }
                        return sent;
                    }
                })
                .thenApply(new Function<String, Task>() {
                    @Override
                    public Task apply(String body) {
                        try {
                            return decode(envelope, body);
                        } catch (A2AClientException e) {
                            throw Utils.asCompletionException(e);
                        }
                    }
                })
                .whenComplete((task, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = Utils.unwrapCompletionException(throwable);
                        LOGGER.debug("Call {} with request id {} failed: {}", method, requestId, cause.toString());
                        result.completeExceptionally(cause);
                    } else {
                        LOGGER.debug("Call {} with request id {} returned task {} in state {}",
                                method, requestId, task.id(), task.status().state());
                        result.complete(task);
                    }
                });

        result.whenComplete((task, throwable) -> {
            if (result.isCancelled()) {
                LOGGER.debug("Call {} with request id {} was cancelled", method, requestId);
                inProgress.get().cancel(true);
            }
        });
        return result;
    }

    private CompletableFuture<@Nullable CredentialArtifact> produceCredential(String method) {
        if (credentialProvider == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            CompletableFuture<CredentialArtifact> artifact =
                    credentialProvider.produceArtifact(new CredentialContext(method, agentUrl));
            if (artifact == null) {
                return CompletableFuture.failedFuture(
                        new AuthenticationException("Credential provider returned no result for " + method));
            }
            CompletableFuture<CredentialArtifact> checked = artifact.thenApply(a -> {
                if (a == null) {
                    throw Utils.asCompletionException(
                            new AuthenticationException("Credential provider produced no credential for " + method));
                }
                return a;
            });
            return Utils.propagateCancellation(checked, artifact);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable toAuthenticationFailure(String method, Throwable throwable) {
        Throwable cause = Utils.unwrapCompletionException(throwable);
        if (cause instanceof CancellationException || cause instanceof AuthenticationException) {
            return cause;
        }
        return new AuthenticationException("Failed to obtain credential for " + method + ": " + cause.getMessage(), cause);
    }

    private CompletableFuture<String> dispatch(String method, TransportRequest request) {
        CompletableFuture<String> sent;
        try {
            sent = transport.send(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new A2AClientTransportException("Failed to send " + method + " request: " + e.getMessage(), e));
        }
        CompletableFuture<String> mapped = sent.exceptionally(new Function<Throwable, String>() {
            @Override
            public String apply(Throwable throwable) {
                Throwable cause = Utils.unwrapCompletionException(throwable);
                if (cause instanceof CancellationException || cause instanceof A2AClientException) {
                    throw Utils.asCompletionException(cause);
                }
                throw Utils.asCompletionException(new A2AClientTransportException(
                        "Failed to send " + method + " request: " + cause.getMessage(), cause));
            }
        });
        return Utils.propagateCancellation(mapped, sent);
    }

    private Task decode(JSONRPCRequest request, String body) throws A2AClientException {
        JSONRPCResponse<Task> response;
        try {
            response = Utils.unmarshalFrom(body, TASK_RESPONSE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new A2AClientProtocolException("Failed to decode response to " + request.method() + ": "
                    + e.getOriginalMessage(), e);
        }
        if (response == null) {
            throw new A2AClientProtocolException("Empty response to " + request.method());
        }
        if (!JSONRPCMessage.JSONRPC_VERSION.equals(response.jsonrpc())) {
            throw new A2AClientProtocolException("Invalid JSON-RPC version in response to " + request.method()
                    + ": " + response.jsonrpc());
        }
        if (!response.correlatesWith(request.id())) {
            throw new A2AClientProtocolException(request.id(), response.id());
        }
        JSONRPCError error = response.error();
        if (error != null) {
            throw new A2AServerException(error);
        }
        Task task = response.result();
        if (task == null) {
            throw new A2AClientProtocolException("Response to " + request.method() + " carries neither result nor error");
        }
        return task;
    }

    private static Task await(CompletableFuture<Task> future) throws A2AClientException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new A2AClientCancelledException("Interrupted while waiting for the response", e);
        } catch (CancellationException e) {
            throw new A2AClientCancelledException("Call was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = Utils.unwrapCompletionException(e);
            if (cause instanceof A2AClientException) {
                throw (A2AClientException) cause;
            }
            if (cause instanceof CancellationException) {
                throw new A2AClientCancelledException("Call was cancelled", cause);
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new A2AClientException("Call failed: " + cause.getMessage(), cause);
        }
    }
}
