package io.a2a.authclient.util;

import java.net.URI;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;

public class Utils {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Deserializes the provided string.
     *
     * @param data the string to deserialize
     * @param typeRef the type reference for the type to deserialize to
     * @param <T> the type to deserialize to
     * @return the deserialized object
     * @throws JsonProcessingException if the string cannot be deserialized
     */
    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    public static <T> T defaultIfNull(@Nullable T value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        return value;
    }

    /**
     * Cancels {@code upstream} when {@code downstream} gets cancelled.
     * <p>
     * Cancelling a dependent {@link CompletableFuture} does not reach the stage it was derived from;
     * this links the two so that cancelling a call also cancels the network operation behind it.
     *
     * @param downstream the future handed to the caller
     * @param upstream the future doing the actual work
     * @param <T> the result type of the downstream future
     * @return {@code downstream}
     */
    public static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> downstream,
                                                                 CompletableFuture<?> upstream) {
        downstream.whenComplete((result, throwable) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers
     * {@link CompletableFuture} puts around failures.
     *
     * @param throwable the failure as observed on a future
     * @return the underlying failure
     */
    public static Throwable unwrapCompletionException(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Wraps a checked failure so that it can be thrown from a {@link CompletableFuture} stage
     * function; the future then completes with {@code throwable} as its cause.
     *
     * @param throwable the failure
     * @return a completion exception wrapping {@code throwable}
     */
    public static CompletionException asCompletionException(Throwable throwable) {
        if (throwable instanceof CompletionException) {
            return (CompletionException) throwable;
        }
        return new CompletionException(throwable);
    }

    /**
     * Returns the part of {@code url} an HTTP client bound to its scheme and authority has to
     * request: the raw path, {@code /} when there is none, followed by the raw query if present.
     *
     * @param url an absolute URL
     * @return the request path and query
     * @throws IllegalArgumentException if {@code url} is not a valid URI
     */
    public static String requestPathOf(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URL [" + url + "] is not valid", e);
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    public static boolean isCancellation(Throwable throwable) {
        return unwrapCompletionException(throwable) instanceof CancellationException;
    }
}
