package io.a2a.authclient.client.transport.jsonrpc;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import io.a2a.authclient.spec.TaskIdParams;
import io.a2a.authclient.spec.TaskQueryParams;
import io.a2a.authclient.spec.TaskSendParams;
import org.jspecify.annotations.Nullable;

/**
 * Chooses the JSON-RPC {@code id} of requests the caller did not give an explicit id.
 * Generated ids are Strings or Numbers.
 */
@FunctionalInterface
public interface RequestIdGenerator {

    /**
     * @param method the JSON-RPC method of the request
     * @param params the request parameters, may be null
     * @return the id to send
     */
    Object nextId(String method, @Nullable Object params);

    /**
     * Uses the id of the task the request is about, falling back to a random UUID for
     * parameters that carry no task id.
     *
     * @return the generator
     */
    static RequestIdGenerator taskId() {
        return (method, params) -> {
            if (params instanceof TaskSendParams p) {
                return p.id();
            }
            if (params instanceof TaskQueryParams p) {
                return p.id();
            }
            if (params instanceof TaskIdParams p) {
                return p.id();
            }
            return UUID.randomUUID().toString();
        };
    }

    /**
     * @return a generator producing a random UUID per request
     */
    static RequestIdGenerator uuid() {
        return (method, params) -> UUID.randomUUID().toString();
    }

    /**
     * @return a generator producing 1, 2, 3, ... for the requests of one client
     */
    static RequestIdGenerator sequential() {
        AtomicLong next = new AtomicLong(1);
        return (method, params) -> next.getAndIncrement();
    }
}
