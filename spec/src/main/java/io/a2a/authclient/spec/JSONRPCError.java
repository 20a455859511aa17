package io.a2a.authclient.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The error member of a JSON-RPC response.
 *
 * @param code the error code, see {@link A2AErrorCodes}
 * @param message a short description of the error
 * @param data optional additional information about the error
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JSONRPCError(@JsonProperty("code") int code,
                           @JsonProperty("message") String message,
                           @JsonProperty("data") @Nullable Object data) {

    @JsonCreator
    public JSONRPCError {
        Assert.checkNotNullParam("message", message);
    }

    public JSONRPCError(int code, String message) {
        this(code, message, null);
    }
}
