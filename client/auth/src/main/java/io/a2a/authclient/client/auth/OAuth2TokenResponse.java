package io.a2a.authclient.client.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Successful response of an OAuth2 token endpoint.
 *
 * @param accessToken the issued token
 * @param tokenType the token type, {@code Bearer} for the tokens this client can use
 * @param expiresIn the token lifetime in seconds
 * @param scope the granted scopes, space separated
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuth2TokenResponse(@JsonProperty("access_token") @Nullable String accessToken,
                                  @JsonProperty("token_type") @Nullable String tokenType,
                                  @JsonProperty("expires_in") @Nullable Long expiresIn,
                                  @JsonProperty("scope") @Nullable String scope) {
}
