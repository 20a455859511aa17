package io.a2a.authclient.spec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.a2a.authclient.util.Assert;
import org.jspecify.annotations.Nullable;

import static io.a2a.authclient.spec.TextPart.TEXT;

/**
 * Represents a plain text content part within a {@link Message} or {@link Artifact}.
 * <p>
 * Example usage:
 * <pre>{@code
 * TextPart greeting = new TextPart("Hello, this is an authenticated request");
 * TextPart withMetadata = new TextPart("Bonjour!", Map.of("language", "fr"));
 * }</pre>
 */
@JsonTypeName(TEXT)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextPart(@JsonProperty("text") String text,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part<String> {

    public static final String TEXT = "text";

    @JsonCreator
    public TextPart {
        Assert.checkNotNullParam("text", text);
        metadata = (metadata != null) ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : null;
    }

    public TextPart(String text) {
        this(text, null);
    }

    @Override
    public String type() {
        return TEXT;
    }
}
