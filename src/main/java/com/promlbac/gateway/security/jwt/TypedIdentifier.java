package com.promlbac.gateway.security.jwt;

import java.util.Collection;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;
import org.springframework.lang.Nullable;

/**
 * Identifier encoded as {@code <kind>:<id>}, the format Grafana uses for the {@code sub} and {@code aud} claims of
 * its id tokens (e.g. {@code user:42}, {@code org:7}).
 * <p>
 * The kind is everything before the first colon, the id is everything after it.
 */
@Value
public class TypedIdentifier {

    private static final char SEPARATOR = ':';

    @NonNull
    String kind;

    @NonNull
    String id;

    public static TypedIdentifier parse(String claimName, @Nullable String value) {
        if (value == null || value.isEmpty()) {
            throw new MalformedIdentifierException(claimName, value, Reason.MISSING);
        }

        var separatorIndex = value.indexOf(SEPARATOR);
        if (separatorIndex < 0) {
            throw new MalformedIdentifierException(claimName, value, Reason.MISSING_SEPARATOR);
        }

        var id = value.substring(separatorIndex + 1);
        if (id.isEmpty()) {
            throw new MalformedIdentifierException(claimName, value, Reason.EMPTY_ID);
        }

        return new TypedIdentifier(value.substring(0, separatorIndex), id);
    }

    /**
     * Parses a multi-valued claim that must hold exactly one identifier.
     */
    public static TypedIdentifier parseSingle(String claimName, @Nullable Collection<String> values) {
        if (values == null || values.isEmpty()) {
            throw new MalformedIdentifierException(claimName, null, Reason.MISSING);
        }
        if (values.size() != 1) {
            throw new MalformedIdentifierException(claimName, String.valueOf(values), Reason.NOT_SINGLE_VALUED);
        }
        return parse(claimName, values.iterator().next());
    }

    public long numericId(String claimName) {
        try {
            return Long.parseLong(this.id);
        } catch (NumberFormatException e) {
            throw new MalformedIdentifierException(claimName, this.toString(), Reason.NOT_NUMERIC, e);
        }
    }

    @Override
    public String toString() {
        return this.kind + SEPARATOR + this.id;
    }

    public enum Reason {
        MISSING,
        MISSING_SEPARATOR,
        EMPTY_ID,
        NOT_NUMERIC,
        NOT_SINGLE_VALUED
    }

    @Getter
    public static class MalformedIdentifierException extends RuntimeException {

        private final String claimName;
        private final Reason reason;

        MalformedIdentifierException(String claimName, @Nullable String value, Reason reason) {
            this(claimName, value, reason, null);
        }

        MalformedIdentifierException(String claimName, @Nullable String value, Reason reason,
                @Nullable Throwable cause) {
            super("Claim '%s' is malformed (%s): %s".formatted(claimName, reason, value), cause);
            this.claimName = claimName;
            this.reason = reason;
        }
    }
}
