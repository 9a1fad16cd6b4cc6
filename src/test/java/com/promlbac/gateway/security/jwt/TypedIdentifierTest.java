package com.promlbac.gateway.security.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.promlbac.gateway.security.jwt.TypedIdentifier.MalformedIdentifierException;
import com.promlbac.gateway.security.jwt.TypedIdentifier.Reason;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class TypedIdentifierTest {

    @Test
    void parse() {
        var identifier = TypedIdentifier.parse("sub", "user:42");

        assertThat(identifier.getKind()).isEqualTo("user");
        assertThat(identifier.getId()).isEqualTo("42");
        assertThat(identifier).hasToString("user:42");
    }

    @Test
    void parse_idIsEverythingAfterFirstColon() {
        var identifier = TypedIdentifier.parse("sub", "service-account:team:7");

        assertThat(identifier.getKind()).isEqualTo("service-account");
        assertThat(identifier.getId()).isEqualTo("team:7");
    }

    @ParameterizedTest
    @NullAndEmptySource
    void parse_missing(String value) {
        assertThatThrownBy(() -> TypedIdentifier.parse("sub", value))
                .isInstanceOfSatisfying(MalformedIdentifierException.class, ex -> {
                    assertThat(ex.getReason()).isEqualTo(Reason.MISSING);
                    assertThat(ex.getClaimName()).isEqualTo("sub");
                });
    }

    @Test
    void parse_withoutSeparator() {
        assertThatThrownBy(() -> TypedIdentifier.parse("sub", "42"))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.MISSING_SEPARATOR));
    }

    @Test
    void parse_emptyId() {
        assertThatThrownBy(() -> TypedIdentifier.parse("sub", "user:"))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.EMPTY_ID));
    }

    @Test
    void parseSingle() {
        assertThat(TypedIdentifier.parseSingle("aud", List.of("org:7")).numericId("aud")).isEqualTo(7L);
    }

    @Test
    void parseSingle_rejectsMultipleValues() {
        assertThatThrownBy(() -> TypedIdentifier.parseSingle("aud", List.of("org:7", "org:8")))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.NOT_SINGLE_VALUED));
    }

    @Test
    void parseSingle_rejectsNoValues() {
        assertThatThrownBy(() -> TypedIdentifier.parseSingle("aud", List.of()))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.MISSING));
        assertThatThrownBy(() -> TypedIdentifier.parseSingle("aud", null))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.MISSING));
    }

    @Test
    void numericId_rejectsNonNumeric() {
        var identifier = TypedIdentifier.parse("aud", "org:main");

        assertThatThrownBy(() -> identifier.numericId("aud"))
                .isInstanceOfSatisfying(MalformedIdentifierException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.NOT_NUMERIC))
                .hasCauseInstanceOf(NumberFormatException.class);
    }
}
