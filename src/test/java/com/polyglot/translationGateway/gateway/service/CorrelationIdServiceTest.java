package com.polyglot.translationGateway.gateway.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationIdService should echo safe ids and generate the rest")
class CorrelationIdServiceTest {

    private final CorrelationIdService service = new CorrelationIdService();

    @Test
    void keepsWellFormedClientId() {
        assertThat(service.resolve(" order-42.retry_1 ")).isEqualTo("order-42.retry_1");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"has space", "line\nbreak", "{json}"})
    void generatesIdForUnusableInput(String candidate) {
        String resolved = service.resolve(candidate);

        assertThat(resolved).isNotBlank().isNotEqualTo(candidate);
        assertThat(resolved).matches("[0-9a-f-]{36}");
    }

    @Test
    void generatedIdsAreUnique() {
        assertThat(service.generateCorrelationId()).isNotEqualTo(service.generateCorrelationId());
    }
}
