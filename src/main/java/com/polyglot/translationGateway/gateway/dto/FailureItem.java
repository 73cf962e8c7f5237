package com.polyglot.translationGateway.gateway.dto;

import com.polyglot.translationGateway.translation.model.UnitFailure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failed unit as reported to clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FailureItem {

    private int index;

    /**
     * "transient" or "permanent".
     */
    private String kind;

    private boolean retryable;

    private String reason;

    public static FailureItem from(UnitFailure failure) {
        return FailureItem.builder()
                .index(failure.getIndex())
                .kind(failure.getKind().name().toLowerCase())
                .retryable(failure.isRetryable())
                .reason(failure.getReason())
                .build();
    }
}
