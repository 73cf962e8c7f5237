package com.polyglot.translationGateway.translation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options shared by every unit of a batch.
 */
@Value
@Builder
public class BatchOptions {

    public static final BatchOptions NONE = BatchOptions.builder().build();

    String glossaryId;

    String formality;

    boolean preserveEntities;
}
