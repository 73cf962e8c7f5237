package com.polyglot.translationGateway.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CacheStatsResponse {

    private long size;

    @JsonProperty("hit_count")
    private long hitCount;

    @JsonProperty("miss_count")
    private long missCount;

    @JsonProperty("eviction_count")
    private long evictionCount;
}
