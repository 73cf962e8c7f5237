package com.polyglot.translationGateway.translation.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStatsSnapshot {

    long size;

    long hitCount;

    long missCount;

    long evictionCount;
}
