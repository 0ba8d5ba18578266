package com.salesforce.dynamodbv2.mapper.stream;

import com.google.common.base.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

/**
 * Counters shared by a coordinator and its shards.
 */
final class StreamMeters {

    final Counter iteratorRefreshes;
    final Counter trimHorizonFallbacks;

    StreamMeters(MeterRegistry meterRegistry, String metricPrefix) {
        final String cn = Coordinator.class.getSimpleName();
        final String prefix = Strings.isNullOrEmpty(metricPrefix) ? cn : cn + "." + metricPrefix;
        this.iteratorRefreshes = meterRegistry.counter(prefix + ".IteratorRefreshes");
        this.trimHorizonFallbacks = meterRegistry.counter(prefix + ".TrimHorizonFallbacks");
    }

    static StreamMeters noop() {
        return new StreamMeters(new CompositeMeterRegistry(), null);
    }

}
