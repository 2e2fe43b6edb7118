package com.gradientcast.detection.engine.features;

import com.gradientcast.detection.config.DetectionProperties;
import com.gradientcast.detection.config.MetricsConfig;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded read-through cache of rolling statistics.
 *
 * <p>Entries are keyed by dimension, window-end timestamp, lookback and the exact
 * window values, so an entry is only ever returned for an identical window and a
 * hit equals recomputation. Least recently used entries are evicted past
 * {@code detection.cache.max-entries}.
 */
@Component
public class RollingStatisticsCache {

    private final boolean enabled;
    private final MetricsConfig metricsConfig;
    private final Map<Key, RollingStatistics> entries;

    public RollingStatisticsCache(DetectionProperties properties, MetricsConfig metricsConfig) {
        this.enabled = properties.getCache().isEnabled();
        this.metricsConfig = metricsConfig;
        int maxEntries = properties.getCache().getMaxEntries();
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, RollingStatistics> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public RollingStatistics get(String dimensionKey, LocalDateTime windowEnd, int lookback,
                                 double[] values, Supplier<RollingStatistics> loader) {
        if (!enabled) {
            return loader.get();
        }
        Key key = new Key(dimensionKey, windowEnd, lookback, values);
        synchronized (entries) {
            RollingStatistics cached = entries.get(key);
            if (cached != null) {
                metricsConfig.recordCacheLookup(true);
                return cached;
            }
        }
        RollingStatistics computed = loader.get();
        metricsConfig.recordCacheLookup(false);
        synchronized (entries) {
            entries.put(key, computed);
        }
        return computed;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private static final class Key {
        private final String dimensionKey;
        private final LocalDateTime windowEnd;
        private final int lookback;
        private final double[] values;
        private final int hash;

        Key(String dimensionKey, LocalDateTime windowEnd, int lookback, double[] values) {
            this.dimensionKey = dimensionKey;
            this.windowEnd = windowEnd;
            this.lookback = lookback;
            this.values = values.clone();
            this.hash = Objects.hash(dimensionKey, windowEnd, lookback) * 31 + Arrays.hashCode(this.values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return lookback == other.lookback
                    && Objects.equals(dimensionKey, other.dimensionKey)
                    && Objects.equals(windowEnd, other.windowEnd)
                    && Arrays.equals(values, other.values);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
