package com.dimosr.cache;

import com.dimosr.cache.core.Cacheable;
import com.dimosr.cache.core.MetricsCollector;
import com.dimosr.cache.exceptions.MissingKeysException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class MonitoredCacheTest {

    private static final String CACHE_ID = "cache-id";
    private static final String METRIC_FOR_HIT = "Cache.cache-id.hit";

    private static final String KEY = "key";
    private static final String VALUE = "value";

    private static final Instant NOW = Instant.ofEpochMilli(1000);

    @Mock
    private Cacheable<String, String> mockCache;
    @Mock
    private MetricsCollector metricsCollector;
    @Mock
    private Clock clock;

    private MonitoredCache<String, String> monitoredCache;

    @Before
    public void setupMonitoredCache() {
        monitoredCache = new MonitoredCache<>(mockCache, CACHE_ID, clock, metricsCollector);
    }

    @Test
    public void whenValueIsInCacheItIsReturnedAndAHitIsEmitted() {
        when(clock.instant()).thenReturn(NOW);
        when(mockCache.get(KEY)).thenReturn(Optional.of(VALUE));

        Optional<String> value = monitoredCache.get(KEY);

        assertThat(value).contains(VALUE);
        verify(metricsCollector).putMetric(METRIC_FOR_HIT, 1.0d, NOW);
    }

    @Test
    public void whenValueIsNotInCacheAMissIsEmitted() {
        when(clock.instant()).thenReturn(NOW);
        when(mockCache.get(KEY, String.class)).thenReturn(Optional.empty());

        Optional<String> value = monitoredCache.get(KEY, String.class);

        assertThat(value).isEmpty();
        verify(metricsCollector).putMetric(METRIC_FOR_HIT, 0.0d, NOW);
    }

    @Test
    public void whenResolveFailsAMissIsEmittedAndTheErrorPropagated() {
        when(clock.instant()).thenReturn(NOW);
        when(mockCache.resolve(KEY)).thenThrow(MissingKeysException.forKey(KEY));

        assertThatThrownBy(() -> monitoredCache.resolve(KEY))
                .isInstanceOf(MissingKeysException.class);
        verify(metricsCollector).putMetric(METRIC_FOR_HIT, 0.0d, NOW);
    }

    @Test
    public void whenResolveSucceedsAHitIsEmitted() {
        when(clock.instant()).thenReturn(NOW);
        when(mockCache.resolve(KEY, String.class)).thenReturn(VALUE);

        assertThat(monitoredCache.resolve(KEY, String.class)).isEqualTo(VALUE);
        verify(metricsCollector).putMetric(eq(METRIC_FOR_HIT), eq(1.0d), eq(NOW));
    }

    @Test
    public void writesAreForwardedWithoutMetrics() {
        monitoredCache.set(KEY, VALUE);
        monitoredCache.remove(KEY);

        verify(mockCache).set(KEY, VALUE);
        verify(mockCache).remove(KEY);
        verify(metricsCollector, never()).putMetric(anyString(), anyDouble(), eq(NOW));
    }

    @Test
    public void requireReturnsTheMonitoredCache() {
        assertThat(monitoredCache.require(KEY)).isSameAs(monitoredCache);
        verify(mockCache).require(KEY);
    }
}
