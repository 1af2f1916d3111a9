package org.hivemind.runtime.pathfinding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.pathfinding.impl.DirectPathStrategy;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.test.utils.LogCapture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link PathfindingService}: caching and the direct-path fallback.
 */
@ExtendWith(MockitoExtension.class)
@Tag("unit")
class PathfindingServiceTest {

    @Mock
    private IPathfindingStrategy strategy;

    private PathCache cache;
    private PathfindingService service;

    @BeforeEach
    void setUp() {
        cache = new PathCache(50, 100, 30_000);
        service = new PathfindingService(strategy, cache, new DirectPathStrategy());
    }

    @Test
    void repeatedRequestIsServedFromCacheWithoutInvokingTheStrategy() {
        Vector2 start = new Vector2(0, 0);
        Vector2 goal = new Vector2(300, 0);
        List<Vector2> computed = List.of(start, new Vector2(150, 20), goal);
        when(strategy.findPath(start, goal)).thenReturn(computed);

        List<Vector2> first = service.findPath(start, goal, 0);
        List<Vector2> second = service.findPath(new Vector2(5, 5), new Vector2(310, 10), 100);

        assertThat(second).isEqualTo(first).isEqualTo(computed);
        verify(strategy, times(1)).findPath(any(), any());
        assertThat(service.getStrategyInvocations()).isEqualTo(1);
        assertThat(service.getCacheHits()).isEqualTo(1);
    }

    @Test
    void failingStrategyFallsBackToDirectPathAndWarns() {
        Vector2 start = new Vector2(0, 0);
        Vector2 goal = new Vector2(100, 0);
        when(strategy.findPath(start, goal)).thenThrow(new IllegalStateException("boom"));

        try (LogCapture log = LogCapture.of(PathfindingService.class)) {
            List<Vector2> path = service.findPath(start, goal, 0);

            assertThat(path).isEqualTo(new DirectPathStrategy().findPath(start, goal));
            assertThat(log.warnings()).singleElement().asString().contains("boom");
        }
        assertThat(cache.size()).isZero();
    }

    @Test
    void emptyResultIsReplacedByDirectPathAndCached() {
        Vector2 start = new Vector2(0, 0);
        Vector2 goal = new Vector2(100, 0);
        when(strategy.findPath(start, goal)).thenReturn(List.of());

        List<Vector2> path = service.findPath(start, goal, 0);

        assertThat(path).isNotEmpty().endsWith(goal);
        assertThat(cache.get(start, goal)).contains(path);
    }

    @Test
    void prepareFailureIsContained() {
        doThrow(new IllegalStateException("no field")).when(strategy).prepare(any());

        try (LogCapture log = LogCapture.of(PathfindingService.class)) {
            service.prepare(new Vector2(1, 1));

            assertThat(log.warnings()).hasSize(1);
        }
    }

    @Test
    void replacingTheStrategyClearsTheCache() {
        cache.put(Vector2.ZERO, new Vector2(100, 0), List.of(new Vector2(100, 0)), 0);
        IPathfindingStrategy replacement = new DirectPathStrategy();

        service.setStrategy(replacement);

        assertThat(cache.size()).isZero();
        assertThat(service.getStrategy()).isSameAs(replacement);
        verify(strategy, never()).findPath(any(), any());
    }

    @Test
    void resetClearsTickCounters() {
        when(strategy.findPath(any(), any())).thenReturn(List.of(new Vector2(9, 9)));
        service.findPath(Vector2.ZERO, new Vector2(9, 9), 0);

        service.resetTickCounters();

        assertThat(service.getStrategyInvocations()).isZero();
        assertThat(service.getCacheHits()).isZero();
    }
}
