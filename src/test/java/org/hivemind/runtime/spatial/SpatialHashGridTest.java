package org.hivemind.runtime.spatial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.hivemind.runtime.model.Vector2;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link SpatialHashGrid}: radius queries, bookkeeping and k-nearest search.
 */
@Tag("unit")
class SpatialHashGridTest {

    private SpatialHashGrid grid;

    @BeforeEach
    void setUp() {
        grid = new SpatialHashGrid(100.0, WorldBounds.centered(5000.0));
    }

    @Test
    void queryReturnsOnlyEntitiesWithinRadius() {
        grid.insert(1, new Vector2(10, 10), 0);
        grid.insert(2, new Vector2(20, 20), 0);
        grid.insert(3, new Vector2(5000, 5000), 0);

        assertThat(grid.query(new Vector2(15, 15), 50).toIntArray()).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void zeroRadiusQueryAlwaysFindsTheEntityItself() {
        Random random = new Random(42);
        for (int id = 0; id < 200; id++) {
            grid.insert(id, new Vector2(random.nextDouble() * 2000 - 1000, random.nextDouble() * 2000 - 1000),
                    random.nextDouble() * 20);
        }
        for (int id = 0; id < 200; id++) {
            Vector2 position = grid.getPosition(id).orElseThrow();
            assertThat(grid.query(position, 0).toIntArray()).contains(id);
        }
    }

    @Test
    void sizeTracksInsertsMinusRemoves() {
        grid.insert(1, new Vector2(0, 0), 0);
        grid.insert(2, new Vector2(150, 0), 0);
        grid.insert(3, new Vector2(-150, 220), 10);
        grid.insert(2, new Vector2(170, 0), 0);
        grid.update(3, new Vector2(900, 900));
        grid.update(99, new Vector2(1, 1));
        assertThat(grid.remove(1)).isTrue();
        assertThat(grid.remove(1)).isFalse();

        assertThat(grid.size()).isEqualTo(2);
        assertThat(grid.contains(99)).isFalse();
        assertThat(grid.getStats().entityCount()).isEqualTo(2);
    }

    @Test
    void updateMovesEntityBetweenCells() {
        grid.insert(7, new Vector2(10, 10), 0);
        grid.update(7, new Vector2(1010, 1010));

        assertThat(grid.query(new Vector2(10, 10), 20).toIntArray()).isEmpty();
        assertThat(grid.query(new Vector2(1000, 1000), 20).toIntArray()).containsExactly(7);
        assertThat(grid.getStats().cellCount()).isEqualTo(1);
    }

    @Test
    void entityRadiusExtendsReach() {
        grid.insert(1, new Vector2(0, 0), 40);

        assertThat(grid.query(new Vector2(60, 0), 30).toIntArray()).containsExactly(1);
        assertThat(grid.query(new Vector2(80, 0), 30).toIntArray()).isEmpty();
    }

    @Test
    void entitySpanningCellsIsReportedOnce() {
        grid.insert(1, new Vector2(100, 100), 50);

        assertThat(grid.getStats().cellCount()).isEqualTo(4);
        assertThat(grid.query(new Vector2(100, 100), 500).toIntArray()).containsExactly(1);
    }

    @Test
    void kNearestReturnsClosestFirst() {
        grid.insert(1, new Vector2(300, 0), 0);
        grid.insert(2, new Vector2(50, 0), 0);
        grid.insert(3, new Vector2(120, 0), 0);
        grid.insert(4, new Vector2(4000, 0), 0);

        assertThat(grid.kNearest(Vector2.ZERO, 3, 1000).toIntArray()).containsExactly(2, 3, 1);
        assertThat(grid.kNearest(Vector2.ZERO, 10, 1000).toIntArray()).containsExactly(2, 3, 1);
        assertThat(grid.kNearest(Vector2.ZERO, 0, 1000).toIntArray()).isEmpty();
    }

    @Test
    void clearEmptiesTheIndex() {
        grid.insert(1, new Vector2(0, 0), 0);
        grid.clear();

        assertThat(grid.size()).isZero();
        assertThat(grid.query(Vector2.ZERO, 100).toIntArray()).isEmpty();
        assertThat(grid.getStats().averageEntitiesPerCell()).isZero();
    }

    @Test
    void rejectsNonPositiveCellSize() {
        assertThatThrownBy(() -> new SpatialHashGrid(0, WorldBounds.centered(10)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpatialHashGrid(-5, WorldBounds.centered(10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createsFromConfigBlock() {
        Config spatial = ConfigFactory.parseString(
                "cell-size = 50\nworld-bounds { min-x = -100, min-y = -100, max-x = 100, max-y = 100 }");

        SpatialHashGrid configured = SpatialHashGrid.fromConfig(spatial);

        assertThat(configured.getCellSize()).isEqualTo(50.0);
        assertThat(configured.getBounds().width()).isEqualTo(200.0);
    }
}
