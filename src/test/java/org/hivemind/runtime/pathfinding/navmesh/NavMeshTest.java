package org.hivemind.runtime.pathfinding.navmesh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.hivemind.runtime.model.Vector2;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for polygon containment and chain search on a small corridor mesh.
 */
@Tag("unit")
class NavMeshTest {

    private NavMesh mesh;

    /** Three unit squares of edge 100 in a row, plus an unconnected island. */
    static NavMesh corridor() {
        return new NavMesh(List.of(
                square(0, 0, List.of(1)),
                square(100, 0, List.of(0, 2)),
                square(200, 0, List.of(1)),
                square(1000, 1000, List.of())));
    }

    static NavMeshPolygon square(double x, double y, List<Integer> neighbors) {
        return new NavMeshPolygon(List.of(
                new Vector2(x, y), new Vector2(x + 100, y), new Vector2(x + 100, y + 100), new Vector2(x, y + 100)),
                neighbors);
    }

    @BeforeEach
    void setUp() {
        mesh = corridor();
    }

    @Test
    void locatesContainingPolygon() {
        assertThat(mesh.findPolygon(new Vector2(50, 50))).hasValue(0);
        assertThat(mesh.findPolygon(new Vector2(250, 10))).hasValue(2);
        assertThat(mesh.findPolygon(new Vector2(500, 500))).isEmpty();
    }

    @Test
    void centreDefaultsToVertexAverage() {
        assertThat(mesh.getPolygon(1).center()).isEqualTo(new Vector2(150, 50));
    }

    @Test
    void findsShortestChainOfAdjacentPolygons() {
        assertThat(mesh.findChain(0, 2)).hasValueSatisfying(chain -> assertThat(chain.toIntArray()).containsExactly(0, 1, 2));
        assertThat(mesh.findChain(1, 1)).hasValueSatisfying(chain -> assertThat(chain.toIntArray()).containsExactly(1));
        assertThat(mesh.findChain(0, 3)).isEmpty();
    }

    @Test
    void concavePolygonContainment() {
        NavMeshPolygon ell = new NavMeshPolygon(List.of(
                new Vector2(0, 0), new Vector2(200, 0), new Vector2(200, 100),
                new Vector2(100, 100), new Vector2(100, 200), new Vector2(0, 200)), List.of());

        assertThat(ell.contains(new Vector2(50, 150))).isTrue();
        assertThat(ell.contains(new Vector2(150, 150))).isFalse();
    }

    @Test
    void rejectsInvalidPolygonsAndNeighbours() {
        assertThatThrownBy(() -> new NavMeshPolygon(List.of(Vector2.ZERO, new Vector2(1, 1)), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NavMesh(List.of(square(0, 0, List.of(5)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown neighbor 5");
    }
}
