package org.hivemind.runtime.pathfinding.navmesh;

import java.util.List;

import org.hivemind.runtime.model.Vector2;

/**
 * One walkable convex or concave polygon of a {@link NavMesh}.
 *
 * @param vertices The outline, at least three points, in either winding order.
 * @param neighbors Indices of adjacent polygons within the owning mesh.
 * @param center The point agents steer at when crossing this polygon.
 */
public record NavMeshPolygon(List<Vector2> vertices, List<Integer> neighbors, Vector2 center) {

    public NavMeshPolygon {
        if (vertices == null || vertices.size() < 3) {
            throw new IllegalArgumentException("A navigation polygon needs at least three vertices");
        }
        vertices = List.copyOf(vertices);
        neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
        if (center == null) {
            center = centroidOf(vertices);
        }
    }

    /**
     * Creates a polygon whose centre is the average of its vertices.
     */
    public NavMeshPolygon(List<Vector2> vertices, List<Integer> neighbors) {
        this(vertices, neighbors, null);
    }

    /**
     * Even-odd containment test: casts a horizontal ray from the point and counts edge crossings.
     *
     * @param point The point to test.
     * @return {@code true} if the point lies inside the polygon.
     */
    public boolean contains(Vector2 point) {
        boolean inside = false;
        int n = vertices.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Vector2 a = vertices.get(i);
            Vector2 b = vertices.get(j);
            if ((a.y() > point.y()) != (b.y() > point.y())
                    && point.x() < (b.x() - a.x()) * (point.y() - a.y()) / (b.y() - a.y()) + a.x()) {
                inside = !inside;
            }
        }
        return inside;
    }

    private static Vector2 centroidOf(List<Vector2> vertices) {
        double x = 0.0;
        double y = 0.0;
        for (Vector2 v : vertices) {
            x += v.x();
            y += v.y();
        }
        return new Vector2(x / vertices.size(), y / vertices.size());
    }
}
