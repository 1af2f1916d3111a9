package org.hivemind.runtime.pathfinding.navmesh;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import org.hivemind.runtime.model.Vector2;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A navigation mesh: walkable polygons and their adjacency.
 * <p>
 * Supports locating the polygon containing a point and finding the shortest polygon chain
 * (by number of hops) between two polygons.
 */
public final class NavMesh {

    private final List<NavMeshPolygon> polygons;

    /**
     * @param polygons The polygons. Neighbour indices must refer to polygons in this list.
     * @throws IllegalArgumentException if a neighbour index is out of range.
     */
    public NavMesh(List<NavMeshPolygon> polygons) {
        this.polygons = List.copyOf(polygons);
        for (int i = 0; i < this.polygons.size(); i++) {
            for (int neighbor : this.polygons.get(i).neighbors()) {
                if (neighbor < 0 || neighbor >= this.polygons.size()) {
                    throw new IllegalArgumentException(
                            "Polygon " + i + " references unknown neighbor " + neighbor);
                }
            }
        }
    }

    /**
     * @param point A world position.
     * @return The index of the first polygon containing the point, or empty.
     */
    public OptionalInt findPolygon(Vector2 point) {
        for (int i = 0; i < polygons.size(); i++) {
            if (polygons.get(i).contains(point)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Breadth-first search over polygon adjacency.
     *
     * @param from Start polygon index.
     * @param to Goal polygon index.
     * @return The polygon indices from {@code from} to {@code to} inclusive, or empty if they are not connected.
     */
    public Optional<IntList> findChain(int from, int to) {
        int[] parent = new int[polygons.size()];
        Arrays.fill(parent, -1);
        parent[from] = from;
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(from);
        while (!queue.isEmpty()) {
            int current = queue.dequeueInt();
            if (current == to) {
                IntArrayList chain = new IntArrayList();
                for (int p = to; p != from; p = parent[p]) {
                    chain.add(0, p);
                }
                chain.add(0, from);
                return Optional.of(chain);
            }
            for (int neighbor : polygons.get(current).neighbors()) {
                if (parent[neighbor] == -1) {
                    parent[neighbor] = current;
                    queue.enqueue(neighbor);
                }
            }
        }
        return Optional.empty();
    }

    public NavMeshPolygon getPolygon(int index) {
        return polygons.get(index);
    }

    public int size() {
        return polygons.size();
    }

    public boolean isEmpty() {
        return polygons.isEmpty();
    }
}
