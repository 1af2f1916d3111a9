package org.hivemind.runtime.spatial;

import java.util.Optional;

import org.hivemind.runtime.model.Vector2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * Uniform hash grid answering radius and k-nearest queries over entity ids.
 * <p>
 * Each entity is registered in every cell its bounding circle overlaps. Cells are keyed by
 * {@link GridKeys#pack(int, int)}; only occupied cells exist in the map. The grid stores ids,
 * positions and radii only, never entity objects.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. The orchestrator refreshes and queries it from a
 * single tick thread.
 */
public class SpatialHashGrid {

    private static final Logger LOG = LoggerFactory.getLogger(SpatialHashGrid.class);

    private final double cellSize;
    private final WorldBounds bounds;

    private final Long2ObjectOpenHashMap<IntOpenHashSet> cells = new Long2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<Entry> entries = new Int2ObjectOpenHashMap<>();

    /**
     * Creates an empty grid.
     *
     * @param cellSize Edge length of a cell, positive.
     * @param bounds The world bounds.
     * @throws IllegalArgumentException if the cell size is not positive.
     */
    public SpatialHashGrid(double cellSize, WorldBounds bounds) {
        if (!(cellSize > 0.0) || Double.isInfinite(cellSize)) {
            throw new IllegalArgumentException("Spatial cell size must be positive, got " + cellSize);
        }
        if (bounds == null) {
            throw new IllegalArgumentException("World bounds must not be null");
        }
        this.cellSize = cellSize;
        this.bounds = bounds;
    }

    /**
     * Creates a grid from the {@code hivemind.spatial} configuration block.
     *
     * @param spatialConfig The spatial block ({@code cell-size}, {@code world-bounds}).
     * @return A new empty grid.
     */
    public static SpatialHashGrid fromConfig(Config spatialConfig) {
        Config b = spatialConfig.getConfig("world-bounds");
        WorldBounds bounds = new WorldBounds(
                b.getDouble("min-x"), b.getDouble("min-y"), b.getDouble("max-x"), b.getDouble("max-y"));
        SpatialHashGrid grid = new SpatialHashGrid(spatialConfig.getDouble("cell-size"), bounds);
        LOG.debug("Spatial grid created: cellSize={}, bounds={}", grid.cellSize, bounds);
        return grid;
    }

    // ==================== Mutation ====================

    /**
     * Indexes an entity. An entity already present is replaced.
     *
     * @param id The entity id.
     * @param position The centre of its bounding circle.
     * @param radius The radius of its bounding circle; negative values are treated as 0.
     */
    public void insert(int id, Vector2 position, double radius) {
        Entry previous = entries.get(id);
        if (previous != null) {
            unlink(id, previous);
        }
        Entry entry = new Entry(position, Math.max(0.0, radius));
        entries.put(id, entry);
        link(id, entry);
    }

    /**
     * Moves an indexed entity. Unknown ids are ignored.
     *
     * @param id The entity id.
     * @param newPosition The new centre.
     */
    public void update(int id, Vector2 newPosition) {
        Entry current = entries.get(id);
        if (current == null) {
            return;
        }
        Entry moved = new Entry(newPosition, current.radius);
        if (moved.minX(cellSize) != current.minX(cellSize) || moved.maxX(cellSize) != current.maxX(cellSize)
                || moved.minY(cellSize) != current.minY(cellSize) || moved.maxY(cellSize) != current.maxY(cellSize)) {
            unlink(id, current);
            link(id, moved);
        }
        entries.put(id, moved);
    }

    /**
     * Removes an entity from the index.
     *
     * @param id The entity id.
     * @return {@code true} if the entity was indexed.
     */
    public boolean remove(int id) {
        Entry entry = entries.remove(id);
        if (entry == null) {
            return false;
        }
        unlink(id, entry);
        return true;
    }

    public void clear() {
        cells.clear();
        entries.clear();
    }

    // ==================== Queries ====================

    /**
     * Returns the ids of all entities whose bounding circle intersects the query circle,
     * i.e. {@code dist² <= (radius + entityRadius)²}.
     *
     * @param position The query centre.
     * @param radius The query radius; negative values are treated as 0.
     * @return The matching ids, each at most once.
     */
    public IntList query(Vector2 position, double radius) {
        double r = Math.max(0.0, radius);
        IntList result = new IntArrayList();
        if (entries.isEmpty()) {
            return result;
        }
        IntOpenHashSet seen = new IntOpenHashSet();
        int minX = GridKeys.quantize(position.x() - r, cellSize);
        int maxX = GridKeys.quantize(position.x() + r, cellSize);
        int minY = GridKeys.quantize(position.y() - r, cellSize);
        int maxY = GridKeys.quantize(position.y() + r, cellSize);
        long rangeCells = ((long) maxX - minX + 1) * ((long) maxY - minY + 1);

        if (rangeCells > cells.size()) {
            // Sparse grid: scanning the occupied cells is cheaper than walking the range.
            for (Long2ObjectMap.Entry<IntOpenHashSet> cell : cells.long2ObjectEntrySet()) {
                int gx = GridKeys.unpackX(cell.getLongKey());
                int gy = GridKeys.unpackY(cell.getLongKey());
                if (gx >= minX && gx <= maxX && gy >= minY && gy <= maxY) {
                    collect(cell.getValue(), position, r, seen, result);
                }
            }
        } else {
            for (int gx = minX; gx <= maxX; gx++) {
                for (int gy = minY; gy <= maxY; gy++) {
                    IntOpenHashSet cell = cells.get(GridKeys.pack(gx, gy));
                    if (cell != null) {
                        collect(cell, position, r, seen, result);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Returns up to {@code k} ids nearest to {@code position}, closest first.
     * <p>
     * The search radius starts at one cell size and doubles until {@code k} candidates are
     * found, {@code maxRadius} is reached or every indexed entity is a candidate.
     *
     * @param position The query centre.
     * @param k The maximum number of results.
     * @param maxRadius The largest radius searched.
     * @return The nearest ids sorted by ascending distance.
     */
    public IntList kNearest(Vector2 position, int k, double maxRadius) {
        if (k <= 0 || entries.isEmpty()) {
            return new IntArrayList();
        }
        double limit = Math.max(0.0, maxRadius);
        double radius = Math.min(cellSize, limit);
        IntList candidates = query(position, radius);
        while (candidates.size() < k && radius < limit && candidates.size() < entries.size()) {
            radius = Math.min(radius * 2.0, limit);
            candidates = query(position, radius);
        }
        IntArrayList sorted = new IntArrayList(candidates);
        sorted.sort((int a, int b) -> Double.compare(
                entries.get(a).position.distanceSquared(position),
                entries.get(b).position.distanceSquared(position)));
        if (sorted.size() > k) {
            sorted.size(k);
        }
        return sorted;
    }

    public boolean contains(int id) {
        return entries.containsKey(id);
    }

    public Optional<Vector2> getPosition(int id) {
        Entry entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.position);
    }

    /** @return The number of indexed entities. */
    public int size() {
        return entries.size();
    }

    public double getCellSize() {
        return cellSize;
    }

    public WorldBounds getBounds() {
        return bounds;
    }

    /**
     * @return Current occupancy statistics.
     */
    public SpatialGridStats getStats() {
        int max = 0;
        long total = 0;
        for (IntOpenHashSet cell : cells.values()) {
            max = Math.max(max, cell.size());
            total += cell.size();
        }
        double average = cells.isEmpty() ? 0.0 : (double) total / cells.size();
        return new SpatialGridStats(entries.size(), cells.size(), average, max);
    }

    // ==================== Internals ====================

    private void collect(IntOpenHashSet cell, Vector2 position, double radius, IntOpenHashSet seen, IntList result) {
        for (int id : cell) {
            if (!seen.add(id)) {
                continue;
            }
            Entry entry = entries.get(id);
            double reach = radius + entry.radius;
            if (entry.position.distanceSquared(position) <= reach * reach) {
                result.add(id);
            }
        }
    }

    private void link(int id, Entry entry) {
        int maxX = entry.maxX(cellSize);
        int maxY = entry.maxY(cellSize);
        for (int gx = entry.minX(cellSize); gx <= maxX; gx++) {
            for (int gy = entry.minY(cellSize); gy <= maxY; gy++) {
                cells.computeIfAbsent(GridKeys.pack(gx, gy), key -> new IntOpenHashSet()).add(id);
            }
        }
    }

    private void unlink(int id, Entry entry) {
        int maxX = entry.maxX(cellSize);
        int maxY = entry.maxY(cellSize);
        for (int gx = entry.minX(cellSize); gx <= maxX; gx++) {
            for (int gy = entry.minY(cellSize); gy <= maxY; gy++) {
                long key = GridKeys.pack(gx, gy);
                IntOpenHashSet cell = cells.get(key);
                if (cell != null) {
                    cell.remove(id);
                    if (cell.isEmpty()) {
                        cells.remove(key);
                    }
                }
            }
        }
    }

    private record Entry(Vector2 position, double radius) {
        int minX(double cellSize) { return GridKeys.quantize(position.x() - radius, cellSize); }
        int maxX(double cellSize) { return GridKeys.quantize(position.x() + radius, cellSize); }
        int minY(double cellSize) { return GridKeys.quantize(position.y() - radius, cellSize); }
        int maxY(double cellSize) { return GridKeys.quantize(position.y() + radius, cellSize); }
    }
}
