package org.hivemind.runtime.spatial;

/**
 * Occupancy snapshot of a {@link SpatialHashGrid}.
 *
 * @param entityCount Number of indexed entities.
 * @param cellCount Number of non-empty cells.
 * @param averageEntitiesPerCell Mean cell occupancy, 0 when the grid is empty.
 * @param maxEntitiesPerCell Occupancy of the fullest cell.
 */
public record SpatialGridStats(int entityCount, int cellCount, double averageEntitiesPerCell, int maxEntitiesPerCell) {
}
