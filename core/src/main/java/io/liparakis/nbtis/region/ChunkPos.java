package io.liparakis.nbtis.region;

/**
 * Absolute chunk coordinates.
 *
 * @param x The chunk X coordinate
 * @param z The chunk Z coordinate
 */
public record ChunkPos(int x, int z) {

    public int regionX() {
        return x >> RegionConstants.REGION_SHIFT;
    }

    public int regionZ() {
        return z >> RegionConstants.REGION_SHIFT;
    }

    public int localX() {
        return x & (RegionConstants.REGION_SIZE - 1);
    }

    public int localZ() {
        return z & (RegionConstants.REGION_SIZE - 1);
    }

    /** Position of this chunk in its region's header tables (0-1023). */
    public int index() {
        return localX() + localZ() * RegionConstants.REGION_SIZE;
    }

    public RegionKey region() {
        return new RegionKey(regionX(), regionZ());
    }
}
