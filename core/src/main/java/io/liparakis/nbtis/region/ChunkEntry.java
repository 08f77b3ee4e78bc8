package io.liparakis.nbtis.region;

/**
 * One occupied slot of a region's location table.
 *
 * @param index        the slot index (0-1023)
 * @param localX       chunk X within the region
 * @param localZ       chunk Z within the region
 * @param sectorOffset first sector of the chunk blob
 * @param sectorCount  number of sectors reserved for the blob
 * @param timestamp    last modification time in epoch seconds
 */
public record ChunkEntry(int index, int localX, int localZ, int sectorOffset, int sectorCount, int timestamp) {

    static ChunkEntry of(int index, int location, int timestamp) {
        return new ChunkEntry(index,
                index % RegionConstants.REGION_SIZE,
                index / RegionConstants.REGION_SIZE,
                location >>> 8,
                location & 0xFF,
                timestamp);
    }

    public long byteOffset() {
        return (long) sectorOffset * RegionConstants.SECTOR_SIZE;
    }

    public int byteLength() {
        return sectorCount * RegionConstants.SECTOR_SIZE;
    }

    @Override
    public String toString() {
        return String.format("Chunk [%d, %d] (%d sectors at %d)", localX, localZ, sectorCount, sectorOffset);
    }
}
