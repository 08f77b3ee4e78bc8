package io.liparakis.nbtis.region;

/**
 * Layout constants of the region container format.
 */
public final class RegionConstants {

    /** Allocation unit for chunk blobs, in bytes. */
    public static final int SECTOR_SIZE = 4096;

    /** Chunks along one side of a region. */
    public static final int REGION_SIZE = 32;

    /** Bits to shift a chunk coordinate by to get its region coordinate. */
    public static final int REGION_SHIFT = 5;

    public static final int CHUNKS_PER_REGION = REGION_SIZE * REGION_SIZE;

    /** Location table followed by timestamp table, one 32-bit entry per chunk each. */
    public static final int HEADER_SIZE = 2 * SECTOR_SIZE;

    /** Sectors reserved for the header at the start of the file. */
    public static final int HEADER_SECTORS = HEADER_SIZE / SECTOR_SIZE;

    /** Blob prefix: 4-byte length followed by a 1-byte compression scheme. */
    public static final int CHUNK_HEADER_SIZE = 5;

    /** The sector count occupies the low byte of a location entry. */
    public static final int MAX_SECTORS_PER_CHUNK = 0xFF;

    /** The sector offset occupies the upper three bytes of a location entry. */
    public static final int MAX_SECTOR_OFFSET = 0xFFFFFF;

    public static final String FILE_EXTENSION = "mca";

    private RegionConstants() {
        throw new AssertionError("RegionConstants is a utility class and should not be instantiated");
    }
}
