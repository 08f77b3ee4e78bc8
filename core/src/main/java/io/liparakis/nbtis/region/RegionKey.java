package io.liparakis.nbtis.region;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Region coordinate key, also used to name region files.
 *
 * @param x the region's X coordinate
 * @param z the region's Z coordinate
 */
public record RegionKey(int x, int z) {
    private static final Pattern FILE_NAME = Pattern.compile("r\\.(-?\\d+)\\.(-?\\d+)\\.mc[ar]");

    /** Conventional file name, {@code r.<x>.<z>.mca}. */
    public String fileName() {
        return this + "." + RegionConstants.FILE_EXTENSION;
    }

    /** Absolute coordinates of a chunk in this region. */
    public ChunkPos chunk(int localX, int localZ) {
        return new ChunkPos((x << RegionConstants.REGION_SHIFT) + localX, (z << RegionConstants.REGION_SHIFT) + localZ);
    }

    /**
     * Parses a region file name such as {@code r.-1.2.mca}.
     *
     * @return the key, or {@code null} if the name does not follow the convention
     */
    public static @Nullable RegionKey fromFileName(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return null;
        }
        try {
            return new RegionKey(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public @NotNull String toString() {
        return "r." + x + "." + z;
    }
}
