package io.liparakis.nbtis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.Deflater;

/**
 * Tunable limits and defaults for decoding, compression and region caching.
 * <p>
 * Persisted as a flat JSON object. Keys that are absent from the file keep
 * their default value.
 * </p>
 *
 * @param maxDepth         maximum nesting of lists and compounds accepted on decode
 * @param maxArrayLength   maximum element count accepted for any array or list
 * @param compressionLevel deflate level used for gzip and zlib output
 * @param maxCachedRegions number of region files kept open by a storage
 */
public record NbtisSettings(int maxDepth, int maxArrayLength, int compressionLevel, int maxCachedRegions) {

    public static final int DEFAULT_MAX_DEPTH = 512;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 16 * 1024 * 1024;
    public static final int DEFAULT_MAX_CACHED_REGIONS = 64;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public NbtisSettings {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxArrayLength < 0) {
            throw new IllegalArgumentException("maxArrayLength must not be negative: " + maxArrayLength);
        }
        if (compressionLevel != Deflater.DEFAULT_COMPRESSION && (compressionLevel < 0 || compressionLevel > 9)) {
            throw new IllegalArgumentException("compressionLevel out of range: " + compressionLevel);
        }
        if (maxCachedRegions <= 0) {
            throw new IllegalArgumentException("maxCachedRegions must be positive: " + maxCachedRegions);
        }
    }

    /**
     * Returns the built-in settings.
     */
    public static NbtisSettings defaults() {
        return new NbtisSettings(DEFAULT_MAX_DEPTH, DEFAULT_MAX_ARRAY_LENGTH,
                Deflater.DEFAULT_COMPRESSION, DEFAULT_MAX_CACHED_REGIONS);
    }

    /**
     * Loads settings from a JSON file.
     *
     * @param file the settings file
     * @return the parsed settings, or {@link #defaults()} if the file does not exist
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static NbtisSettings load(Path file) throws IOException {
        if (!Files.exists(file)) {
            return defaults();
        }

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (root.isJsonNull()) {
                return defaults();
            }
            if (!root.isJsonObject()) {
                throw new IOException("Settings file " + file + " must contain a JSON object");
            }
            return fromJson(root.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException e) {
            throw new IOException("Malformed settings file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes these settings to a JSON file, replacing any existing content.
     */
    public void save(Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(this, writer);
        }
    }

    private static NbtisSettings fromJson(JsonObject json) {
        NbtisSettings base = defaults();
        return new NbtisSettings(
                intOr(json, "maxDepth", base.maxDepth()),
                intOr(json, "maxArrayLength", base.maxArrayLength()),
                intOr(json, "compressionLevel", base.compressionLevel()),
                intOr(json, "maxCachedRegions", base.maxCachedRegions()));
    }

    private static int intOr(JsonObject json, String key, int fallback) {
        JsonElement element = json.get(key);
        return (element == null || element.isJsonNull()) ? fallback : element.getAsInt();
    }
}
