package io.liparakis.nbtis.spi;

import io.liparakis.nbtis.file.VendorHeader;
import org.jetbrains.annotations.Nullable;

/**
 * Strategy for recognising a vendor header in front of a document.
 * <p>
 * Detection is heuristic; callers that know their files can supply a
 * stricter implementation or {@link #NONE}.
 * </p>
 */
@FunctionalInterface
public interface HeaderSniffer {

    /** The built-in heuristic, see {@link VendorHeader#sniff(byte[])}. */
    HeaderSniffer DEFAULT = VendorHeader::sniff;

    /** Never reports a header. */
    HeaderSniffer NONE = prefix -> null;

    /**
     * Inspects the leading bytes of an uncompressed document.
     *
     * @param prefix up to {@link VendorHeader#SNIFF_LENGTH} bytes; shorter if the document is shorter
     * @return the detected header, or {@code null} for standard framing
     */
    @Nullable VendorHeader sniff(byte[] prefix);
}
