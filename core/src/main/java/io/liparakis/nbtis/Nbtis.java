package io.liparakis.nbtis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared identity and logger for the Nbtis library.
 */
public final class Nbtis {
    public static final String ID = "nbtis";
    public static final Logger LOGGER = LoggerFactory.getLogger(ID);

    private Nbtis() {
        throw new AssertionError("Nbtis is a utility class and should not be instantiated");
    }
}
