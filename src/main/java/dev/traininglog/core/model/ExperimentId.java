package dev.traininglog.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.traininglog.core.InvalidExperimentIdException;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 12 random bytes scoping every row/document of one experiment inside a shared database.
 * Externally a 24 character hex string.
 */
public final class ExperimentId {
    public static final int LENGTH_BYTES = 12;

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private ExperimentId(final byte[] bytes) {
        this.bytes = bytes;
    }

    public static ExperimentId random() {
        final byte[] b = new byte[LENGTH_BYTES];
        RANDOM.nextBytes(b);
        return new ExperimentId(b);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ExperimentId parse(final String hex) {
        if (hex == null) {
            throw new InvalidExperimentIdException("experiment id must not be null");
        }
        if (hex.length() != LENGTH_BYTES * 2) {
            throw new InvalidExperimentIdException(
                    "experiment id must be " + LENGTH_BYTES * 2 + " hex characters, got " + hex.length() + ": '" + hex + "'");
        }
        final byte[] decoded;
        try {
            decoded = HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new InvalidExperimentIdException("experiment id is not valid hex: " + hex, e);
        }
        if (decoded.length != LENGTH_BYTES) {
            throw new InvalidExperimentIdException(
                    "experiment id must be " + LENGTH_BYTES + " bytes, got " + decoded.length + ": " + hex);
        }
        return new ExperimentId(decoded);
    }

    public static ExperimentId fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH_BYTES) {
            throw new InvalidExperimentIdException("experiment id must be " + LENGTH_BYTES + " bytes");
        }
        return new ExperimentId(bytes.clone());
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    @JsonValue
    public String hex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExperimentId other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return hex();
    }
}
