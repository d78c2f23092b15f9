package dev.traininglog.core.model;

import dev.traininglog.core.InvalidExperimentIdException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentIdTest {

    @Test
    void randomIdsAreTwelveBytesOfHex() {
        final ExperimentId id = ExperimentId.random();

        assertEquals(24, id.hex().length());
        assertEquals(12, id.bytes().length);
        assertTrue(id.hex().matches("[0-9a-f]{24}"));
    }

    @Test
    void randomIdsDiffer() {
        assertNotEquals(ExperimentId.random(), ExperimentId.random());
    }

    @Test
    void parseRoundTripsHex() {
        final ExperimentId id = ExperimentId.parse("5f1b2c3d4e5f60718293a4b5");

        assertEquals("5f1b2c3d4e5f60718293a4b5", id.hex());
        assertEquals(id, ExperimentId.parse("5F1B2C3D4E5F60718293A4B5"));
        assertEquals(id, ExperimentId.fromBytes(id.bytes()));
    }

    @Test
    void wrongLengthIsRejected() {
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse("5f1b2c3d"));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse("5f1b2c3d4e5f60718293a4b5ff"));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse(""));
    }

    @Test
    void nonHexIsRejected() {
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse("zz1b2c3d4e5f60718293a4b5"));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse("5f1b2c3d4e5f60718293a4b"));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse(null));
    }

    @Test
    void surroundingWhitespaceIsRejected() {
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse(" 5f1b2c3d4e5f60718293a4b5 "));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse("5f1b2c3d4e5f60718293a4b5\n"));
        assertThrows(InvalidExperimentIdException.class, () -> ExperimentId.parse(" 5f1b2c3d4e5f60718293a4 "));
    }
}
