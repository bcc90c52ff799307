package com.finsight.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DirectionTest {

    @Test
    void classifyShouldUseAbsoluteDeadband() {
        assertEquals(Direction.UP, Direction.classify(1.2, 0.5));
        assertEquals(Direction.DOWN, Direction.classify(-0.8, 0.5));
        assertEquals(Direction.FLAT, Direction.classify(0.49, 0.5));
        assertEquals(Direction.FLAT, Direction.classify(-0.2, 0.5));
    }

    @Test
    void deltaEqualToDeadbandShouldNotBeFlat() {
        assertEquals(Direction.UP, Direction.classify(0.5, 0.5));
        assertEquals(Direction.DOWN, Direction.classify(-0.5, 0.5));
    }

    @Test
    void zeroDeadbandShouldNeverBeFlat() {
        assertEquals(Direction.UP, Direction.classify(0.0001, 0.0));
        assertEquals(Direction.DOWN, Direction.classify(0.0, 0.0));
    }
}
