package com.adforge.core.scene;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DurationClassTest {

    @Test
    @DisplayName("snaps to the nearest allowed class")
    void snapsToNearest() {
        assertEquals(DurationClass.TEN, DurationClass.nearest(8.0));
        assertEquals(DurationClass.TEN, DurationClass.nearest(12.0));
        assertEquals(DurationClass.FIFTEEN, DurationClass.nearest(13.0));
        assertEquals(DurationClass.FIFTEEN, DurationClass.nearest(30.0));
    }

    @Test
    @DisplayName("a tie goes to the shorter class")
    void tieGoesShorter() {
        assertEquals(DurationClass.TEN, DurationClass.nearest(12.5));
    }

    @Test
    @DisplayName("missing or non-positive durations use the default")
    void defaults() {
        assertEquals(DurationClass.DEFAULT, DurationClass.nearest(null));
        assertEquals(DurationClass.DEFAULT, DurationClass.nearest(0.0));
        assertEquals(DurationClass.DEFAULT, DurationClass.nearest(-3.0));
        assertEquals(10, DurationClass.DEFAULT.seconds());
    }
}
