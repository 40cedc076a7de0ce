package com.hmmlab.server.hmm;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingSetTest {

    @Test
    void testValidSetIsCopied() {
        int[] seq = { 0, 1, 2 };
        TrainingSet set = TrainingSet.of(3, seq, new int[] { 2 });
        seq[0] = 2;

        assertEquals(2, set.size());
        assertEquals(4, set.totalLength());
        assertEquals(0, set.get(0)[0]);
    }

    @Test
    void testSymbolOutOfRangeNamesPosition() {
        HmmValidationException e = assertThrows(HmmValidationException.class,
                () -> TrainingSet.of(2, new int[] { 0, 1 }, new int[] { 1, 2 }));
        assertEquals("Symbol index 2 at position 1 of sequence 1 outside [0, 2)", e.getMessage());

        assertThrows(HmmValidationException.class, () -> TrainingSet.of(2, new int[] { -1 }));
    }

    @Test
    void testEmptyInputsRejected() {
        assertThrows(HmmValidationException.class, () -> new TrainingSet(2, new ArrayList<>()));
        assertThrows(HmmValidationException.class, () -> TrainingSet.of(2, new int[0]));
        assertThrows(HmmValidationException.class, () -> TrainingSet.of(0, new int[] { 0 }));

        List<int[]> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(HmmValidationException.class, () -> new TrainingSet(2, withNull));
    }
}
