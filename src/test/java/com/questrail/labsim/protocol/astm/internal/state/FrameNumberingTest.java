package com.questrail.labsim.protocol.astm.internal.state;

import org.junit.jupiter.api.Test;

import static com.questrail.labsim.protocol.astm.internal.state.FrameNumbering.Classification.DUPLICATE;
import static com.questrail.labsim.protocol.astm.internal.state.FrameNumbering.Classification.NEW;
import static com.questrail.labsim.protocol.astm.internal.state.FrameNumbering.Classification.OUT_OF_SEQUENCE;
import static org.junit.jupiter.api.Assertions.*;

final class FrameNumberingTest
{
    @Test
    void nextCyclesOneThroughSeven()
    {
        assertEquals(1, FrameNumbering.next(FrameNumbering.UNSET));
        assertEquals(2, FrameNumbering.next(1));
        assertEquals(7, FrameNumbering.next(6));
        assertEquals(1, FrameNumbering.next(7));
    }

    @Test
    void anyNumberStartsATransfer()
    {
        for (int n = 1; n <= 7; n++) {
            assertEquals(NEW, FrameNumbering.classify(FrameNumbering.UNSET, n));
        }
    }

    @Test
    void successorIsNewAndSameNumberIsDuplicate()
    {
        for (int last = 1; last <= 7; last++) {
            assertEquals(NEW, FrameNumbering.classify(last, FrameNumbering.next(last)));
            assertEquals(DUPLICATE, FrameNumbering.classify(last, last));
        }
    }

    @Test
    void everythingElseIsOutOfSequence()
    {
        for (int last = 1; last <= 7; last++) {
            for (int received = 1; received <= 7; received++) {
                if (received != last && received != FrameNumbering.next(last)) {
                    assertEquals(OUT_OF_SEQUENCE, FrameNumbering.classify(last, received),
                            "last=" + last + " received=" + received);
                }
            }
        }
        assertEquals(OUT_OF_SEQUENCE, FrameNumbering.classify(3, 0));
        assertEquals(OUT_OF_SEQUENCE, FrameNumbering.classify(3, 8));
    }
}
