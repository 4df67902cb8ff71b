package org.dimacs.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LitTest {

    @Test
    public void signFollowsValue() {
        Lit positive = Lit.fromLong(7);
        Lit negative = Lit.fromLong(-7);

        assertEquals(new Var(7), positive.getVar());
        assertEquals(Sign.POSITIVE, positive.getSign());
        assertTrue(positive.isPositive());
        assertFalse(negative.isPositive());
        assertEquals(new Var(7), negative.getVar());
        assertEquals(Sign.NEGATIVE, negative.getSign());
        assertEquals(-7, negative.toLong());
        assertEquals(negative, positive.negate());
        assertEquals("-7", negative.toString());
    }

    @Test
    public void zeroIsNotALiteral() {
        assertThrows(IllegalArgumentException.class, () -> Lit.fromLong(0));
        assertThrows(IllegalArgumentException.class, () -> Lit.fromLong(Long.MIN_VALUE));
        assertThrows(IllegalArgumentException.class, () -> new Var(0));
    }

    @Test
    public void extremeMagnitudes() {
        assertEquals(Long.MAX_VALUE, Lit.fromLong(Long.MAX_VALUE).getVar().getIndex());
        assertEquals(-Long.MAX_VALUE, Lit.fromLong(-Long.MAX_VALUE).toLong());
    }
}
