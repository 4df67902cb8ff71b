package org.dimacs.support;

/**
 * Polarità di un letterale.
 */
public enum Sign {
    POSITIVE,
    NEGATIVE;

    /**
     * @return la polarità opposta
     */
    public Sign negate() {
        return this == POSITIVE ? NEGATIVE : POSITIVE;
    }
}
