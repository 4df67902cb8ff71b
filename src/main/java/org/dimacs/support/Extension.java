package org.dimacs.support;

/**
 * Estensioni opzionali del formato .sat.
 *
 * @see Extensions
 */
public enum Extension {
    /** Operatore di equivalenza '=' (problemi sate, satex) */
    EQ,
    /** Operatore 'xor' (problemi satx, satex) */
    XOR
}
