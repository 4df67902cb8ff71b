package org.dimacs.support;

import java.util.Objects;

/**
 * LETTERALE - Riferimento con segno a una variabile
 *
 * Costruito a partire da un intero con segno nel formato DIMACS: il valore
 * assoluto è l'indice della variabile, il segno ne seleziona la polarità.
 * Lo zero non è mai un letterale valido (in DIMACS termina le clausole).
 *
 * ESEMPI:
 * • 3  -> (var 3, POSITIVE)
 * • -7 -> (var 7, NEGATIVE)
 */
public final class Lit {

    private final Var var;
    private final Sign sign;

    /**
     * @param var variabile referenziata (non null)
     * @param sign polarità (non null)
     */
    public Lit(Var var, Sign sign) {
        this.var = Objects.requireNonNull(var, "Variabile non può essere null");
        this.sign = Objects.requireNonNull(sign, "Segno non può essere null");
    }

    /**
     * Costruisce il letterale corrispondente a un valore DIMACS con segno.
     *
     * @param value valore con segno (!= 0, != Long.MIN_VALUE)
     * @return letterale con variabile |value| e segno di value
     * @throws IllegalArgumentException se value è zero o non rappresentabile
     */
    public static Lit fromLong(long value) {
        if (value == 0) {
            throw new IllegalArgumentException("Lo zero non è un letterale valido");
        }
        if (value == Long.MIN_VALUE) {
            throw new IllegalArgumentException("Letterale fuori intervallo: " + value);
        }
        return value > 0
                ? new Lit(new Var(value), Sign.POSITIVE)
                : new Lit(new Var(-value), Sign.NEGATIVE);
    }

    /**
     * @return valore DIMACS con segno del letterale
     */
    public long toLong() {
        return sign == Sign.POSITIVE ? var.getIndex() : -var.getIndex();
    }

    public Var getVar() {
        return var;
    }

    public Sign getSign() {
        return sign;
    }

    public boolean isPositive() {
        return sign == Sign.POSITIVE;
    }

    /**
     * @return letterale con la stessa variabile e polarità opposta
     */
    public Lit negate() {
        return new Lit(var, sign.negate());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Lit other = (Lit) obj;
        return var.equals(other.var) && sign == other.sign;
    }

    @Override
    public int hashCode() {
        return Objects.hash(var, sign);
    }

    /**
     * Rappresentazione DIMACS: l'indice, preceduto da '-' se negativo.
     */
    @Override
    public String toString() {
        return Long.toString(toLong());
    }
}
