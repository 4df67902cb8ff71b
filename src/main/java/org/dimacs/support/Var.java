package org.dimacs.support;

/**
 * VARIABILE PROPOSIZIONALE - Indice numerico di una variabile DIMACS
 *
 * Le variabili sono identificate da interi strettamente positivi, esattamente
 * come compaiono nel file sorgente. Immutabile.
 */
public final class Var {

    /** Indice della variabile (sempre > 0) */
    private final long index;

    /**
     * @param index indice della variabile (> 0)
     * @throws IllegalArgumentException se l'indice non è positivo
     */
    public Var(long index) {
        if (index <= 0) {
            throw new IllegalArgumentException("Indice variabile deve essere > 0, ricevuto: " + index);
        }
        this.index = index;
    }

    /**
     * @return indice numerico della variabile
     */
    public long getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return index == ((Var) obj).index;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(index);
    }

    @Override
    public String toString() {
        return Long.toString(index);
    }
}
