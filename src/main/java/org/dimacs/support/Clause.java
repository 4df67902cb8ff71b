package org.dimacs.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * CLAUSOLA - Disgiunzione ordinata di letterali
 *
 * Conserva i letterali nell'ordine in cui compaiono nel file, duplicati
 * compresi: nessuna normalizzazione viene applicata in fase di parsing.
 * La clausola vuota è ammessa (rappresenta una contraddizione).
 */
public final class Clause implements Iterable<Lit> {

    private final List<Lit> lits;

    /**
     * @param lits letterali della clausola (non null, senza elementi null)
     * @throws IllegalArgumentException se la lista non è valida
     */
    public Clause(List<Lit> lits) {
        if (lits == null) {
            throw new IllegalArgumentException("Lista letterali non può essere null");
        }
        if (lits.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista letterali non può contenere elementi null");
        }
        this.lits = Collections.unmodifiableList(new ArrayList<>(lits));
    }

    /**
     * Costruisce una clausola da valori DIMACS con segno.
     *
     * @param values valori non nulli, es. {@code of(1, -2, 3)}
     * @return clausola con i letterali nello stesso ordine
     */
    public static Clause of(long... values) {
        List<Lit> lits = new ArrayList<>(values.length);
        for (long value : values) {
            lits.add(Lit.fromLong(value));
        }
        return new Clause(lits);
    }

    /**
     * @return vista immutabile dei letterali
     */
    public List<Lit> getLits() {
        return lits;
    }

    public int size() {
        return lits.size();
    }

    public boolean isEmpty() {
        return lits.isEmpty();
    }

    @Override
    public Iterator<Lit> iterator() {
        return lits.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return lits.equals(((Clause) obj).lits);
    }

    @Override
    public int hashCode() {
        return lits.hashCode();
    }

    /**
     * Riga DIMACS della clausola, terminata da " 0" (es. "1 -2 0").
     */
    @Override
    public String toString() {
        if (lits.isEmpty()) {
            return "0";
        }
        return lits.stream().map(Lit::toString).collect(Collectors.joining(" ")) + " 0";
    }
}
