package org.dimacs.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ISTANZA DIMACS - Risultato tipizzato del parsing di un file .cnf o .sat
 *
 * Due varianti, distinte da {@link Kind}:
 * • CNF: numero di variabili dichiarate e lista ordinata di clausole
 * • SAT: numero di variabili dichiarate, estensioni attive e una formula
 *
 * Immutabile; le istanze sono create dal parser oppure dalle factory
 * {@link #cnf(long, List)} e {@link #sat(long, Set, Formula)}.
 */
public final class Instance {

    public enum Kind {
        CNF,
        SAT
    }

    private final Kind kind;
    private final long numVars;

    /** Clausole (solo CNF, lista vuota per SAT) */
    private final List<Clause> clauses;

    /** Estensioni (solo SAT, insieme vuoto per CNF) */
    private final Set<Extension> extensions;

    /** Formula (solo SAT, null per CNF) */
    private final Formula formula;

    private Instance(Kind kind, long numVars, List<Clause> clauses, Set<Extension> extensions, Formula formula) {
        if (numVars <= 0) {
            throw new IllegalArgumentException("Numero variabili deve essere > 0, ricevuto: " + numVars);
        }
        this.kind = kind;
        this.numVars = numVars;
        this.clauses = clauses;
        this.extensions = extensions;
        this.formula = formula;
    }

    /**
     * @param numVars numero di variabili dichiarate nell'header (> 0)
     * @param clauses clausole nell'ordine del file (non null, almeno una)
     */
    public static Instance cnf(long numVars, List<Clause> clauses) {
        if (clauses == null || clauses.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Lista clausole non valida");
        }
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("Un'istanza cnf richiede almeno una clausola");
        }
        return new Instance(Kind.CNF, numVars, Collections.unmodifiableList(new ArrayList<>(clauses)),
                Extensions.NONE, null);
    }

    /**
     * @param numVars numero di variabili dichiarate nell'header (> 0)
     * @param extensions estensioni attive (vedi {@link Extensions})
     * @param formula formula radice (non null)
     */
    public static Instance sat(long numVars, Set<Extension> extensions, Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        return new Instance(Kind.SAT, numVars, List.of(), Extensions.of(extensions), formula);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCnf() {
        return kind == Kind.CNF;
    }

    public boolean isSat() {
        return kind == Kind.SAT;
    }

    public long getNumVars() {
        return numVars;
    }

    public List<Clause> getClauses() {
        return clauses;
    }

    public int getNumClauses() {
        return clauses.size();
    }

    public Set<Extension> getExtensions() {
        return extensions;
    }

    /**
     * @return formula radice
     * @throws IllegalStateException per istanze CNF
     */
    public Formula getFormula() {
        if (kind != Kind.SAT) {
            throw new IllegalStateException("Le istanze CNF non hanno una formula");
        }
        return formula;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Instance other = (Instance) obj;
        return kind == other.kind &&
                numVars == other.numVars &&
                clauses.equals(other.clauses) &&
                extensions.equals(other.extensions) &&
                Objects.equals(formula, other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, numVars, clauses, extensions, formula);
    }

    /**
     * Testo DIMACS completo dell'istanza (header compreso), rileggibile dal parser.
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        switch (kind) {
            case CNF -> {
                out.append("p cnf ").append(numVars).append(' ').append(clauses.size()).append('\n');
                for (Clause clause : clauses) {
                    out.append(clause).append('\n');
                }
            }
            case SAT -> out.append("p ").append(Extensions.problemKeyword(extensions))
                    .append(' ').append(numVars).append('\n')
                    .append(formula).append('\n');
        }
        return out.toString();
    }
}
