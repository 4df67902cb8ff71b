package org.dimacs.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FORMULA .SAT - Albero sintattico di una formula in notazione prefissa
 *
 * Ogni nodo possiede in modo esclusivo i propri figli: nessuna condivisione,
 * nessun ciclo. Tutti i nodi sono immutabili.
 *
 * TIPI DI NODO:
 * • LIT   - letterale, es. 3 oppure -3
 * • PAREN - formula tra parentesi, es. (f)
 * • NEG   - negazione di formula tra parentesi, es. -(f)
 * • OR    - disgiunzione, es. +(f g h)
 * • AND   - congiunzione, es. *(f g h)
 * • EQ    - equivalenza, es. =(f g)   (estensione EQ)
 * • XOR   - or esclusivo, es. xor(f g) (estensione XOR)
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    public enum Kind {
        LIT,
        PAREN,
        NEG,
        OR,
        AND,
        EQ,
        XOR
    }

    private final Kind kind;

    /** Letterale (solo per nodi LIT) */
    private final Lit lit;

    /** Figli: uno per PAREN e NEG, zero o più per gli operatori n-ari */
    private final List<Formula> children;

    //endregion

    //region COSTRUZIONE

    private Formula(Kind kind, Lit lit, List<Formula> children) {
        this.kind = kind;
        this.lit = lit;
        this.children = children;
    }

    public static Formula lit(Lit lit) {
        if (lit == null) {
            throw new IllegalArgumentException("Letterale non può essere null");
        }
        return new Formula(Kind.LIT, lit, List.of());
    }

    public static Formula paren(Formula inner) {
        return unary(Kind.PAREN, inner);
    }

    public static Formula neg(Formula inner) {
        return unary(Kind.NEG, inner);
    }

    public static Formula or(List<Formula> operands) {
        return nary(Kind.OR, operands);
    }

    public static Formula and(List<Formula> operands) {
        return nary(Kind.AND, operands);
    }

    public static Formula eq(List<Formula> operands) {
        return nary(Kind.EQ, operands);
    }

    public static Formula xor(List<Formula> operands) {
        return nary(Kind.XOR, operands);
    }

    private static Formula unary(Kind kind, Formula inner) {
        if (inner == null) {
            throw new IllegalArgumentException("Operando per " + kind + " non può essere null");
        }
        return new Formula(kind, null, List.of(inner));
    }

    /**
     * Gli operatori n-ari accettano anche liste vuote, es. "+()": la grammatica
     * prevede zero o più parametri.
     */
    private static Formula nary(Kind kind, List<Formula> operands) {
        if (operands == null) {
            throw new IllegalArgumentException("Lista operandi null per operatore " + kind);
        }
        if (operands.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Operandi null trovati per operatore " + kind);
        }
        return new Formula(kind, null, Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    //endregion

    //region ACCESSO

    public Kind getKind() {
        return kind;
    }

    /**
     * @return letterale del nodo
     * @throws IllegalStateException se il nodo non è di tipo LIT
     */
    public Lit getLit() {
        if (kind != Kind.LIT) {
            throw new IllegalStateException("Nodo " + kind + " non contiene un letterale");
        }
        return lit;
    }

    /**
     * @return vista immutabile dei figli (vuota per LIT)
     */
    public List<Formula> getChildren() {
        return children;
    }

    /**
     * @return unico figlio di un nodo PAREN o NEG
     * @throws IllegalStateException per gli altri tipi di nodo
     */
    public Formula getInner() {
        if (kind != Kind.PAREN && kind != Kind.NEG) {
            throw new IllegalStateException("Nodo " + kind + " non ha un singolo operando");
        }
        return children.get(0);
    }

    /**
     * Conta i nodi dell'albero, radice compresa.
     */
    public int countNodes() {
        int count = 1;
        for (Formula child : children) {
            count += child.countNodes();
        }
        return count;
    }

    //endregion

    //region UGUAGLIANZA E RAPPRESENTAZIONE

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return kind == other.kind && Objects.equals(lit, other.lit) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, lit, children);
    }

    /**
     * Rappresentazione nella sintassi .sat, rileggibile dal parser.
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }

    private void appendTo(StringBuilder out) {
        switch (kind) {
            case LIT -> out.append(lit);
            case PAREN -> {
                out.append('(');
                children.get(0).appendTo(out);
                out.append(')');
            }
            case NEG -> {
                out.append("-(");
                children.get(0).appendTo(out);
                out.append(')');
            }
            case OR -> appendParams(out, "+");
            case AND -> appendParams(out, "*");
            case EQ -> appendParams(out, "=");
            case XOR -> appendParams(out, "xor");
        }
    }

    private void appendParams(StringBuilder out, String operator) {
        out.append(operator).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) out.append(' ');
            children.get(i).appendTo(out);
        }
        out.append(')');
    }

    //endregion
}
