package org.dimacs.lexer;

/**
 * Posizione (riga, colonna) all'interno del testo DIMACS.
 *
 * Le righe partono da 1. La colonna di un carattere è il valore raggiunto
 * dopo averlo consumato: il primo carattere di una riga ha colonna 1, mentre
 * il terminatore di riga porta la posizione a (riga + 1, 0).
 */
public final class Location {

    /** Posizione iniziale dello stream, prima di qualsiasi carattere */
    public static final Location START = new Location(1, 0);

    /** Posizione fittizia usata prima che il parser abbia letto un token */
    public static final Location NOWHERE = new Location(0, 0);

    private final int line;
    private final int column;

    public Location(int line, int column) {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Posizione non valida: " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return posizione all'inizio della riga successiva
     */
    public Location nextLine() {
        return new Location(line + 1, 0);
    }

    /**
     * @return posizione sulla colonna successiva della stessa riga
     */
    public Location nextColumn() {
        return new Location(line, column + 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Location other = (Location) obj;
        return line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return 31 * line + column;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
