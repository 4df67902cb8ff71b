package org.dimacs.lexer;

/**
 * Cursore riga/colonna avanzato un carattere alla volta dal lexer.
 */
public final class LocationTracker {

    private Location current = Location.START;

    public Location current() {
        return current;
    }

    /**
     * Avanza oltre un carattere appena consumato.
     *
     * @param unit carattere consumato (code point)
     * @return nuova posizione corrente
     */
    public Location bump(int unit) {
        current = unit == '\n' ? current.nextLine() : current.nextColumn();
        return current;
    }
}
