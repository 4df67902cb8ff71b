package org.dimacs.lexer;

import java.util.Objects;

/**
 * ERRORE DI PARSING - Coppia (posizione, tipo) restituita al chiamante
 *
 * Eccezione non controllata: attraversa il lexer (un {@link TokenSource})
 * e interrompe il parsing al primo errore. Due errori sono uguali se hanno
 * stessa posizione e stesso tipo.
 */
public class ParseError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Location location;
    private final ErrorKind kind;

    public ParseError(Location location, ErrorKind kind) {
        super(kind.getDescription() + " alla riga " + location.getLine() + ", colonna " + location.getColumn());
        this.location = Objects.requireNonNull(location);
        this.kind = kind;
    }

    public Location getLocation() {
        return location;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ParseError other = (ParseError) obj;
        return location.equals(other.location) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, kind);
    }
}
