package org.dimacs.lexer;

import java.util.Objects;

/**
 * TOKEN - Unità lessicale con la posizione del suo primo carattere
 *
 * I token NAT portano il loro valore numerico, i token IDENT la parola
 * chiave riconosciuta. Immutabile.
 */
public final class Token {

    private final Location location;
    private final TokenKind kind;
    private final long value;
    private final Keyword keyword;

    private Token(Location location, TokenKind kind, long value, Keyword keyword) {
        this.location = Objects.requireNonNull(location, "Posizione non può essere null");
        this.kind = Objects.requireNonNull(kind, "Tipo token non può essere null");
        this.value = value;
        this.keyword = keyword;
    }

    /**
     * Token senza contenuto (simboli, ZERO, COMMENT, END_OF_FILE).
     *
     * @throws IllegalArgumentException per NAT e IDENT, che richiedono un contenuto
     */
    public static Token of(Location location, TokenKind kind) {
        if (kind == TokenKind.NAT || kind == TokenKind.IDENT) {
            throw new IllegalArgumentException("Il token " + kind + " richiede un contenuto");
        }
        return new Token(location, kind, 0, null);
    }

    public static Token nat(Location location, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Valore NAT deve essere > 0, ricevuto: " + value);
        }
        return new Token(location, TokenKind.NAT, value, null);
    }

    public static Token ident(Location location, Keyword keyword) {
        return new Token(location, TokenKind.IDENT, 0, Objects.requireNonNull(keyword));
    }

    public Location getLocation() {
        return location;
    }

    public TokenKind getKind() {
        return kind;
    }

    /**
     * @return valore del token NAT, 0 per gli altri
     */
    public long getValue() {
        return value;
    }

    /**
     * @return parola chiave del token IDENT, null per gli altri
     */
    public Keyword getKeyword() {
        return keyword;
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean is(Keyword expected) {
        return kind == TokenKind.IDENT && keyword == expected;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Token other = (Token) obj;
        return location.equals(other.location) &&
                kind == other.kind &&
                value == other.value &&
                keyword == other.keyword;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, kind, value, keyword);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NAT -> "NAT(" + value + ")@" + location;
            case IDENT -> "IDENT(" + keyword.getSpelling() + ")@" + location;
            default -> kind + "@" + location;
        };
    }
}
