package org.dimacs.lexer;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.IntStream;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LEXER DIMACS - Trasforma uno stream di caratteri in token posizionati
 *
 * Legge lo stream un carattere alla volta tenendo un solo carattere di
 * lookahead ({@code peek}), già consumato dallo stream sottostante.
 *
 * DISPATCH SUL LOOKAHEAD:
 * • lettera ASCII -> parola chiave (max 5 caratteri), 'c' apre un commento
 * • 1-9           -> numero naturale (NAT)
 * • 0             -> ZERO (nessun numero inizia con 0: "01" sono ZERO e NAT(1))
 * • ( ) + - * =   -> simbolo singolo
 * • altro         -> INVALID_TOKEN_START, carattere scartato
 *
 * Gli errori lessicali sono lanciati come {@link ParseError} con la posizione
 * di inizio del token; il lexer resta utilizzabile e la chiamata successiva
 * riprende dal carattere seguente.
 */
public class Lexer implements TokenSource {

    private static final Logger LOGGER = Logger.getLogger(Lexer.class.getName());

    private static final int EOF = IntStream.EOF;

    //region STATO

    private final CharStream input;

    /** Buffer riutilizzato per la scansione delle parole chiave */
    private final StringBuilder buffer = new StringBuilder(Keyword.MAX_LENGTH);

    /** Posizione corrente nello stream (del carattere in peek) */
    private final LocationTracker tracker = new LocationTracker();

    /** Carattere corrente su cui si fa dispatch, EOF a fine input */
    private int peek;

    /** Posizione di inizio del token in scansione */
    private Location tokenStart = Location.START;

    //endregion

    /**
     * @param input stream di caratteri, letto solo in avanti
     */
    public Lexer(CharStream input) {
        this.input = Objects.requireNonNull(input, "Stream di input non può essere null");
        bump();
    }

    /**
     * Lexer su un testo in memoria.
     */
    public static Lexer fromString(String text) {
        return new Lexer(CharStreams.fromString(text));
    }

    //region INTERFACCIA PUBBLICA

    @Override
    public Token nextToken() {
        skipWhitespace();
        if (peek == EOF) {
            return null;
        }
        tokenStart = tracker.current();

        Token token = dispatch();
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Token letto: " + token);
        }
        return token;
    }

    //endregion

    //region DISPATCH E SCANSIONE

    private Token dispatch() {
        if (isAsciiLetter(peek)) {
            return scanKeyword();
        }
        if (peek >= '1' && peek <= '9') {
            return scanNat();
        }
        return switch (peek) {
            case '0' -> bumpToken(TokenKind.ZERO);
            case '(' -> bumpToken(TokenKind.OPEN);
            case ')' -> bumpToken(TokenKind.CLOSE);
            case '+' -> bumpToken(TokenKind.PLUS);
            case '*' -> bumpToken(TokenKind.STAR);
            case '=' -> bumpToken(TokenKind.EQ);
            case '-' -> bumpToken(TokenKind.MINUS);
            default -> {
                bump();
                throw error(ErrorKind.INVALID_TOKEN_START);
            }
        };
    }

    /**
     * Accumula al più {@link Keyword#MAX_LENGTH} caratteri alfanumerici. Una
     * sequenza più lunga o sconosciuta viene consumata per intero prima di
     * segnalare l'errore.
     */
    private Token scanKeyword() {
        buffer.setLength(0);
        buffer.appendCodePoint(peek);
        while (isAsciiAlphanumeric(bump())) {
            if (buffer.length() < Keyword.MAX_LENGTH) {
                buffer.appendCodePoint(peek);
            } else {
                return unknownKeyword();
            }
        }

        if (buffer.length() == 1 && buffer.charAt(0) == 'c') {
            return scanComment();
        }

        Keyword keyword = Keyword.fromSpelling(buffer);
        if (keyword == null) {
            throw error(ErrorKind.UNKNOWN_KEYWORD);
        }
        return Token.ident(tokenStart, keyword);
    }

    private Token unknownKeyword() {
        while (isAsciiAlphanumeric(bump())) {
            // scarta il resto della parola
        }
        throw error(ErrorKind.UNKNOWN_KEYWORD);
    }

    /**
     * Il commento termina prima del fine riga, che resta come lookahead.
     */
    private Token scanComment() {
        while (peek != '\n' && peek != EOF) {
            bump();
        }
        return Token.of(tokenStart, TokenKind.COMMENT);
    }

    /**
     * Accumulo decimale da sinistra a destra. Un valore oltre Long.MAX_VALUE
     * consuma comunque tutte le cifre e produce NUMBER_OVERFLOW.
     */
    private Token scanNat() {
        long value = peek - '0';
        boolean overflow = false;
        while (isAsciiDigit(bump())) {
            int digit = peek - '0';
            if (overflow || value > (Long.MAX_VALUE - digit) / 10) {
                overflow = true;
            } else {
                value = value * 10 + digit;
            }
        }
        if (overflow) {
            throw error(ErrorKind.NUMBER_OVERFLOW);
        }
        return Token.nat(tokenStart, value);
    }

    private void skipWhitespace() {
        while (isAsciiWhitespace(peek)) {
            bump();
        }
    }

    //endregion

    //region SUPPORTO

    /**
     * Consuma il prossimo carattere dello stream rendendolo il nuovo lookahead.
     * A fine input il lookahead diventa EOF e la posizione non cambia.
     */
    private int bump() {
        int next = input.LA(1);
        if (next == EOF) {
            peek = EOF;
            return peek;
        }
        input.consume();
        tracker.bump(next);
        peek = next;
        return peek;
    }

    private Token bumpToken(TokenKind kind) {
        bump();
        return Token.of(tokenStart, kind);
    }

    private ParseError error(ErrorKind kind) {
        LOGGER.fine("Errore lessicale " + kind + " in " + tokenStart);
        return new ParseError(tokenStart, kind);
    }

    private static boolean isAsciiLetter(int unit) {
        return (unit >= 'a' && unit <= 'z') || (unit >= 'A' && unit <= 'Z');
    }

    private static boolean isAsciiDigit(int unit) {
        return unit >= '0' && unit <= '9';
    }

    private static boolean isAsciiAlphanumeric(int unit) {
        return isAsciiLetter(unit) || isAsciiDigit(unit);
    }

    private static boolean isAsciiWhitespace(int unit) {
        return unit == ' ' || unit == '\t' || unit == '\n' || unit == '\f' || unit == '\r';
    }

    //endregion
}
