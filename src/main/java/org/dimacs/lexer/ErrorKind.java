package org.dimacs.lexer;

/**
 * Tipologie di errore di parsing.
 *
 * Errori lessicali: UNKNOWN_KEYWORD, INVALID_TOKEN_START, NUMBER_OVERFLOW.
 * Errori strutturali: tutti gli altri.
 */
public enum ErrorKind {
    UNKNOWN_KEYWORD("Parola chiave sconosciuta"),
    INVALID_TOKEN_START("Carattere non valido come inizio di token"),
    NUMBER_OVERFLOW("Numero troppo grande"),
    UNEXPECTED_END_OF_FILE("Fine inattesa dell'input"),
    UNEXPECTED_TOKEN("Token inatteso"),
    EMPTY_TOKEN_STREAM("Nessun token letto"),
    INVALID_SAT_EXTENSION("Estensione sat non valida"),
    CLAUSE_COUNT_MISMATCH("Numero di clausole diverso da quello dichiarato");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isLexical() {
        return this == UNKNOWN_KEYWORD || this == INVALID_TOKEN_START || this == NUMBER_OVERFLOW;
    }
}
