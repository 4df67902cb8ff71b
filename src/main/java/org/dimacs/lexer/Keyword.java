package org.dimacs.lexer;

/**
 * Parole chiave riconosciute dal lexer, con la loro grafia esatta (minuscola).
 */
public enum Keyword {
    /** Inizio della riga del problema */
    PROBLEM("p"),
    /** Operatore xor nelle formule satx / satex */
    XOR("xor"),
    /** Problema in forma normale congiuntiva */
    CNF("cnf"),
    /** Problema sat senza estensioni */
    SAT("sat"),
    /** Problema sat con estensione XOR */
    SATX("satx"),
    /** Problema sat con estensione EQ */
    SATE("sate"),
    /** Problema sat con estensioni EQ e XOR */
    SATEX("satex");

    /** Lunghezza massima di una parola chiave */
    public static final int MAX_LENGTH = 5;

    private final String spelling;

    Keyword(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }

    /**
     * @param text grafia da cercare
     * @return la parola chiave corrispondente, oppure null se sconosciuta
     */
    public static Keyword fromSpelling(CharSequence text) {
        for (Keyword keyword : values()) {
            if (keyword.spelling.contentEquals(text)) {
                return keyword;
            }
        }
        return null;
    }
}
