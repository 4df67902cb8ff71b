package org.dimacs.lexer;

/**
 * Categorie di token del formato DIMACS.
 */
public enum TokenKind {
    /** Un'intera riga di commento 'c ...' (contenuto scartato) */
    COMMENT,
    /** Intero positivo non nullo, es. 42 */
    NAT,
    /** La cifra 0, terminatore di clausola */
    ZERO,
    /** '+', disgiunzione */
    PLUS,
    /** '-', negazione di letterali e formule */
    MINUS,
    /** '*', congiunzione */
    STAR,
    /** '=', equivalenza */
    EQ,
    /** '(' */
    OPEN,
    /** ')' */
    CLOSE,
    /** Parola chiave nota, es. p, cnf, sat, xor */
    IDENT,
    /** Fine dell'input (mai prodotto dal lexer, usato dal parser come lookahead finale) */
    END_OF_FILE;

    /**
     * @return true se il token ha significato grammaticale (tutto tranne i commenti)
     */
    public boolean isRelevant() {
        return this != COMMENT;
    }
}
