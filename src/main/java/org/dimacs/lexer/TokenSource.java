package org.dimacs.lexer;

/**
 * Sequenza pigra, finita e non riavviabile di token.
 *
 * Ogni chiamata a {@link #nextToken()} produce esattamente un elemento: un
 * token, oppure un {@link ParseError} lanciato. Un errore non chiude la
 * sequenza: la chiamata successiva riprende dopo l'input che lo ha causato.
 */
public interface TokenSource {

    /**
     * @return il prossimo token, oppure null quando l'input è esaurito
     * @throws ParseError se il prossimo elemento della sequenza è un errore
     */
    Token nextToken();
}
