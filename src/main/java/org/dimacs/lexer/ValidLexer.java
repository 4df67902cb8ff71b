package org.dimacs.lexer;

import org.antlr.v4.runtime.CharStream;

import java.util.Objects;

/**
 * Filtro sul {@link Lexer} che scarta i token privi di significato
 * grammaticale (i commenti). Gli errori passano invariati.
 */
public class ValidLexer implements TokenSource {

    private final TokenSource input;

    public ValidLexer(TokenSource input) {
        this.input = Objects.requireNonNull(input, "Sorgente token non può essere null");
    }

    public ValidLexer(CharStream input) {
        this(new Lexer(input));
    }

    @Override
    public Token nextToken() {
        Token token = input.nextToken();
        while (token != null && !token.getKind().isRelevant()) {
            token = input.nextToken();
        }
        return token;
    }
}
