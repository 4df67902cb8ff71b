package org.dimacs.parser;

import org.antlr.v4.runtime.CharStream;
import org.dimacs.lexer.ErrorKind;
import org.dimacs.lexer.Keyword;
import org.dimacs.lexer.Location;
import org.dimacs.lexer.ParseError;
import org.dimacs.lexer.Token;
import org.dimacs.lexer.TokenKind;
import org.dimacs.lexer.TokenSource;
import org.dimacs.lexer.ValidLexer;
import org.dimacs.support.Clause;
import org.dimacs.support.Extension;
import org.dimacs.support.Extensions;
import org.dimacs.support.Formula;
import org.dimacs.support.Instance;
import org.dimacs.support.Lit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * PARSER DIMACS - Discesa ricorsiva su un token di lookahead
 *
 * Consuma la sequenza filtrata prodotta da {@link ValidLexer} e costruisce
 * un'{@link Instance} validata. Il parsing si interrompe al primo errore,
 * senza recupero e senza risultati parziali.
 *
 * GRAMMATICA:
 * <pre>
 * dimacs   := header
 * header   := 'p' ( cnf_hdr | sat_hdr )
 * cnf_hdr  := 'cnf' NAT NAT clause{num_clauses}
 * clause   := lit* '0'
 * lit      := NAT | '-' NAT
 * sat_hdr  := sat_kw NAT formula
 * sat_kw   := 'sat' | 'sate' | 'satx' | 'satex'
 * formula  := NAT | '(' formula ')' | '+' params | '*' params
 *           | '=' params | 'xor' params | '-' ( '(' formula ')' | NAT )
 * params   := '(' formula* ')'
 * </pre>
 *
 * Dopo l'istanza è ammessa solo la fine dell'input.
 *
 * Un parser esegue un solo parsing: lo stream sottostante è consumato una
 * volta sola, in avanti.
 */
public class DimacsParser {

    private static final Logger LOGGER = Logger.getLogger(DimacsParser.class.getName());

    /** Limite alla capacità iniziale della lista clausole, indipendente dall'header */
    private static final int MAX_INITIAL_CLAUSE_CAPACITY = 1 << 16;

    //region STATO

    private final TokenSource tokens;

    /** Token di lookahead, null se il lookahead è un errore */
    private Token peek;

    /** Errore di lookahead, null se il lookahead è un token */
    private ParseError peekError = new ParseError(Location.NOWHERE, ErrorKind.EMPTY_TOKEN_STREAM);

    /** Indice di variabile più alto incontrato, per il controllo sull'header */
    private long maxVarSeen;

    //endregion

    /**
     * @param tokens sorgente di token già filtrata dai commenti
     */
    public DimacsParser(TokenSource tokens) {
        this.tokens = Objects.requireNonNull(tokens, "Sorgente token non può essere null");
    }

    public DimacsParser(CharStream input) {
        this(new ValidLexer(input));
    }

    //region PUNTO DI INGRESSO

    /**
     * Esegue il parsing completo dell'input.
     *
     * @return istanza CNF o SAT
     * @throws ParseError al primo errore lessicale o strutturale
     */
    public Instance parseDimacs() {
        LOGGER.fine("Inizio parsing DIMACS");

        consume();
        Instance instance = parseHeader();
        expectEndOfInput(instance);

        if (maxVarSeen > instance.getNumVars()) {
            LOGGER.warning("Variabile " + maxVarSeen + " oltre il numero dichiarato nell'header ("
                    + instance.getNumVars() + ")");
        }
        LOGGER.fine("Parsing completato: istanza " + instance.getKind()
                + " con " + instance.getNumVars() + " variabili");
        return instance;
    }

    //endregion

    //region HEADER

    private Instance parseHeader() {
        expect(Keyword.PROBLEM);
        Token token = current();
        if (!token.is(TokenKind.IDENT)) {
            throw unexpected(token);
        }
        return switch (token.getKeyword()) {
            case CNF -> parseCnfHeader();
            case SAT, SATE, SATX, SATEX -> parseSatHeader();
            case PROBLEM, XOR -> throw unexpected(token);
        };
    }

    private Instance parseCnfHeader() {
        expect(Keyword.CNF);
        long numVars = readNat();
        long numClauses = readNat();
        LOGGER.fine("Header cnf: " + numVars + " variabili, " + numClauses + " clausole");

        return Instance.cnf(numVars, parseClauses(numClauses));
    }

    private Instance parseSatHeader() {
        Set<Extension> extensions = parseSatExtensions();
        long numVars = readNat();
        LOGGER.fine("Header " + Extensions.problemKeyword(extensions) + ": " + numVars + " variabili");

        return Instance.sat(numVars, extensions, parseFormula());
    }

    private Set<Extension> parseSatExtensions() {
        Token token = current();
        Set<Extension> extensions = null;
        if (token.is(TokenKind.IDENT)) {
            extensions = switch (token.getKeyword()) {
                case SAT -> Extensions.NONE;
                case SATE -> Extensions.EQ;
                case SATX -> Extensions.XOR;
                case SATEX -> Extensions.EQ_XOR;
                case PROBLEM, XOR, CNF -> null;
            };
        }
        if (extensions == null) {
            throw new ParseError(token.getLocation(), ErrorKind.INVALID_SAT_EXTENSION);
        }
        consume();
        return extensions;
    }

    //endregion

    //region CLAUSOLE CNF

    private List<Clause> parseClauses(long numClauses) {
        List<Clause> clauses = new ArrayList<>((int) Math.min(numClauses, MAX_INITIAL_CLAUSE_CAPACITY));
        for (long i = 0; i < numClauses; i++) {
            clauses.add(parseClause());
        }
        return clauses;
    }

    /**
     * Letterali fino al terminatore ZERO, che viene consumato.
     */
    private Clause parseClause() {
        List<Lit> lits = new ArrayList<>();
        while (!current().is(TokenKind.ZERO)) {
            lits.add(parseLit());
        }
        consume();
        return new Clause(lits);
    }

    private Lit parseLit() {
        Token token = current();
        return switch (token.getKind()) {
            case NAT -> {
                consume();
                yield lit(token.getValue());
            }
            case MINUS -> {
                consume();
                yield lit(-readNat());
            }
            default -> throw unexpected(token);
        };
    }

    //endregion

    //region FORMULE SAT

    private Formula parseFormula() {
        Token token = current();
        return switch (token.getKind()) {
            case NAT -> {
                consume();
                yield Formula.lit(lit(token.getValue()));
            }
            case OPEN -> parseParenFormula();
            case PLUS -> {
                expect(TokenKind.PLUS);
                yield Formula.or(parseFormulaParams());
            }
            case STAR -> {
                expect(TokenKind.STAR);
                yield Formula.and(parseFormulaParams());
            }
            case EQ -> {
                expect(TokenKind.EQ);
                yield Formula.eq(parseFormulaParams());
            }
            case MINUS -> parseNegFormula();
            case IDENT -> {
                if (!token.is(Keyword.XOR)) {
                    throw unexpected(token);
                }
                expect(Keyword.XOR);
                yield Formula.xor(parseFormulaParams());
            }
            default -> throw unexpected(token);
        };
    }

    private Formula parseParenFormula() {
        expect(TokenKind.OPEN);
        Formula formula = Formula.paren(parseFormula());
        expect(TokenKind.CLOSE);
        return formula;
    }

    /**
     * '-' seguito da '(' nega una sottoformula, seguito da NAT produce un
     * letterale negativo.
     */
    private Formula parseNegFormula() {
        expect(TokenKind.MINUS);
        Token token = current();
        return switch (token.getKind()) {
            case OPEN -> {
                expect(TokenKind.OPEN);
                Formula formula = Formula.neg(parseFormula());
                expect(TokenKind.CLOSE);
                yield formula;
            }
            case NAT -> {
                consume();
                yield Formula.lit(lit(-token.getValue()));
            }
            default -> throw unexpected(token);
        };
    }

    private List<Formula> parseFormulaParams() {
        expect(TokenKind.OPEN);
        List<Formula> params = new ArrayList<>();
        while (!current().is(TokenKind.CLOSE)) {
            params.add(parseFormula());
        }
        expect(TokenKind.CLOSE);
        return params;
    }

    //endregion

    //region FINE INPUT

    private void expectEndOfInput(Instance instance) {
        if (peek == null) {
            throw peekError;
        }
        if (peek.is(TokenKind.END_OF_FILE)) {
            return;
        }
        if (instance.isCnf() && (peek.is(TokenKind.NAT) || peek.is(TokenKind.MINUS) || peek.is(TokenKind.ZERO))) {
            throw new ParseError(peek.getLocation(), ErrorKind.CLAUSE_COUNT_MISMATCH);
        }
        throw unexpected(peek);
    }

    //endregion

    //region PRIMITIVE SUL LOOKAHEAD

    /**
     * Avanza il lookahead. Un errore lessicale resta in attesa finché il
     * lookahead non viene ispezionato; a fine input il lookahead diventa un
     * token END_OF_FILE sull'ultima posizione nota.
     */
    private void consume() {
        Location last = peekLocation();
        try {
            Token next = tokens.nextToken();
            peek = next != null ? next : Token.of(last, TokenKind.END_OF_FILE);
            peekError = null;
        } catch (ParseError e) {
            peek = null;
            peekError = e;
        }
    }

    /**
     * @return il token di lookahead
     * @throws ParseError se il lookahead è un errore o la fine dell'input
     */
    private Token current() {
        if (peek == null) {
            throw peekError;
        }
        if (peek.is(TokenKind.END_OF_FILE)) {
            throw new ParseError(peek.getLocation(), ErrorKind.UNEXPECTED_END_OF_FILE);
        }
        return peek;
    }

    private Location peekLocation() {
        return peek != null ? peek.getLocation() : peekError.getLocation();
    }

    private Token expect(TokenKind kind) {
        Token token = current();
        if (!token.is(kind)) {
            throw unexpected(token);
        }
        consume();
        return token;
    }

    private Token expect(Keyword keyword) {
        Token token = current();
        if (!token.is(keyword)) {
            throw unexpected(token);
        }
        consume();
        return token;
    }

    /**
     * Valore del lookahead NAT, senza consumarlo.
     */
    private long expectNat() {
        Token token = current();
        if (!token.is(TokenKind.NAT)) {
            throw unexpected(token);
        }
        return token.getValue();
    }

    private long readNat() {
        long value = expectNat();
        consume();
        return value;
    }

    private Lit lit(long value) {
        maxVarSeen = Math.max(maxVarSeen, Math.abs(value));
        return Lit.fromLong(value);
    }

    private ParseError unexpected(Token token) {
        return new ParseError(token.getLocation(), ErrorKind.UNEXPECTED_TOKEN);
    }

    //endregion
}
