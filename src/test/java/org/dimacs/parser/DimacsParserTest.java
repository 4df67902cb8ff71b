package org.dimacs.parser;

import org.dimacs.lexer.ErrorKind;
import org.dimacs.lexer.Location;
import org.dimacs.lexer.ParseError;
import org.dimacs.support.Clause;
import org.dimacs.support.Extensions;
import org.dimacs.support.Formula;
import org.dimacs.support.Instance;
import org.dimacs.support.Lit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.dimacs.parser.Dimacs.parseDimacs;
import static org.junit.jupiter.api.Assertions.*;

public class DimacsParserTest {

    private static Formula lit(long value) {
        return Formula.lit(Lit.fromLong(value));
    }

    private static void assertError(String text, int line, int column, ErrorKind kind) {
        ParseError error = assertThrows(ParseError.class, () -> parseDimacs(text));
        assertEquals(kind, error.getKind(), error.getMessage());
        assertEquals(new Location(line, column), error.getLocation(), error.getMessage());
    }

    //region CNF

    @Test
    public void simpleCnf() {
        String sample = "\n"
                + "\t\t\tc Sample DIMACS .cnf file\n"
                + "\t\t\tc holding some information\n"
                + "\t\t\tc and trying to be some\n"
                + "\t\t\tc kind of a test.\n"
                + "\t\t\tp cnf 42 4\n"
                + "\t\t\t1 2 0\n"
                + "\t\t\t-3 4 0\n"
                + "\t\t\t5 -6 7 0\n"
                + "\t\t\t-7 -8 -9 0";
        Instance expected = Instance.cnf(42, List.of(
                Clause.of(1, 2),
                Clause.of(-3, 4),
                Clause.of(5, -6, 7),
                Clause.of(-7, -8, -9)));

        assertEquals(expected, parseDimacs(sample));
    }

    @Test
    public void twoClauseCnf() {
        Instance instance = parseDimacs("p cnf 2 2\n1 2 0\n-1 -2 0");

        assertTrue(instance.isCnf());
        assertEquals(2, instance.getNumVars());
        assertEquals(List.of(Clause.of(1, 2), Clause.of(-1, -2)), instance.getClauses());
        assertTrue(instance.getExtensions().isEmpty());
    }

    @Test
    public void leadingCommentIsSkipped() {
        Instance instance = parseDimacs("c hi\np cnf 1 1\n1 0");

        assertEquals(Instance.cnf(1, List.of(Clause.of(1))), instance);
        assertError("c hi\np cnf 1 1\n1 ? 0", 3, 3, ErrorKind.INVALID_TOKEN_START);
        assertError("c hi\np cnf 1 1\n1 0\n2 0", 4, 1, ErrorKind.CLAUSE_COUNT_MISMATCH);
    }

    @Test
    public void variableBeyondHeaderIsWarned() {
        Logger logger = Logger.getLogger(DimacsParser.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            Instance instance = parseDimacs("p cnf 2 1\n1 -5 0\n");

            assertEquals(List.of(Clause.of(1, -5)), instance.getClauses());
            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING
                    && r.getMessage().contains("Variabile 5")));

            records.clear();
            parseDimacs("p cnf 5 1\n1 -5 0\n");
            assertTrue(records.stream().noneMatch(r -> r.getLevel() == Level.WARNING));
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    public void commentInsideClauseIsSkipped() {
        Instance instance = parseDimacs("p cnf 2 1\n1 c rest of line\n-2 0\n");

        assertEquals(List.of(Clause.of(1, -2)), instance.getClauses());
    }

    @Test
    public void clausesMayShareLinesOrSpanSeveral() {
        Instance instance = parseDimacs("p cnf 3 3\n1 0 2\n-3 0\n\n3\n0");

        assertEquals(List.of(Clause.of(1), Clause.of(2, -3), Clause.of(3)), instance.getClauses());
    }

    @Test
    public void emptyClauseAndDuplicatesArePreserved() {
        Instance instance = parseDimacs("p cnf 1 2\n0\n1 1 -1 0");

        assertEquals(List.of(Clause.of(), Clause.of(1, 1, -1)), instance.getClauses());
        assertTrue(instance.getClauses().get(0).isEmpty());
    }

    @Test
    public void missingClausesFailAtEndOfInput() {
        assertError("p cnf 2 2\n1 2 0\n", 2, 5, ErrorKind.UNEXPECTED_END_OF_FILE);
        assertError("p cnf 2 1\n1 2", 2, 3, ErrorKind.UNEXPECTED_END_OF_FILE);
        assertError("p cnf 2 1", 1, 9, ErrorKind.UNEXPECTED_END_OF_FILE);
    }

    @Test
    public void extraClausesAreReported() {
        assertError("p cnf 2 1\n1 0\n2 0", 3, 1, ErrorKind.CLAUSE_COUNT_MISMATCH);
        assertError("p cnf 2 1\n1 0\n-2 0", 3, 1, ErrorKind.CLAUSE_COUNT_MISMATCH);
        assertError("p cnf 2 1\n1 0 0", 2, 5, ErrorKind.CLAUSE_COUNT_MISMATCH);
    }

    @Test
    public void foreignTokenInClause() {
        assertError("p cnf 1 1\n1 ( 0", 2, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p cnf 1 1\n- 0", 2, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p cnf 1 1\n1 0 )", 2, 5, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void headerCountsMustBeNaturals() {
        assertError("p cnf 0 0", 1, 7, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p cnf 3", 1, 7, ErrorKind.UNEXPECTED_END_OF_FILE);
        assertError("p cnf -3 1", 1, 7, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void lexicalErrorsAbortTheParse() {
        assertError("p cnf 1 1\n1 # 0", 2, 3, ErrorKind.INVALID_TOKEN_START);
        assertError("p cnf 1 1\n1 0 #", 2, 5, ErrorKind.INVALID_TOKEN_START);
        assertError("p cnf 99999999999999999999 1\n1 0", 1, 7, ErrorKind.NUMBER_OVERFLOW);
    }

    //endregion

    //region SAT

    @Test
    public void simpleSat() {
        String sample = "\n"
                + "\t\t\tc Sample DIMACS .sat file\n"
                + "\t\t\tp sat 42\n"
                + "\t\t\t(*(+(1 3 -4)\n"
                + "\t\t\t+(4)\n"
                + "\t\t\t+(2 3)))";
        Instance expected = Instance.sat(42, Extensions.NONE,
                Formula.paren(Formula.and(List.of(
                        Formula.or(List.of(lit(1), lit(3), lit(-4))),
                        Formula.or(List.of(lit(4))),
                        Formula.or(List.of(lit(2), lit(3)))))));

        assertEquals(expected, parseDimacs(sample));
    }

    @Test
    public void nestedSat() {
        Instance instance = parseDimacs("p sat 3\n(*(+(1 3 -2)\n+(2)))");

        assertTrue(instance.isSat());
        assertEquals(3, instance.getNumVars());
        assertEquals(Extensions.NONE, instance.getExtensions());
        assertEquals(Formula.paren(Formula.and(List.of(
                        Formula.or(List.of(lit(1), lit(3), lit(-2))),
                        Formula.or(List.of(lit(2)))))),
                instance.getFormula());
    }

    @Test
    public void extensionKeywords() {
        assertEquals(Extensions.NONE, parseDimacs("p sat 1\n1").getExtensions());
        assertEquals(Extensions.EQ, parseDimacs("p sate 2\n=(1 2)").getExtensions());
        assertEquals(Extensions.XOR, parseDimacs("p satx 2\nxor(1 2)").getExtensions());
        assertEquals(Extensions.EQ_XOR, parseDimacs("p satex 3\n*(=(1 2) xor(2 3))").getExtensions());
    }

    @Test
    public void equivalenceAndXor() {
        Instance instance = parseDimacs("p satex 3\n*(=(1 -2) xor(2 3 -1))");

        assertEquals(Formula.and(List.of(
                        Formula.eq(List.of(lit(1), lit(-2))),
                        Formula.xor(List.of(lit(2), lit(3), lit(-1))))),
                instance.getFormula());
    }

    @Test
    public void minusBeforeNaturalIsNegativeLiteral() {
        Formula formula = parseDimacs("p sat 1\n-1").getFormula();

        assertEquals(Formula.Kind.LIT, formula.getKind());
        assertEquals(Lit.fromLong(-1), formula.getLit());
    }

    @Test
    public void minusBeforeParenthesisIsNegation() {
        Formula formula = parseDimacs("p sat 2\n-(+(1 2))").getFormula();

        assertEquals(Formula.neg(Formula.or(List.of(lit(1), lit(2)))), formula);
        assertEquals(Formula.Kind.NEG, formula.getKind());
    }

    @Test
    public void minusBeforeAnythingElseIsUnexpected() {
        assertError("p sat 1\n-*(1)", 2, 2, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\n--1", 2, 2, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\n-", 2, 1, ErrorKind.UNEXPECTED_END_OF_FILE);
    }

    @Test
    public void emptyParameterList() {
        assertEquals(Formula.or(List.of()), parseDimacs("p sat 1\n+()").getFormula());
        assertEquals(Formula.and(List.of()), parseDimacs("p sat 1\n*( )").getFormula());
    }

    @Test
    public void operatorsRequireParameterList() {
        assertError("p sat 2\n+ 1 2", 2, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sate 2\n= 1", 2, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p satx 2\nxor 1", 2, 5, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void unbalancedParentheses() {
        assertError("p sat 1\n+(1", 2, 3, ErrorKind.UNEXPECTED_END_OF_FILE);
        assertError("p sat 1\n(1 1)", 2, 4, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\n+(1))", 2, 5, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void invalidFormulaStart() {
        assertError("p sat 1\n)", 2, 1, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\n0", 2, 1, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\nsat", 2, 1, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p sat 1\n", 1, 7, ErrorKind.UNEXPECTED_END_OF_FILE);
    }

    @Test
    public void trailingTokensAfterFormula() {
        assertError("p sat 2\n1 2", 2, 3, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void lexicalErrorInsideFormula() {
        assertError("p sat 2\n+(1 # 2)", 2, 5, ErrorKind.INVALID_TOKEN_START);
    }

    //endregion

    //region HEADER

    @Test
    public void unknownProblemKeyword() {
        assertError("p satq 3\n1", 1, 3, ErrorKind.UNKNOWN_KEYWORD);
    }

    @Test
    public void headerMustStartWithProblemLine() {
        assertError("cnf 1 1\n1 0", 1, 1, ErrorKind.UNEXPECTED_TOKEN);
        assertError("1 0", 1, 1, ErrorKind.UNEXPECTED_TOKEN);
    }

    @Test
    public void problemKindMustBeCnfOrSat() {
        assertError("p xor 1", 1, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p p 1", 1, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p 3", 1, 3, ErrorKind.UNEXPECTED_TOKEN);
        assertError("p", 1, 1, ErrorKind.UNEXPECTED_END_OF_FILE);
    }

    @Test
    public void emptyInput() {
        assertError("", 0, 0, ErrorKind.UNEXPECTED_END_OF_FILE);
        assertError("c only a comment\n", 0, 0, ErrorKind.UNEXPECTED_END_OF_FILE);
    }

    //endregion

    @Test
    public void renderedInstancesParseBack() {
        Instance cnf = parseDimacs("c x\np cnf 3 3\n1 -2 0\n0\n3 3 0");
        Instance sat = parseDimacs("p satex 4\n(-(*(=(1 -2) xor(3 4) +() -(4))))");

        assertEquals(cnf, parseDimacs(cnf.toString()));
        assertEquals(sat, parseDimacs(sat.toString()));
    }
}
