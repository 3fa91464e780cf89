package org.logic.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.formula.Formula;
import org.logic.formula.Operator;

import static org.junit.jupiter.api.Assertions.*;
import static org.logic.formula.Formula.*;

@DisplayName("FormulaParser")
class FormulaParserTest {

    @Test
    @DisplayName("Variabili e costanti")
    void leaves() {
        assertEquals(variable("p"), FormulaParser.parse("p"));
        assertEquals(variable("x12"), FormulaParser.parse("x12"));
        assertEquals(variable("qA1"), FormulaParser.parse("qA1"));
        assertSame(Formula.TRUE, FormulaParser.parse("T"));
        assertSame(Formula.FALSE, FormulaParser.parse("F"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"&", "|", "->", "+", "<->", "-&", "-|"})
    @DisplayName("Ogni connettivo binario è riconosciuto dal proprio simbolo")
    void binaryOperators(String symbol) {
        Formula formula = FormulaParser.parse("(p" + symbol + "q)");

        assertEquals(Operator.fromSymbol(symbol), formula.getOperator());
        assertEquals(variable("p"), formula.getFirst());
        assertEquals(variable("q"), formula.getSecond());
    }

    @Test
    @DisplayName("Annidamento e negazioni multiple")
    void nesting() {
        Formula expected = implies(not(not(and(variable("p"), Formula.TRUE))), nor(variable("q"), Formula.FALSE));
        assertEquals(expected, FormulaParser.parse("(~~(p&T)->(q-|F))"));
    }

    @Test
    @DisplayName("Gli spazi sono ignorati")
    void whitespaceIsIgnored() {
        assertEquals(FormulaParser.parse("((p<->q)-&~r)"), FormulaParser.parse("  ( ( p <-> q ) -& ~ r )\t"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"((p+~q)<->(r-&T))", "~(p-|F)", "(((p|q)&r)->~s)"})
    @DisplayName("La rappresentazione testuale si rilegge nella stessa formula")
    void textRoundTrip(String text) {
        Formula formula = FormulaParser.parse(text);
        assertEquals(text, formula.toString());
        assertEquals(formula, FormulaParser.parse(formula.toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"(p&q", "p&q", "(p)", "P", "(p=>q)", "~", "(p&q))", "1p", "(p&&q)"})
    @DisplayName("Testo malformato produce IllegalArgumentException")
    void syntaxErrors(String text) {
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(text));
    }

    @Test
    @DisplayName("Testo vuoto o null rifiutato")
    void emptyText() {
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse(null));
        assertThrows(IllegalArgumentException.class, () -> FormulaParser.parse("   "));
    }
}
