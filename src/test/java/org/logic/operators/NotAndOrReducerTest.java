package org.logic.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.logic.parser.FormulaParser.parse;

@DisplayName("NotAndOrReducer")
class NotAndOrReducerTest {

    private final NotAndOrReducer reducer = new NotAndOrReducer();

    @Nested
    @DisplayName("Regole di riscrittura")
    class Rules {

        @Test
        @DisplayName("Le variabili restano invariate")
        void variableUnchanged() {
            Formula p = parse("p");
            assertSame(p, reducer.reduce(p));
        }

        @Test
        @DisplayName("T diventa (p|~p) e F diventa (p&~p)")
        void constantsBecomePlaceholderExpansions() {
            assertEquals(parse("(p|~p)"), reducer.reduce(Formula.TRUE));
            assertEquals(parse("(p&~p)"), reducer.reduce(Formula.FALSE));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = ';', value = {
                "(p&q);        (p&q)",
                "(p|q);        (p|q)",
                "~p;           ~p",
                "(p->q);       (~p|q)",
                "(p+q);        ((p&~q)|(~p&q))",
                "(p<->q);      ((p&q)|(~p&~q))",
                "(p-&q);       ~(p&q)",
                "(p-|q);       ~(p|q)",
                "((p->q)->r);  (~(~p|q)|r)",
                "~(p-|T);      ~~(p|(p|~p))"
        })
        @DisplayName("Ogni connettivo derivato segue la propria identità")
        void derivedConnectives(String input, String expected) {
            assertEquals(parse(expected), reducer.reduce(parse(input)));
        }

        @Test
        @DisplayName("Gli operandi ripetuti da + sono lo stesso nodo convertito")
        void xorReusesConvertedOperands() {
            Formula result = reducer.reduce(parse("((p->q)+r)"));

            Formula left = result.getFirst();   // (a&~b)
            Formula right = result.getSecond(); // (~a&b)
            assertSame(left.getFirst(), right.getFirst().getFirst());
            assertSame(left.getSecond().getFirst(), right.getSecond());
        }
    }

    @Nested
    @DisplayName("Proprietà")
    class Properties {

        @Test
        @DisplayName("Output in {~, &, |} senza costanti ed equivalente all'input")
        void containmentAndEquivalence() {
            for (Formula formula : new RandomFormulas(11).sample(200, 6)) {
                Formula result = reducer.reduce(formula);

                assertTrue(OperatorBasis.NOT_AND_OR.isExpressedIn(result), () -> "Fuori base: " + formula);
                assertTrue(TruthTable.equivalent(formula, result), () -> "Non equivalente: " + formula);
            }
        }

        @Test
        @DisplayName("applyPass coincide con reduce: non c'è normalizzazione a monte")
        void applyPassMatchesReduce() {
            Formula formula = parse("((p+T)<->~(q-|r))");
            assertEquals(reducer.reduce(formula), reducer.applyPass(formula));
        }

        @Test
        @DisplayName("Input null rifiutato")
        void nullInput() {
            assertThrows(NullPointerException.class, () -> reducer.reduce(null));
        }
    }

    @Nested
    @DisplayName("Variabile segnaposto")
    class Placeholder {

        @Test
        @DisplayName("FIXED usa p anche quando p compare già nella formula")
        void fixedPolicyMayReuseVariable() {
            Formula formula = parse("(p&T)");
            Formula result = reducer.reduce(formula);

            assertEquals(parse("(p&(p|~p))"), result);
            assertTrue(TruthTable.equivalent(formula, result));
        }

        @Test
        @DisplayName("FRESH sceglie un nome assente dalla formula")
        void freshPolicyAvoidsExistingVariables() {
            NotAndOrReducer fresh = new NotAndOrReducer("p", PlaceholderPolicy.FRESH);

            assertEquals(parse("(q|(p|~p))"), fresh.reduce(parse("(q|T)")));
            assertEquals(parse("(p&(p1|~p1))"), fresh.reduce(parse("(p&T)")));
            assertEquals("p3", fresh.placeholderFor(parse("((p&p1)|(p2->F))")));
        }

        @Test
        @DisplayName("FRESH aggiunge al più una variabile all'output")
        void freshPolicyAddsAtMostOneVariable() {
            NotAndOrReducer fresh = new NotAndOrReducer("p", PlaceholderPolicy.FRESH);

            for (Formula formula : new RandomFormulas(5).sample(100, 5)) {
                Formula result = fresh.reduce(formula);
                List<String> added = result.variables().stream()
                        .filter(name -> !formula.variables().contains(name))
                        .toList();

                assertTrue(added.size() <= 1, () -> "Variabili aggiunte: " + added);
                assertTrue(TruthTable.equivalent(formula, result));
            }
        }

        @Test
        @DisplayName("Nome personalizzato")
        void customName() {
            NotAndOrReducer custom = new NotAndOrReducer("z", PlaceholderPolicy.FIXED);
            assertEquals(parse("(z&~z)"), custom.reduce(Formula.FALSE));
            assertEquals("z", custom.getPlaceholder());
        }

        @Test
        @DisplayName("Nome vuoto rifiutato")
        void blankNameRejected() {
            assertThrows(IllegalArgumentException.class, () -> new NotAndOrReducer(" ", PlaceholderPolicy.FIXED));
            assertThrows(NullPointerException.class, () -> new NotAndOrReducer("p", null));
        }

        @Test
        @DisplayName("La variante che conserva le costanti non usa il segnaposto")
        void keepingConstants() {
            NotAndOrReducer keeping = reducer.keepingConstants();

            assertTrue(keeping.isKeepingConstants());
            assertSame(keeping, keeping.keepingConstants());
            assertEquals(parse("(~T|F)"), keeping.reduce(parse("(T->F)")));
            assertFalse(keeping.reduce(parse("(p+T)")).operators().contains(Operator.XOR));
        }
    }
}
