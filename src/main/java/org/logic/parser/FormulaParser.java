package org.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logic.antlr.LogicFormulaBaseVisitor;
import org.logic.antlr.LogicFormulaLexer;
import org.logic.antlr.LogicFormulaParser;
import org.logic.antlr.LogicFormulaParser.BinaryContext;
import org.logic.antlr.LogicFormulaParser.FalseContext;
import org.logic.antlr.LogicFormulaParser.FormulaContext;
import org.logic.antlr.LogicFormulaParser.IdContext;
import org.logic.antlr.LogicFormulaParser.NotContext;
import org.logic.antlr.LogicFormulaParser.TrueContext;
import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Convertitore da albero sintattico ANTLR a Formula
 *
 * Implementa un visitor sull'albero di parsing generato dalla grammatica
 * LogicFormula, costruendo nodi {@link Formula} senza alcuna trasformazione:
 * la formula restituita ha esattamente gli operatori scritti nel testo.
 *
 * NOTAZIONE ACCETTATA:
 * • Variabili: lettera minuscola seguita da lettere o cifre (p, q1, x12)
 * • Costanti: T, F
 * • Negazione: ~A
 * • Binari, sempre tra parentesi: (A&B), (A|B), (A->B), (A+B), (A<->B), (A-&B), (A-|B)
 * • Spazi ignorati
 */
public class FormulaParser extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula.
     *
     * Pipeline: Lexing -> Parsing -> Visitor. Gli errori di sintassi interrompono
     * subito l'analisi invece di essere stampati e recuperati.
     *
     * @param text formula in notazione testuale
     * @return albero della formula
     * @throws IllegalArgumentException se il testo non è una formula valida
     */
    public static Formula parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Testo della formula non può essere null o vuoto");
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
    }

    //endregion

    //region GESTIONE OPERATORI

    @Override
    public Formula visitNot(NotContext ctx) {
        LOGGER.finest("Elaborazione negazione unaria");
        return Formula.not(visit(ctx.expression()));
    }

    /**
     * Gestisce tutti i connettivi binari: il simbolo scritto determina l'operatore.
     */
    @Override
    public Formula visitBinary(BinaryContext ctx) {
        Operator operator = Operator.fromSymbol(ctx.op.getText());
        LOGGER.finest("Elaborazione connettivo binario " + operator);
        return Formula.binary(operator, visit(ctx.left), visit(ctx.right));
    }

    //endregion

    //region GESTIONE ATOMI E COSTANTI LOGICHE

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Elaborazione variabile: " + variableName);
        return Formula.variable(variableName);
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return Formula.TRUE;
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return Formula.FALSE;
    }

    //endregion

    /**
     * Trasforma ogni errore lessicale o sintattico in eccezione con posizione.
     */
    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException(
                    "Errore di sintassi alla riga " + line + ", colonna " + charPositionInLine + ": " + msg, e);
        }
    }
}
