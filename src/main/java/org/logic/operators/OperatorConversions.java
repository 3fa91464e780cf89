package org.logic.operators;

import org.logic.formula.Formula;

/**
 * Le cinque conversioni sintattiche come funzioni pure, con segnaposto p fisso.
 *
 * Tutte sono totali sulle formule ben formate; l'unico errore possibile è
 * {@link org.logic.formula.UnrecognizedOperatorException} per un albero malformato.
 */
public final class OperatorConversions {

    private static final NotAndOrReducer NOT_AND_OR = new NotAndOrReducer();
    private static final NotAndReducer NOT_AND = new NotAndReducer(NOT_AND_OR);
    private static final NandReducer NAND = new NandReducer(NOT_AND);
    private static final ImpliesNotReducer IMPLIES_NOT = new ImpliesNotReducer(NOT_AND_OR);
    private static final ImpliesFalseReducer IMPLIES_FALSE = new ImpliesFalseReducer(NOT_AND_OR);

    private OperatorConversions() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /** Formula equivalente con soli ~, &, | e nessuna costante. */
    public static Formula toNotAndOr(Formula formula) {
        return NOT_AND_OR.reduce(formula);
    }

    /** Formula equivalente con soli ~ e &. */
    public static Formula toNotAnd(Formula formula) {
        return NOT_AND.reduce(formula);
    }

    /** Formula equivalente con il solo -&. */
    public static Formula toNand(Formula formula) {
        return NAND.reduce(formula);
    }

    /** Formula equivalente con soli -> e ~. */
    public static Formula toImpliesNot(Formula formula) {
        return IMPLIES_NOT.reduce(formula);
    }

    /** Formula equivalente con soli -> e F. */
    public static Formula toImpliesFalse(Formula formula) {
        return IMPLIES_FALSE.reduce(formula);
    }
}
