package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.Objects;

import static org.logic.formula.Formula.FALSE;
import static org.logic.formula.Formula.implies;

/**
 * RIDUTTORE A {->, F} - Implicazione e falso come unici simboli
 *
 * Parte dalla base {~, &, |} e codifica ogni connettivo con l'implicazione,
 * lasciando F come unica foglia ammessa oltre alle variabili. Il passo a monte
 * conserva le costanti: F è già un simbolo della base e T si codifica direttamente,
 * senza passare per la variabile segnaposto.
 *
 * IDENTITÀ USATE:
 * • T -> (F->F)
 * • ~x -> (x->F)
 * • (a|b) -> ((a->F)->b)
 * • (a&b) -> ((a->(b->F))->F)
 */
public class ImpliesFalseReducer extends FormulaReducer {

    private final NotAndOrReducer base;

    public ImpliesFalseReducer() {
        this(new NotAndOrReducer());
    }

    /**
     * @param base riduttore di base, usato come primo passo nella sua variante che conserva le costanti
     */
    public ImpliesFalseReducer(NotAndOrReducer base) {
        this.base = Objects.requireNonNull(base, "Riduttore di base non può essere null").keepingConstants();
    }

    @Override
    protected Formula prepare(Formula formula) {
        return base.reduce(formula);
    }

    @Override
    protected Formula rewrite(Formula node, Conversion conversion) {
        return switch (node.getType()) {
            case VARIABLE -> node;

            case CONSTANT -> node.getOperator() == Operator.FALSE ? node : implies(FALSE, FALSE);

            case UNARY -> implies(conversion.convert(node.getFirst()), FALSE);

            case BINARY -> {
                Formula a = conversion.convert(node.getFirst());
                Formula b = conversion.convert(node.getSecond());

                yield switch (node.getOperator()) {
                    case OR -> implies(implies(a, FALSE), b);
                    case AND -> implies(implies(a, implies(b, FALSE)), FALSE);
                    default -> throw unrecognized(node);
                };
            }
        };
    }
}
