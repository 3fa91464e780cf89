package org.logic.operators;

import org.logic.formula.Formula;

import java.util.Objects;

import static org.logic.formula.Formula.implies;
import static org.logic.formula.Formula.not;

/**
 * Riduce alla base {->, ~} a partire dalla base {~, &, |}.
 *
 * IDENTITÀ USATE:
 * • (a|b) -> (~a->b)
 * • (a&b) -> ~(a->~b)
 */
public class ImpliesNotReducer extends FormulaReducer {

    private final NotAndOrReducer base;

    public ImpliesNotReducer() {
        this(new NotAndOrReducer());
    }

    /**
     * @param base riduttore di base usato come primo passo
     */
    public ImpliesNotReducer(NotAndOrReducer base) {
        this.base = Objects.requireNonNull(base, "Riduttore di base non può essere null");
    }

    @Override
    protected Formula prepare(Formula formula) {
        return base.reduce(formula);
    }

    @Override
    protected Formula rewrite(Formula node, Conversion conversion) {
        return switch (node.getType()) {
            case VARIABLE, CONSTANT -> node;

            case UNARY -> not(conversion.convert(node.getFirst()));

            case BINARY -> {
                Formula a = conversion.convert(node.getFirst());
                Formula b = conversion.convert(node.getSecond());

                yield switch (node.getOperator()) {
                    case OR -> implies(not(a), b);
                    case AND -> not(implies(a, not(b)));
                    default -> throw unrecognized(node);
                };
            }
        };
    }
}
