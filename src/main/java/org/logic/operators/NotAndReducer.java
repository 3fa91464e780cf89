package org.logic.operators;

import org.logic.formula.Formula;

import java.util.Objects;

import static org.logic.formula.Formula.and;
import static org.logic.formula.Formula.not;

/**
 * Riduce alla base {~, &} eliminando la disgiunzione con De Morgan:
 * (a|b) -> ~(~a&~b).
 *
 * L'input viene prima portato in {~, &, |} dal riduttore di base; le costanti,
 * se presenti in un input passato direttamente ad {@link #applyPass}, restano invariate.
 */
public class NotAndReducer extends FormulaReducer {

    private final NotAndOrReducer base;

    public NotAndReducer() {
        this(new NotAndOrReducer());
    }

    /**
     * @param base riduttore di base usato come primo passo
     */
    public NotAndReducer(NotAndOrReducer base) {
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

            case BINARY -> switch (node.getOperator()) {
                case AND -> and(conversion.convert(node.getFirst()), conversion.convert(node.getSecond()));
                case OR -> {
                    Formula left = conversion.convert(node.getFirst());
                    Formula right = conversion.convert(node.getSecond());
                    yield not(and(not(left), not(right)));
                }
                default -> throw unrecognized(node);
            };
        };
    }
}
