package org.logic.operators;

import org.logic.formula.Formula;

import java.util.Objects;

import static org.logic.formula.Formula.nand;

/**
 * Riduce al solo connettivo -& a partire dalla base {~, &}.
 *
 * IDENTITÀ USATE:
 * • ~x -> (x-&x)
 * • (x&y) -> ((x-&y)-&(x-&y))
 *
 * Ogni operando che compare due volte è lo stesso nodo già convertito, costruito una volta.
 */
public class NandReducer extends FormulaReducer {

    private final NotAndReducer notAnd;

    public NandReducer() {
        this(new NotAndReducer());
    }

    /**
     * @param notAnd riduttore a {~, &} usato come primo passo
     */
    public NandReducer(NotAndReducer notAnd) {
        this.notAnd = Objects.requireNonNull(notAnd, "Riduttore a {~, &} non può essere null");
    }

    @Override
    protected Formula prepare(Formula formula) {
        return notAnd.reduce(formula);
    }

    @Override
    protected Formula rewrite(Formula node, Conversion conversion) {
        return switch (node.getType()) {
            case VARIABLE, CONSTANT -> node;

            case UNARY -> {
                Formula x = conversion.convert(node.getFirst());
                yield nand(x, x);
            }

            case BINARY -> switch (node.getOperator()) {
                case AND -> {
                    Formula x = conversion.convert(node.getFirst());
                    Formula y = conversion.convert(node.getSecond());
                    Formula t = nand(x, y);
                    yield nand(t, t);
                }
                default -> throw unrecognized(node);
            };
        };
    }
}
