package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import static org.logic.formula.Formula.and;
import static org.logic.formula.Formula.not;
import static org.logic.formula.Formula.or;

/**
 * RIDUTTORE DI BASE - Elimina connettivi derivati e costanti
 *
 * Primo passo di ogni pipeline: produce una formula equivalente che usa solo
 * ~, & e | oltre alle variabili. I passi successivi assumono questo vocabolario.
 *
 * TRASFORMAZIONI APPLICATE (a, b operandi già ridotti):
 * • T -> (p|~p), F -> (p&~p) con p variabile segnaposto
 * • (a->b) -> (~a|b)
 * • (a+b) -> ((a&~b)|(~a&b))
 * • (a<->b) -> ((a&b)|(~a&~b))
 * • (a-&b) -> ~(a&b)
 * • (a-|b) -> ~(a|b)
 *
 * Nella variante {@link #keepingConstants()} T e F restano foglie invariate: serve
 * alle basi che ammettono una costante tra i propri simboli.
 */
public class NotAndOrReducer extends FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(NotAndOrReducer.class.getName());

    /** Nome di default della variabile segnaposto */
    public static final String DEFAULT_PLACEHOLDER = "p";

    private final String placeholder;
    private final PlaceholderPolicy policy;
    private final boolean keepConstants;

    /**
     * Riduttore con segnaposto p fisso.
     */
    public NotAndOrReducer() {
        this(DEFAULT_PLACEHOLDER, PlaceholderPolicy.FIXED);
    }

    /**
     * @param placeholder nome della variabile segnaposto (non vuoto)
     * @param policy politica di scelta del segnaposto
     * @throws IllegalArgumentException se il nome è vuoto
     */
    public NotAndOrReducer(String placeholder, PlaceholderPolicy policy) {
        this(placeholder, policy, false);
    }

    private NotAndOrReducer(String placeholder, PlaceholderPolicy policy, boolean keepConstants) {
        if (placeholder == null || placeholder.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome del segnaposto non può essere null o vuoto");
        }
        this.placeholder = placeholder.trim();
        this.policy = Objects.requireNonNull(policy, "Politica del segnaposto non può essere null");
        this.keepConstants = keepConstants;
    }

    /**
     * Variante che elimina solo i connettivi derivati e lascia T e F nell'output.
     */
    public NotAndOrReducer keepingConstants() {
        return keepConstants ? this : new NotAndOrReducer(placeholder, policy, true);
    }

    public boolean isKeepingConstants() {
        return keepConstants;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public PlaceholderPolicy getPolicy() {
        return policy;
    }

    /**
     * Nome del segnaposto che verrebbe usato per la formula data.
     */
    public String placeholderFor(Formula formula) {
        if (policy == PlaceholderPolicy.FIXED) {
            return placeholder;
        }

        Set<String> used = formula.variables();
        if (!used.contains(placeholder)) {
            return placeholder;
        }
        int suffix = 1;
        while (used.contains(placeholder + suffix)) {
            suffix++;
        }
        return placeholder + suffix;
    }

    @Override
    protected FormulaReducer forInput(Formula formula) {
        if (policy == PlaceholderPolicy.FIXED || keepConstants) {
            return this;
        }
        String chosen = placeholderFor(formula);
        LOGGER.finest("Segnaposto scelto per la formula: " + chosen);
        return new NotAndOrReducer(chosen, PlaceholderPolicy.FIXED);
    }

    @Override
    protected Formula rewrite(Formula node, Conversion conversion) {
        return switch (node.getType()) {
            case VARIABLE -> node;

            case CONSTANT -> keepConstants ? node : eliminateConstant(node);

            case UNARY -> not(conversion.convert(node.getFirst()));

            case BINARY -> {
                Formula a = conversion.convert(node.getFirst());
                Formula b = conversion.convert(node.getSecond());
                yield rewriteBinary(node, a, b);
            }
        };
    }

    private Formula eliminateConstant(Formula node) {
        Formula p = Formula.variable(placeholder);
        return node.getOperator() == Operator.TRUE
                ? or(p, not(p))       // tautologia
                : and(p, not(p));     // contraddizione
    }

    private Formula rewriteBinary(Formula node, Formula a, Formula b) {
        return switch (node.getOperator()) {
            case AND -> and(a, b);
            case OR -> or(a, b);
            case IMPLIES -> or(not(a), b);
            case XOR -> or(and(a, not(b)), and(not(a), b));
            case IFF -> or(and(a, b), and(not(a), not(b)));
            case NAND -> not(and(a, b));
            case NOR -> not(or(a, b));
            default -> throw unrecognized(node);
        };
    }
}
