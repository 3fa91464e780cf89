package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * BASI DI OPERATORI - Insiemi minimi di connettivi supportati come destinazione
 *
 * Ogni base conosce gli operatori ammessi, il nome usato da linea di comando,
 * la directory di output e come costruire il riduttore corrispondente sopra
 * un riduttore di base dato.
 */
public enum OperatorBasis {

    NOT_AND_OR("not-and-or", EnumSet.of(Operator.NOT, Operator.AND, Operator.OR),
            base -> base),

    NOT_AND("not-and", EnumSet.of(Operator.NOT, Operator.AND),
            NotAndReducer::new),

    NAND("nand", EnumSet.of(Operator.NAND),
            base -> new NandReducer(new NotAndReducer(base))),

    IMPLIES_NOT("implies-not", EnumSet.of(Operator.IMPLIES, Operator.NOT),
            ImpliesNotReducer::new),

    IMPLIES_FALSE("implies-false", EnumSet.of(Operator.IMPLIES, Operator.FALSE),
            ImpliesFalseReducer::new);

    private final String cliName;
    private final Set<Operator> allowedOperators;
    private final Function<NotAndOrReducer, FormulaReducer> factory;

    OperatorBasis(String cliName, Set<Operator> allowedOperators,
                  Function<NotAndOrReducer, FormulaReducer> factory) {
        this.cliName = cliName;
        this.allowedOperators = Collections.unmodifiableSet(allowedOperators);
        this.factory = factory;
    }

    /**
     * Risolve il nome da linea di comando (es. "implies-false").
     *
     * @throws IllegalArgumentException se il nome non corrisponde a nessuna base
     */
    public static OperatorBasis fromCliName(String name) {
        for (OperatorBasis basis : values()) {
            if (basis.cliName.equalsIgnoreCase(name.trim())) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Base di operatori non supportata: " + name);
    }

    public String getCliName() {
        return cliName;
    }

    /**
     * Nome della sottodirectory di output (es. "NOT-AND-OR").
     */
    public String getDirectoryName() {
        return cliName.toUpperCase();
    }

    public Set<Operator> getAllowedOperators() {
        return allowedOperators;
    }

    /**
     * Verifica strutturale: ogni operatore della formula appartiene alla base.
     * Le variabili sono sempre ammesse.
     */
    public boolean isExpressedIn(Formula formula) {
        return allowedOperators.containsAll(formula.operators());
    }

    /**
     * Riduttore verso questa base con il riduttore di base di default.
     */
    public FormulaReducer createReducer() {
        return createReducer(new NotAndOrReducer());
    }

    /**
     * Riduttore verso questa base costruito sopra il riduttore di base indicato.
     */
    public FormulaReducer createReducer(NotAndOrReducer base) {
        return factory.apply(base);
    }
}
