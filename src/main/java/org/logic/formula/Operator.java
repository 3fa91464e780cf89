package org.logic.formula;

import java.util.HashMap;
import java.util.Map;

/**
 * OPERATORI DELLA LOGICA PROPOSIZIONALE - Insieme chiuso dei simboli ammessi
 *
 * Ogni operatore porta con sé il proprio simbolo testuale e la propria arità,
 * che determina esattamente la forma del nodo che lo contiene:
 * • Arità 0: costanti T e F
 * • Arità 1: negazione ~
 * • Arità 2: connettivi &, |, ->, +, <->, -&, -|
 */
public enum Operator {
    TRUE("T", 0),       // Costante vero
    FALSE("F", 0),      // Costante falso
    NOT("~", 1),        // Negazione: ~A
    AND("&", 2),        // Congiunzione: (A&B)
    OR("|", 2),         // Disgiunzione: (A|B)
    IMPLIES("->", 2),   // Implicazione: (A->B)
    XOR("+", 2),        // Disgiunzione esclusiva: (A+B)
    IFF("<->", 2),      // Biimplicazione: (A<->B)
    NAND("-&", 2),      // Congiunzione negata: (A-&B)
    NOR("-|", 2);       // Disgiunzione negata: (A-|B)

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static {
        for (Operator operator : values()) {
            BY_SYMBOL.put(operator.symbol, operator);
        }
    }

    private final String symbol;
    private final int arity;

    Operator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    /**
     * Risolve un simbolo testuale nell'operatore corrispondente.
     *
     * @param symbol simbolo da risolvere (es. "->", "-&")
     * @return operatore con quel simbolo
     * @throws UnrecognizedOperatorException se il simbolo non appartiene all'insieme noto
     */
    public static Operator fromSymbol(String symbol) {
        Operator operator = symbol == null ? null : BY_SYMBOL.get(symbol);
        if (operator == null) {
            throw new UnrecognizedOperatorException(symbol);
        }
        return operator;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    public boolean isConstant() {
        return arity == 0;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
