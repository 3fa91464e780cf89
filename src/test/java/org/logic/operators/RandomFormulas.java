package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generatore deterministico di formule casuali su al più quattro variabili.
 */
final class RandomFormulas {

    private static final String[] VARIABLES = {"p", "q", "r", "s"};
    private static final Operator[] BINARY = {
            Operator.AND, Operator.OR, Operator.IMPLIES, Operator.XOR,
            Operator.IFF, Operator.NAND, Operator.NOR
    };

    private final Random random;

    RandomFormulas(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Formula con profondità al più maxDepth.
     */
    Formula next(int maxDepth) {
        if (maxDepth == 0 || random.nextInt(5) == 0) {
            return leaf();
        }
        if (random.nextInt(4) == 0) {
            return Formula.not(next(maxDepth - 1));
        }
        Operator operator = BINARY[random.nextInt(BINARY.length)];
        return Formula.binary(operator, next(maxDepth - 1), next(maxDepth - 1));
    }

    List<Formula> sample(int count, int maxDepth) {
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            formulas.add(next(maxDepth));
        }
        return formulas;
    }

    private Formula leaf() {
        int choice = random.nextInt(VARIABLES.length + 2);
        if (choice == VARIABLES.length) {
            return Formula.TRUE;
        }
        if (choice == VARIABLES.length + 1) {
            return Formula.FALSE;
        }
        return Formula.variable(VARIABLES[choice]);
    }
}
