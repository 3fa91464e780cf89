package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.Operator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Valutazione semantica usata solo nei test: tabelle di verità esaustive.
 */
final class TruthTable {

    private TruthTable() {
    }

    /**
     * Valore di verità della formula sotto l'assegnamento dato.
     * I nodi condivisi sono valutati una volta sola.
     */
    static boolean evaluate(Formula formula, Map<String, Boolean> assignment) {
        return evaluate(formula, assignment, new IdentityHashMap<>());
    }

    private static boolean evaluate(Formula node, Map<String, Boolean> assignment, Map<Formula, Boolean> memo) {
        Boolean cached = memo.get(node);
        if (cached != null) {
            return cached;
        }

        boolean value = switch (node.getType()) {
            case VARIABLE -> {
                Boolean assigned = assignment.get(node.getName());
                if (assigned == null) {
                    throw new IllegalArgumentException("Variabile senza valore: " + node.getName());
                }
                yield assigned;
            }
            case CONSTANT -> node.getOperator() == Operator.TRUE;
            case UNARY -> !evaluate(node.getFirst(), assignment, memo);
            case BINARY -> {
                boolean a = evaluate(node.getFirst(), assignment, memo);
                boolean b = evaluate(node.getSecond(), assignment, memo);
                yield switch (node.getOperator()) {
                    case AND -> a && b;
                    case OR -> a || b;
                    case IMPLIES -> !a || b;
                    case XOR -> a != b;
                    case IFF -> a == b;
                    case NAND -> !(a && b);
                    case NOR -> !(a || b);
                    default -> throw new IllegalArgumentException("Operatore binario inatteso: " + node.getRoot());
                };
            }
        };
        memo.put(node, value);
        return value;
    }

    /**
     * Tutti gli assegnamenti delle variabili indicate, in ordine binario.
     */
    static List<Map<String, Boolean>> allAssignments(SortedSet<String> variables) {
        List<String> names = new ArrayList<>(variables);
        List<Map<String, Boolean>> assignments = new ArrayList<>();
        for (int mask = 0; mask < (1 << names.size()); mask++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < names.size(); i++) {
                assignment.put(names.get(i), (mask & (1 << i)) != 0);
            }
            assignments.add(assignment);
        }
        return assignments;
    }

    /**
     * Stessa tabella di verità su tutte le variabili di entrambe le formule.
     * Include il segnaposto introdotto per le costanti: l'equivalenza deve valere
     * per qualunque suo valore.
     */
    static boolean equivalent(Formula first, Formula second) {
        SortedSet<String> variables = new TreeSet<>(first.variables());
        variables.addAll(second.variables());

        for (Map<String, Boolean> assignment : allAssignments(variables)) {
            if (evaluate(first, assignment) != evaluate(second, assignment)) {
                return false;
            }
        }
        return true;
    }
}
