package org.logic.formula;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile e persistente
 *
 * Rappresenta una formula della logica proposizionale come albero di nodi
 * immutabili. Nessuna trasformazione modifica un nodo esistente: ogni riscrittura
 * costruisce nodi nuovi e può condividere per riferimento i sottoalberi invariati.
 *
 * FORME DEI NODI:
 * • VARIABLE: foglia con nome di variabile (token opaco, confrontabile)
 * • CONSTANT: foglia T oppure F
 * • UNARY: negazione con un solo figlio (first)
 * • BINARY: connettivo binario con due figli (first, second)
 *
 * L'arità dell'operatore determina esattamente la forma del nodo ed è verificata
 * dai metodi factory.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Forme di nodo supportate nella rappresentazione ad albero.
     */
    public enum Type {
        VARIABLE,   // Variabile proposizionale: p, q12, ...
        CONSTANT,   // Costante: T, F
        UNARY,      // Negazione: ~A
        BINARY      // Connettivo binario: (A op B)
    }

    /** Costante vero condivisa */
    public static final Formula TRUE = new Formula(Operator.TRUE);

    /** Costante falso condivisa */
    public static final Formula FALSE = new Formula(Operator.FALSE);

    private final Type type;

    /** Nome della variabile (solo per nodi VARIABLE) */
    private final String name;

    /** Operatore del nodo (null per nodi VARIABLE) */
    private final Operator operator;

    private final Formula first;
    private final Formula second;

    // Valori derivati calcolati una sola volta: i sottoalberi condivisi restano economici
    private final int hash;
    private final long size;
    private final int depth;

    //endregion

    //region COSTRUTTORI E FACTORY

    private Formula(String name) {
        this.type = Type.VARIABLE;
        this.name = name;
        this.operator = null;
        this.first = null;
        this.second = null;
        this.hash = 31 * type.ordinal() + name.hashCode();
        this.size = 1;
        this.depth = 0;
    }

    private Formula(Operator constant) {
        this.type = Type.CONSTANT;
        this.name = null;
        this.operator = constant;
        this.first = null;
        this.second = null;
        this.hash = 31 * type.ordinal() + constant.ordinal();
        this.size = 1;
        this.depth = 0;
    }

    private Formula(Operator operator, Formula first, Formula second) {
        this.type = second == null ? Type.UNARY : Type.BINARY;
        this.name = null;
        this.operator = operator;
        this.first = first;
        this.second = second;

        int result = 31 * type.ordinal() + operator.ordinal();
        result = 31 * result + first.hash;
        if (second != null) {
            result = 31 * result + second.hash;
        }
        this.hash = result;
        this.size = expandedSize(first, second);
        this.depth = 1 + Math.max(first.depth, second == null ? 0 : second.depth);
    }

    /**
     * Nodi dell'albero espanso, saturando a Long.MAX_VALUE: con sottoalberi condivisi
     * il conteggio cresce in modo esponenziale rispetto ai nodi distinti.
     */
    private static long expandedSize(Formula first, Formula second) {
        try {
            long result = Math.addExact(1, first.size);
            return second == null ? result : Math.addExact(result, second.size);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Costruisce nodo foglia per variabile proposizionale.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @return nodo variabile
     * @throws IllegalArgumentException se name null o vuoto
     */
    public static Formula variable(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        return new Formula(name.trim());
    }

    /**
     * Restituisce il nodo costante per T o F.
     *
     * @param constant Operator.TRUE oppure Operator.FALSE
     * @return costante condivisa
     * @throws IllegalArgumentException se l'operatore non è una costante
     */
    public static Formula constant(Operator constant) {
        if (constant == Operator.TRUE) {
            return TRUE;
        }
        if (constant == Operator.FALSE) {
            return FALSE;
        }
        throw new IllegalArgumentException("Operatore non costante: " + constant);
    }

    /**
     * Costruisce nodo unario di negazione.
     *
     * @param operand sottoformula da negare (non null)
     * @return nodo ~operand
     * @throws IllegalArgumentException se operand null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Operator.NOT, operand, null);
    }

    /**
     * Costruisce nodo binario con verifica dell'arità.
     *
     * @param operator connettivo binario
     * @param first primo operando (non null)
     * @param second secondo operando (non null)
     * @return nodo (first operator second)
     * @throws IllegalArgumentException se operatore non binario o operandi null
     */
    public static Formula binary(Operator operator, Formula first, Formula second) {
        if (operator == null || !operator.isBinary()) {
            throw new IllegalArgumentException("Operatore non binario: " + operator);
        }
        if (first == null || second == null) {
            throw new IllegalArgumentException("Operandi per " + operator + " non possono essere null");
        }
        return new Formula(operator, first, second);
    }

    public static Formula and(Formula first, Formula second) {
        return binary(Operator.AND, first, second);
    }

    public static Formula or(Formula first, Formula second) {
        return binary(Operator.OR, first, second);
    }

    public static Formula implies(Formula first, Formula second) {
        return binary(Operator.IMPLIES, first, second);
    }

    public static Formula xor(Formula first, Formula second) {
        return binary(Operator.XOR, first, second);
    }

    public static Formula iff(Formula first, Formula second) {
        return binary(Operator.IFF, first, second);
    }

    public static Formula nand(Formula first, Formula second) {
        return binary(Operator.NAND, first, second);
    }

    public static Formula nor(Formula first, Formula second) {
        return binary(Operator.NOR, first, second);
    }

    //endregion

    //region CLASSIFICAZIONE E ACCESSO

    public Type getType() {
        return type;
    }

    public boolean isVariable() {
        return type == Type.VARIABLE;
    }

    public boolean isConstant() {
        return type == Type.CONSTANT;
    }

    public boolean isUnary() {
        return type == Type.UNARY;
    }

    public boolean isBinary() {
        return type == Type.BINARY;
    }

    /**
     * Radice del nodo in forma testuale: nome della variabile o simbolo dell'operatore.
     */
    public String getRoot() {
        return type == Type.VARIABLE ? name : operator.getSymbol();
    }

    /**
     * @return operatore del nodo, null per le variabili
     */
    public Operator getOperator() {
        return operator;
    }

    /**
     * @return nome della variabile, null per gli altri nodi
     */
    public String getName() {
        return name;
    }

    /**
     * @return primo (o unico) operando
     * @throws IllegalStateException se il nodo è una foglia
     */
    public Formula getFirst() {
        if (first == null) {
            throw new IllegalStateException("Il nodo " + getRoot() + " non ha operandi");
        }
        return first;
    }

    /**
     * @return secondo operando
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getSecond() {
        if (second == null) {
            throw new IllegalStateException("Il nodo " + getRoot() + " non è binario");
        }
        return second;
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Raccoglie le variabili distinte della formula in ordine alfabetico.
     */
    public SortedSet<String> variables() {
        SortedSet<String> variables = new TreeSet<>();
        for (Formula node : distinctNodes()) {
            if (node.isVariable()) {
                variables.add(node.name);
            }
        }
        return Collections.unmodifiableSortedSet(variables);
    }

    /**
     * Raccoglie gli operatori (costanti incluse) che compaiono nella formula.
     */
    public Set<Operator> operators() {
        Set<Operator> operators = EnumSet.noneOf(Operator.class);
        for (Formula node : distinctNodes()) {
            if (node.operator != null) {
                operators.add(node.operator);
            }
        }
        return Collections.unmodifiableSet(operators);
    }

    /**
     * Numero di nodi dell'albero espanso, contando più volte i sottoalberi condivisi.
     * Satura a Long.MAX_VALUE quando il conteggio esce dall'intervallo di long.
     */
    public long size() {
        return size;
    }

    /**
     * Numero di istanze distinte di nodo raggiungibili dalla radice.
     * Misura la memoria effettivamente occupata quando i sottoalberi sono condivisi.
     */
    public int distinctNodeCount() {
        return distinctNodes().size();
    }

    /**
     * Profondità massima dell'albero (0 per le foglie).
     */
    public int depth() {
        return depth;
    }

    /**
     * Visita iterativa che restituisce ogni istanza di nodo una sola volta.
     */
    private Set<Formula> distinctNodes() {
        Set<Formula> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Formula> pending = new ArrayDeque<>();
        pending.push(this);

        while (!pending.isEmpty()) {
            Formula node = pending.pop();
            if (!visited.add(node)) {
                continue;
            }
            if (node.first != null) {
                pending.push(node.first);
            }
            if (node.second != null) {
                pending.push(node.second);
            }
        }
        return visited;
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale: stessa forma, stesso operatore o nome, operandi uguali
     * nello stesso ordine.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        if (this.hash != other.hash || this.type != other.type) return false;

        return switch (this.type) {
            case VARIABLE -> this.name.equals(other.name);
            case CONSTANT -> this.operator == other.operator;
            case UNARY -> this.first.equals(other.first);
            case BINARY -> this.operator == other.operator
                    && this.first.equals(other.first)
                    && this.second.equals(other.second);
        };
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione completamente parentesizzata, rileggibile dal parser.
     *
     * FORMATO OUTPUT:
     * • Variabili e costanti: p, q1, T, F
     * • Negazioni: ~p, ~(p&q)
     * • Binari: (p&q), (p->q), (p-&q)
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        appendTo(result);
        return result.toString();
    }

    private void appendTo(StringBuilder result) {
        switch (type) {
            case VARIABLE -> result.append(name);
            case CONSTANT -> result.append(operator.getSymbol());
            case UNARY -> {
                result.append(operator.getSymbol());
                first.appendTo(result);
            }
            case BINARY -> {
                result.append('(');
                first.appendTo(result);
                result.append(operator.getSymbol());
                second.appendTo(result);
                result.append(')');
            }
        }
    }

    //endregion
}
