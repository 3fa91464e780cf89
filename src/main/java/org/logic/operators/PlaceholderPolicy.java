package org.logic.operators;

/**
 * Scelta della variabile segnaposto usata per eliminare le costanti T e F.
 *
 * T diventa (p|~p) e F diventa (p&~p): il valore di verità non dipende da p,
 * quindi la scelta del nome incide solo sull'insieme di variabili dell'output.
 */
public enum PlaceholderPolicy {

    /**
     * Usa sempre il nome configurato, anche se compare già nella formula.
     * La formula resta equivalente, ma il segnaposto può coincidere con una
     * variabile significativa.
     */
    FIXED,

    /**
     * Usa il nome configurato solo se assente dalla formula; altrimenti il primo
     * tra nome1, nome2, ... che non vi compare.
     */
    FRESH
}
