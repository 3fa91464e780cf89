package org.logic.operators;

import org.logic.formula.Formula;
import org.logic.formula.UnrecognizedOperatorException;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PASSO DI RIDUZIONE - Scheletro comune delle riscritture ricorsive
 *
 * Ogni riduttore è un passo di una pipeline: prima normalizza l'input con il
 * riduttore a monte ({@link #prepare}), poi applica le proprie regole locali
 * nodo per nodo ({@link #rewrite}), potendo assumere il vocabolario garantito
 * dal passo precedente.
 *
 * CONDIVISIONE DEI SOTTOALBERI:
 * • Ogni istanza di nodo viene convertita una sola volta per chiamata
 * • Una regola che usa due volte lo stesso operando riceve lo stesso nodo convertito
 * • La dimensione in nodi distinti dell'output resta lineare in quella dell'input
 *
 * I riduttori non hanno stato mutabile: la memoria delle conversioni vive solo
 * per la durata di una chiamata, quindi le istanze sono rientranti e condivisibili
 * tra thread.
 */
public abstract class FormulaReducer {

    private static final Logger LOGGER = Logger.getLogger(FormulaReducer.class.getName());

    //region INTERFACCIA PUBBLICA

    /**
     * METODO PRINCIPALE - Riduce la formula alla base di operatori di questo passo.
     *
     * @param formula formula arbitraria ben formata
     * @return formula equivalente espressa nella base del passo
     * @throws UnrecognizedOperatorException se l'albero contiene un operatore inatteso
     */
    public final Formula reduce(Formula formula) {
        Objects.requireNonNull(formula, "La formula da ridurre non può essere null");

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(getName() + ": inizio riduzione di " + formula);
        }

        Formula result = applyPass(prepare(formula));

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(getName() + ": riduzione completata, " + result.distinctNodeCount() +
                    " nodi distinti, " + result.size() + " nodi espansi");
        }
        return result;
    }

    /**
     * Applica soltanto le regole locali di questo passo, senza normalizzazione a monte.
     *
     * L'input deve già appartenere al vocabolario del passo: un operatore diverso
     * interrompe subito la conversione.
     *
     * @param formula formula nel vocabolario di ingresso del passo
     * @return formula riscritta
     * @throws UnrecognizedOperatorException se compare un operatore fuori vocabolario
     */
    public final Formula applyPass(Formula formula) {
        Objects.requireNonNull(formula, "La formula da convertire non può essere null");

        try {
            return new Conversion(forInput(formula)).convert(formula);
        } catch (UnrecognizedOperatorException e) {
            LOGGER.log(Level.SEVERE, getName() + ": albero malformato", e);
            throw e;
        }
    }

    /**
     * Nome leggibile del passo, usato nei log e nei messaggi di errore.
     */
    public String getName() {
        return getClass().getSimpleName();
    }

    //endregion

    //region PUNTI DI ESTENSIONE

    /**
     * Normalizzazione a monte: di default nessuna.
     */
    protected Formula prepare(Formula formula) {
        return formula;
    }

    /**
     * Passo da usare per uno specifico input: di default questa stessa istanza.
     * Un passo i cui parametri dipendono dalla formula restituisce qui una copia
     * configurata per quella formula.
     */
    protected FormulaReducer forInput(Formula formula) {
        return this;
    }

    /**
     * Riscrive un singolo nodo; gli operandi vanno convertiti tramite la conversione.
     *
     * @param node nodo da riscrivere
     * @param conversion conversione in corso, da usare per gli operandi
     * @return nodo riscritto
     */
    protected abstract Formula rewrite(Formula node, Conversion conversion);

    /**
     * Errore per un nodo che questo passo non sa trattare.
     */
    protected final UnrecognizedOperatorException unrecognized(Formula node) {
        return node.getOperator() == null
                ? new UnrecognizedOperatorException(node.getRoot())
                : new UnrecognizedOperatorException(node.getOperator(), getName());
    }

    //endregion

    //region CONVERSIONE CON MEMORIA

    /**
     * Una singola conversione ricorsiva, con memoria per identità dei nodi già trattati.
     */
    protected static final class Conversion {

        private final FormulaReducer reducer;
        private final Map<Formula, Formula> converted = new IdentityHashMap<>();

        private Conversion(FormulaReducer reducer) {
            this.reducer = reducer;
        }

        /**
         * Converte un nodo, riusando il risultato se la stessa istanza è già stata vista.
         */
        public Formula convert(Formula node) {
            Formula result = converted.get(node);
            if (result == null) {
                result = reducer.rewrite(node, this);
                converted.put(node, result);
            }
            return result;
        }
    }

    //endregion
}
