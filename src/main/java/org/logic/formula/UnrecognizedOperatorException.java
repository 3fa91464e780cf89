package org.logic.formula;

/**
 * Segnala un operatore fuori dall'insieme atteso in quel punto della riduzione.
 *
 * È una violazione del contratto da parte del chiamante (albero malformato o passo
 * applicato a un vocabolario che non gli compete): non va recuperata né ritentata.
 */
public class UnrecognizedOperatorException extends IllegalArgumentException {

    private final String operatorSymbol;

    /**
     * @param operatorSymbol simbolo non riconosciuto (può essere null)
     */
    public UnrecognizedOperatorException(String operatorSymbol) {
        super("Operatore non riconosciuto: " + operatorSymbol);
        this.operatorSymbol = operatorSymbol;
    }

    /**
     * @param operator operatore noto ma non ammesso dal passo corrente
     * @param passName nome del passo che lo ha incontrato
     */
    public UnrecognizedOperatorException(Operator operator, String passName) {
        super("Operatore non riconosciuto da " + passName + ": " + operator.getSymbol());
        this.operatorSymbol = operator.getSymbol();
    }

    public String getOperatorSymbol() {
        return operatorSymbol;
    }
}
