package org.parsat.errors;

/**
 * Operatore riconosciuto dalla grammatica ma non appartenente all'insieme
 * {@code ! && ||} (ad esempio {@code +}, {@code ^}, {@code ==}).
 */
public class UnsupportedOperatorException extends EvaluationException {

    /** Simbolo dell'operatore rifiutato, così come appare nel testo */
    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Operatore non supportato: " + operator);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
