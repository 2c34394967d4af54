package org.parsat.errors;

/**
 * Nodo o costrutto sintattico fuori dalla logica proposizionale supportata
 * (letterali numerici, nodi mancanti).
 */
public class UnsupportedExpressionException extends EvaluationException {

    public UnsupportedExpressionException(String message) {
        super(message);
    }
}
