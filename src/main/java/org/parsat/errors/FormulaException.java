package org.parsat.errors;

/**
 * Radice della gerarchia di errori del solutore.
 *
 * Ogni errore è deterministico rispetto all'input: la stessa formula con lo stesso
 * insieme di variabili produce sempre lo stesso errore, quindi nessun chiamante
 * deve ritentare l'operazione.
 */
public abstract class FormulaException extends Exception {

    protected FormulaException(String message) {
        super(message);
    }

    protected FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
