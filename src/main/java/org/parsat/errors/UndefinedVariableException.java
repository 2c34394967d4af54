package org.parsat.errors;

/**
 * La formula riferisce un identificatore assente dall'assegnamento corrente.
 */
public class UndefinedVariableException extends EvaluationException {

    /** Nome dell'identificatore non definito */
    private final String variableName;

    public UndefinedVariableException(String variableName) {
        super("Identificatore '" + variableName + "' non presente nell'assegnamento");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
