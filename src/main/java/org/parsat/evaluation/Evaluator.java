package org.parsat.evaluation;

import org.parsat.errors.EvaluationException;
import org.parsat.errors.FormulaException;
import org.parsat.errors.UndefinedVariableException;
import org.parsat.errors.UnsupportedExpressionException;
import org.parsat.formula.Expression;
import org.parsat.formula.FormulaParser;
import org.parsat.support.Assignment;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VALUTATORE - Interpretazione ricorsiva di un albero rispetto a un assegnamento
 *
 * SEMANTICA:
 * • IDENTIFIER: valore della variabile, errore se assente dall'assegnamento
 * • NOT: negazione logica dell'operando
 * • AND / OR: congiunzione / disgiunzione
 * • GROUP: valore dell'operando invariato
 *
 * POLITICA DI VALUTAZIONE:
 * AND e OR valutano sempre entrambi gli operandi, senza cortocircuito. Le foglie
 * sono letture pure, quindi il risultato non cambia; in compenso ogni identificatore
 * dell'albero viene visitato per qualunque assegnamento, e una variabile non
 * definita viene segnalata sempre, indipendentemente dai valori delle altre.
 *
 * La valutazione è deterministica e senza effetti collaterali: l'istanza non ha
 * stato ed è condivisibile tra thread.
 */
public class Evaluator {

    private static final Logger LOGGER = Logger.getLogger(Evaluator.class.getName());

    /**
     * Valuta l'albero rispetto all'assegnamento.
     *
     * @param node radice dell'albero da valutare
     * @param assignment valori delle variabili
     * @return valore di verità della formula
     * @throws UndefinedVariableException se un identificatore non è assegnato
     * @throws UnsupportedExpressionException se manca un nodo dell'albero
     */
    public boolean evaluate(Expression node, Assignment assignment) throws EvaluationException {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }

        boolean result = evaluateNode(node, assignment);
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(node + " con " + assignment + " -> " + result);
        }
        return result;
    }

    /**
     * Analizza il testo della formula e la valuta sull'assegnamento dato.
     *
     * @param formulaText formula in notazione infissa
     * @param assignment valori delle variabili
     * @throws FormulaException per errori di parsing, costruzione o valutazione
     */
    public boolean evaluate(String formulaText, Assignment assignment) throws FormulaException {
        return evaluate(new FormulaParser().parse(formulaText), assignment);
    }

    private boolean evaluateNode(Expression node, Assignment assignment) throws EvaluationException {
        if (node == null) {
            throw new UnsupportedExpressionException("Nodo mancante nell'albero di espressione");
        }

        return switch (node.getType()) {
            case IDENTIFIER -> lookup(node.getName(), assignment);

            case NOT -> !evaluateNode(node.getOperand(), assignment);

            case AND -> {
                // Entrambi gli operandi, senza cortocircuito
                boolean left = evaluateNode(node.getLeft(), assignment);
                boolean right = evaluateNode(node.getRight(), assignment);
                yield left & right;
            }

            case OR -> {
                boolean left = evaluateNode(node.getLeft(), assignment);
                boolean right = evaluateNode(node.getRight(), assignment);
                yield left | right;
            }

            case GROUP -> evaluateNode(node.getOperand(), assignment);
        };
    }

    private boolean lookup(String name, Assignment assignment) throws UndefinedVariableException {
        Boolean value = assignment.valueOf(name);
        if (value == null) {
            throw new UndefinedVariableException(name);
        }
        return value;
    }
}
