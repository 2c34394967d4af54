package org.parsat.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.parsat.antlr.BooleanFormulaLexer;
import org.parsat.antlr.BooleanFormulaParser;
import org.parsat.antlr.BooleanFormulaParser.FormulaContext;
import org.parsat.errors.EvaluationException;
import org.parsat.errors.FormulaException;
import org.parsat.errors.FormulaParseException;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Punto di ingresso dal testo all'albero di espressione
 *
 * Pipeline: Lexing -> Parsing (ANTLR) -> Visitor -> {@link Expression}.
 *
 * Il primo errore lessicale o sintattico interrompe il parsing: ANTLR non
 * recupera in silenzio e non stampa su stderr, e nessun albero parziale
 * viene restituito. L'istanza è priva di stato e riutilizzabile.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Converte il testo di una formula nel suo albero.
     *
     * @param formulaText formula in notazione infissa, ad esempio {@code a && !b || c}
     * @return albero immutabile della formula
     * @throws FormulaParseException se il testo è vuoto o non rispetta la grammatica
     * @throws EvaluationException se la formula usa operatori o costrutti fuori dalla logica proposizionale
     */
    public Expression parse(String formulaText) throws FormulaException {
        if (formulaText == null || formulaText.trim().isEmpty()) {
            throw new FormulaParseException("Formula vuota");
        }

        // Setup pipeline ANTLR
        CharStream input = CharStreams.fromString(formulaText);
        BooleanFormulaLexer lexer = new BooleanFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        BooleanFormulaParser parser = new BooleanFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        FormulaContext tree;
        try {
            tree = parser.formula();
        } catch (ParseCancellationException e) {
            SyntaxError error = (SyntaxError) e.getCause();
            LOGGER.fine("Formula rifiutata dal parser: " + formulaText);
            throw new FormulaParseException(
                    "Errore di sintassi alla posizione " + error.line + ":" + error.column + " - " + error.getMessage(),
                    error.line, error.column, error);
        }

        return new ExpressionTreeBuilder().build(tree);
    }

    //region GESTIONE ERRORI ANTLR

    /**
     * Interrompe lexer e parser al primo errore segnalato.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new ParseCancellationException(new SyntaxError(msg, line, charPositionInLine, e));
        }
    }

    /** Posizione e descrizione del primo errore, trasportate fuori da ANTLR */
    private static final class SyntaxError extends RuntimeException {

        final int line;
        final int column;

        SyntaxError(String message, int line, int column, RecognitionException cause) {
            super(message, cause);
            this.line = line;
            this.column = column;
        }
    }

    //endregion
}
