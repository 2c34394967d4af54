package org.parsat.errors;

/**
 * Testo della formula malformato: errore lessicale o sintattico.
 *
 * Nessun albero parziale viene prodotto quando questa eccezione è lanciata.
 */
public class FormulaParseException extends FormulaException {

    /** Riga del primo errore (1-based), 0 se non disponibile */
    private final int line;

    /** Colonna del primo errore (0-based), -1 se non disponibile */
    private final int column;

    public FormulaParseException(String message) {
        this(message, 0, -1, null);
    }

    public FormulaParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
