package org.parsat.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ALBERO DI ESPRESSIONE - Rappresentazione immutabile di una formula proposizionale
 *
 * Ogni nodo ha un tipo chiuso ({@link Type}) e i figli richiesti dal tipo.
 * Le factory validano gli argomenti, quindi un nodo malformato non può esistere:
 * una volta costruito l'albero è di sola lettura e può essere condiviso tra
 * valutazioni concorrenti senza sincronizzazione.
 *
 * NODI SUPPORTATI:
 * • IDENTIFIER: foglia, riferimento a una variabile
 * • NOT: negazione di un sotto-albero
 * • AND / OR: operatori binari
 * • GROUP: parentesi esplicite, semanticamente trasparenti
 */
public final class Expression {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        IDENTIFIER, // Variabile: a, b, x1, ...
        NOT,        // Negazione: !A
        AND,        // Congiunzione: A && B
        OR,         // Disgiunzione: A || B
        GROUP       // Parentesi: (A)
    }

    private final Type type;

    /** Nome della variabile (solo per nodi IDENTIFIER) */
    private final String name;

    /** Operando sinistro, oppure unico operando per NOT e GROUP */
    private final Expression left;

    /** Operando destro (solo per nodi AND e OR) */
    private final Expression right;

    private Expression(Type type, String name, Expression left, Expression right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    //endregion

    //region FACTORY

    /**
     * Costruisce una foglia che riferisce la variabile indicata.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @throws IllegalArgumentException se il nome è null o vuoto
     */
    public static Expression identifier(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome identificatore non può essere null o vuoto");
        }
        return new Expression(Type.IDENTIFIER, name.trim(), null, null);
    }

    public static Expression not(Expression operand) {
        return new Expression(Type.NOT, null, requireOperand(operand, "negazione"), null);
    }

    public static Expression and(Expression left, Expression right) {
        return new Expression(Type.AND, null, requireOperand(left, "congiunzione"), requireOperand(right, "congiunzione"));
    }

    public static Expression or(Expression left, Expression right) {
        return new Expression(Type.OR, null, requireOperand(left, "disgiunzione"), requireOperand(right, "disgiunzione"));
    }

    public static Expression group(Expression inner) {
        return new Expression(Type.GROUP, null, requireOperand(inner, "parentesi"), null);
    }

    private static Expression requireOperand(Expression operand, String construct) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per " + construct + " non può essere null");
        }
        return operand;
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile per nodi IDENTIFIER, null altrimenti
     */
    public String getName() {
        return name;
    }

    /**
     * Unico operando di NOT e GROUP.
     */
    public Expression getOperand() {
        return left;
    }

    public Expression getLeft() {
        return left;
    }

    /**
     * @return operando destro per AND e OR, null altrimenti
     */
    public Expression getRight() {
        return right;
    }

    /**
     * Raccoglie gli identificatori nell'ordine della prima apparizione (da sinistra a destra).
     *
     * @return insieme ordinato e senza duplicati dei nomi di variabile
     */
    public List<String> identifiers() {
        Set<String> collected = new LinkedHashSet<>();
        collectIdentifiers(collected);
        return new ArrayList<>(collected);
    }

    private void collectIdentifiers(Set<String> collected) {
        switch (type) {
            case IDENTIFIER -> collected.add(name);
            case NOT, GROUP -> left.collectIdentifiers(collected);
            case AND, OR -> {
                left.collectIdentifiers(collected);
                right.collectIdentifiers(collected);
            }
        }
    }

    //endregion

    //region OUTPUT E UGUAGLIANZA

    /**
     * Rappresentazione infissa ricostruita dall'albero.
     * Oltre ai nodi GROUP, aggiunge parentesi solo dove la precedenza
     * degli operatori altererebbe la struttura (alberi costruiti a mano).
     */
    @Override
    public String toString() {
        return switch (type) {
            case IDENTIFIER -> name;
            case NOT -> "!" + bracketIf(left, left.type == Type.AND || left.type == Type.OR);
            case AND -> bracketIf(left, left.type == Type.OR) + " && " + bracketIf(right, right.type == Type.OR);
            case OR -> left + " || " + right;
            case GROUP -> "(" + left + ")";
        };
    }

    private static String bracketIf(Expression operand, boolean needsBrackets) {
        return needsBrackets ? "(" + operand + ")" : operand.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Expression other = (Expression) obj;
        return type == other.type &&
                Objects.equals(name, other.name) &&
                Objects.equals(left, other.left) &&
                Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, left, right);
    }

    //endregion
}
