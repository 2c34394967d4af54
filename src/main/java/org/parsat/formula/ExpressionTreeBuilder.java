package org.parsat.formula;

import org.antlr.v4.runtime.Token;
import org.parsat.antlr.BooleanFormulaBaseVisitor;
import org.parsat.antlr.BooleanFormulaParser.AndContext;
import org.parsat.antlr.BooleanFormulaParser.BinaryContext;
import org.parsat.antlr.BooleanFormulaParser.FormulaContext;
import org.parsat.antlr.BooleanFormulaParser.GroupContext;
import org.parsat.antlr.BooleanFormulaParser.IdentifierContext;
import org.parsat.antlr.BooleanFormulaParser.LiteralContext;
import org.parsat.antlr.BooleanFormulaParser.NotContext;
import org.parsat.antlr.BooleanFormulaParser.OrContext;
import org.parsat.antlr.BooleanFormulaParser.UnaryContext;
import org.parsat.errors.EvaluationException;
import org.parsat.errors.UnsupportedExpressionException;
import org.parsat.errors.UnsupportedOperatorException;

import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO - Convertitore da albero sintattico ANTLR a {@link Expression}
 *
 * Implementa un visitor sulla grammatica generica BooleanFormula e decide quali
 * costrutti appartengono alla logica proposizionale. La grammatica accetta anche
 * operatori aritmetici, relazionali e bit a bit: qui vengono rifiutati con
 * {@link UnsupportedOperatorException}, i letterali numerici con
 * {@link UnsupportedExpressionException}.
 *
 * CORRISPONDENZE:
 * - identificatore -> IDENTIFIER
 * - !A -> NOT
 * - A && B -> AND (associativo a sinistra)
 * - A || B -> OR (associativo a sinistra)
 * - (A) -> GROUP, le parentesi sono conservate come nodo esplicito
 */
class ExpressionTreeBuilder extends BooleanFormulaBaseVisitor<Expression> {

    private static final Logger LOGGER = Logger.getLogger(ExpressionTreeBuilder.class.getName());

    /**
     * Costruisce l'albero completo a partire dalla radice del parse tree.
     *
     * @param ctx contesto della formula completa
     * @return albero immutabile della formula
     * @throws EvaluationException se la formula usa operatori o costrutti non supportati
     */
    Expression build(FormulaContext ctx) throws EvaluationException {
        try {
            return visit(ctx);
        } catch (RejectedConstruct rejected) {
            throw rejected.reason;
        }
    }

    //region VISITOR

    @Override
    public Expression visitFormula(FormulaContext ctx) {
        Expression expression = visit(ctx.expression());
        LOGGER.fine("Albero costruito: " + expression);
        return expression;
    }

    @Override
    public Expression visitGroup(GroupContext ctx) {
        return Expression.group(visit(ctx.expression()));
    }

    @Override
    public Expression visitIdentifier(IdentifierContext ctx) {
        return Expression.identifier(ctx.IDENTIFIER().getText());
    }

    @Override
    public Expression visitNot(NotContext ctx) {
        return Expression.not(visit(ctx.expression()));
    }

    @Override
    public Expression visitAnd(AndContext ctx) {
        return Expression.and(visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitOr(OrContext ctx) {
        return Expression.or(visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitLiteral(LiteralContext ctx) {
        throw reject(new UnsupportedExpressionException(
                "Letterale numerico non supportato: " + ctx.NUMBER().getText()));
    }

    @Override
    public Expression visitUnary(UnaryContext ctx) {
        throw rejectOperator(ctx.op);
    }

    @Override
    public Expression visitBinary(BinaryContext ctx) {
        throw rejectOperator(ctx.op);
    }

    //endregion

    //region GESTIONE COSTRUTTI NON SUPPORTATI

    private RejectedConstruct rejectOperator(Token operator) {
        LOGGER.fine("Operatore rifiutato alla posizione " + operator.getLine() + ":" + operator.getCharPositionInLine());
        return reject(new UnsupportedOperatorException(operator.getText()));
    }

    private RejectedConstruct reject(EvaluationException reason) {
        return new RejectedConstruct(reason);
    }

    /**
     * I metodi visit non possono dichiarare eccezioni controllate:
     * il motivo viaggia qui dentro fino a {@link #build(FormulaContext)}.
     */
    private static final class RejectedConstruct extends RuntimeException {

        private final EvaluationException reason;

        RejectedConstruct(EvaluationException reason) {
            super(reason.getMessage(), reason, false, false);
            this.reason = reason;
        }
    }

    //endregion
}
