package org.tel.formula;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.tel.antlr.TemporalFormulaBaseVisitor;
import org.tel.antlr.TemporalFormulaLexer;
import org.tel.antlr.TemporalFormulaParser;
import org.tel.antlr.TemporalFormulaParser.AtomContext;
import org.tel.antlr.TemporalFormulaParser.AtomicFormulaContext;
import org.tel.antlr.TemporalFormulaParser.ConjunctionContext;
import org.tel.antlr.TemporalFormulaParser.ConstantContext;
import org.tel.antlr.TemporalFormulaParser.ConstantFormulaContext;
import org.tel.antlr.TemporalFormulaParser.CountedContext;
import org.tel.antlr.TemporalFormulaParser.DisjunctionContext;
import org.tel.antlr.TemporalFormulaParser.DynamicContext;
import org.tel.antlr.TemporalFormulaParser.EquivalenceContext;
import org.tel.antlr.TemporalFormulaParser.FunctionTermContext;
import org.tel.antlr.TemporalFormulaParser.ImplicationContext;
import org.tel.antlr.TemporalFormulaParser.NumberTermContext;
import org.tel.antlr.TemporalFormulaParser.ParenthesizedContext;
import org.tel.antlr.TemporalFormulaParser.ReverseImplicationContext;
import org.tel.antlr.TemporalFormulaParser.StatementContext;
import org.tel.antlr.TemporalFormulaParser.StringTermContext;
import org.tel.antlr.TemporalFormulaParser.TemporalBinaryContext;
import org.tel.antlr.TemporalFormulaParser.TermContext;
import org.tel.antlr.TemporalFormulaParser.UnaryContext;
import org.tel.support.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * PARSER FORMULE TEMPORALI - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sull'albero prodotto dalla grammatica TemporalFormula e
 * costruisce le formule immutabili del modello, espandendo lo zucchero sintattico
 * (;>, <;, >>) direttamente nei nodi di base.
 *
 * PRECEDENZE (dalla più forte):
 * - Operatori prefissi: ~ < <: > >: <? <* >? >* << >>, n < / n <: / n > / n >: e operatori dinamici
 * - Operatori temporali binari: <? <* >? >* ;> ;>: <; <:;
 * - Congiunzione (&), disgiunzione (|)
 * - Implicazione (->, associativa a destra), implicazione inversa (<-), equivalenza (<>)
 *
 * Gli errori di sintassi non vengono recuperati: la prima segnalazione del
 * lexer o del parser interrompe l'analisi con IllegalArgumentException.
 */
public class FormulaParser extends TemporalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private final PathBuilder pathBuilder = new PathBuilder();

    //region PUNTI DI INGRESSO

    /**
     * Analizza un intero programma composto da istruzioni "#stadio formula."
     *
     * @param text sorgente del programma
     * @return formule raggruppate per stadio
     * @throws IllegalArgumentException se il testo non rispetta la grammatica
     */
    public static StagedProgram parseProgram(String text) {
        TemporalFormulaParser parser = createParser(text);
        FormulaParser converter = new FormulaParser();
        StagedProgram program = new StagedProgram();

        for (StatementContext statement : parser.program().statement()) {
            Stage stage = Stage.fromName(statement.STAGE().getText());
            program.add(stage, converter.visit(statement.formula()));
        }

        LOGGER.fine("Programma analizzato: " + program.size() + " formule");
        return program;
    }

    /**
     * Analizza una singola formula.
     */
    public static Formula parseFormula(String text) {
        TemporalFormulaParser parser = createParser(text);
        return new FormulaParser().visit(parser.singleFormula().formula());
    }

    /**
     * Analizza una singola espressione di cammino.
     */
    public static PathExpression parsePath(String text) {
        TemporalFormulaParser parser = createParser(text);
        return new FormulaParser().pathBuilder.visit(parser.singlePath().path());
    }

    private static TemporalFormulaParser createParser(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }
        TemporalFormulaLexer lexer = new TemporalFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);

        TemporalFormulaParser parser = new TemporalFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);
        return parser;
    }

    //endregion

    //region FORMULE ELEMENTARI

    @Override
    public Formula visitParenthesized(ParenthesizedContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitConstantFormula(ConstantFormulaContext ctx) {
        ConstantContext constant = ctx.constant();
        if (constant.TRUE() != null) return Formula.TRUE;
        if (constant.FALSE() != null) return Formula.FALSE;
        if (constant.INITIAL() != null) return Formula.INITIAL;
        return Formula.FINAL;
    }

    @Override
    public Formula visitAtomicFormula(AtomicFormulaContext ctx) {
        return buildAtom(ctx.atom());
    }

    private Formula buildAtom(AtomContext ctx) {
        List<Term> arguments = new ArrayList<>();
        for (TermContext term : ctx.term()) {
            arguments.add(buildTerm(term));
        }
        return Formula.atom(ctx.IDENTIFIER().getText(), arguments, ctx.MINUS() == null);
    }

    private Term buildTerm(TermContext ctx) {
        if (ctx instanceof NumberTermContext number) {
            long value = Long.parseLong(number.NUMBER().getText());
            return Term.number(number.MINUS() != null ? -value : value);
        }
        if (ctx instanceof StringTermContext string) {
            return Term.symbol(string.STRING().getText());
        }
        FunctionTermContext function = (FunctionTermContext) ctx;
        List<Term> arguments = new ArrayList<>();
        for (TermContext argument : function.term()) {
            arguments.add(buildTerm(argument));
        }
        return Term.function(function.IDENTIFIER().getText(), arguments);
    }

    //endregion

    //region OPERATORI TEMPORALI E DINAMICI

    @Override
    public Formula visitUnary(UnaryContext ctx) {
        Formula operand = visit(ctx.formula());

        return switch (ctx.op.getType()) {
            case TemporalFormulaParser.NEGATION -> Formula.not(operand);
            case TemporalFormulaParser.LT -> Formula.previous(operand);
            case TemporalFormulaParser.LT_COLON -> Formula.weakPrevious(operand);
            case TemporalFormulaParser.GT -> Formula.next(operand);
            case TemporalFormulaParser.GT_COLON -> Formula.weakNext(operand);
            case TemporalFormulaParser.LT_QUESTION -> Formula.once(operand);
            case TemporalFormulaParser.LT_STAR -> Formula.historically(operand);
            case TemporalFormulaParser.GT_QUESTION -> Formula.eventually(operand);
            case TemporalFormulaParser.GT_STAR -> Formula.always(operand);
            case TemporalFormulaParser.LT_LT -> Formula.initially(operand);
            case TemporalFormulaParser.GT_GT -> Formula.finallyAt(operand);
            default -> throw unexpectedOperator(ctx.op);
        };
    }

    @Override
    public Formula visitCounted(CountedContext ctx) {
        int count = Integer.parseInt(ctx.NUMBER().getText());
        Formula operand = visit(ctx.formula());

        return switch (ctx.op.getType()) {
            case TemporalFormulaParser.LT -> Formula.previous(count, operand);
            case TemporalFormulaParser.LT_COLON -> Formula.weakPrevious(count, operand);
            case TemporalFormulaParser.GT -> Formula.next(count, operand);
            case TemporalFormulaParser.GT_COLON -> Formula.weakNext(count, operand);
            default -> throw unexpectedOperator(ctx.op);
        };
    }

    @Override
    public Formula visitTemporalBinary(TemporalBinaryContext ctx) {
        Formula left = visit(ctx.formula(0));
        Formula right = visit(ctx.formula(1));

        return switch (ctx.op.getType()) {
            case TemporalFormulaParser.LT_QUESTION -> Formula.since(left, right);
            case TemporalFormulaParser.LT_STAR -> Formula.trigger(left, right);
            case TemporalFormulaParser.GT_QUESTION -> Formula.until(left, right);
            case TemporalFormulaParser.GT_STAR -> Formula.release(left, right);
            case TemporalFormulaParser.SEMI_GT -> Formula.sequenceNext(left, right);
            case TemporalFormulaParser.SEMI_GT_COLON -> Formula.weakSequenceNext(left, right);
            case TemporalFormulaParser.LT_SEMI -> Formula.sequencePrevious(left, right);
            case TemporalFormulaParser.LT_COLON_SEMI -> Formula.weakSequencePrevious(left, right);
            default -> throw unexpectedOperator(ctx.op);
        };
    }

    @Override
    public Formula visitDynamic(DynamicContext ctx) {
        PathExpression path = pathBuilder.visit(ctx.path());
        Formula operand = visit(ctx.formula());
        return ctx.op.getType() == TemporalFormulaParser.BOX
                ? Formula.box(path, operand)
                : Formula.diamond(path, operand);
    }

    //endregion

    //region CONNETTIVI BOOLEANI

    @Override
    public Formula visitConjunction(ConjunctionContext ctx) {
        return Formula.and(visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    @Override
    public Formula visitDisjunction(DisjunctionContext ctx) {
        return Formula.or(visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        return Formula.implies(visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    @Override
    public Formula visitReverseImplication(ReverseImplicationContext ctx) {
        return Formula.impliedBy(visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    @Override
    public Formula visitEquivalence(EquivalenceContext ctx) {
        return Formula.iff(visit(ctx.formula(0)), visit(ctx.formula(1)));
    }

    private static IllegalArgumentException unexpectedOperator(Token op) {
        return new IllegalArgumentException("Operatore inatteso '" + op.getText()
                + "' alla riga " + op.getLine() + ":" + op.getCharPositionInLine());
    }

    //endregion

    //region CAMMINI

    /**
     * Costruisce le espressioni di cammino; i test delegano al visitor delle formule.
     */
    private class PathBuilder extends TemporalFormulaBaseVisitor<PathExpression> {

        @Override
        public PathExpression visitParenthesizedPath(TemporalFormulaParser.ParenthesizedPathContext ctx) {
            return visit(ctx.path());
        }

        @Override
        public PathExpression visitStarPath(TemporalFormulaParser.StarPathContext ctx) {
            return PathExpression.star(visit(ctx.path()));
        }

        @Override
        public PathExpression visitTestPath(TemporalFormulaParser.TestPathContext ctx) {
            return PathExpression.test(FormulaParser.this.visit(ctx.formula()));
        }

        @Override
        public PathExpression visitStepPath(TemporalFormulaParser.StepPathContext ctx) {
            return PathExpression.step();
        }

        @Override
        public PathExpression visitAtomPath(TemporalFormulaParser.AtomPathContext ctx) {
            return PathExpression.atomStep(buildAtom(ctx.atom()));
        }

        @Override
        public PathExpression visitSequencePath(TemporalFormulaParser.SequencePathContext ctx) {
            return PathExpression.sequence(visit(ctx.path(0)), visit(ctx.path(1)));
        }

        @Override
        public PathExpression visitChoicePath(TemporalFormulaParser.ChoicePathContext ctx) {
            return PathExpression.choice(visit(ctx.path(0)), visit(ctx.path(1)));
        }
    }

    /**
     * Trasforma la prima segnalazione di ANTLR in un'eccezione.
     */
    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException("Errore di sintassi alla riga " + line + ":"
                    + charPositionInLine + " - " + msg, e);
        }
    }

    //endregion
}
