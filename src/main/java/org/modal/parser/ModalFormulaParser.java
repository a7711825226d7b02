package org.modal.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.modal.antlr.ModalFormulaBaseVisitor;
import org.modal.antlr.ModalFormulaLexer;
import org.modal.antlr.ModalFormulaParser.AndContext;
import org.modal.antlr.ModalFormulaParser.BoxContext;
import org.modal.antlr.ModalFormulaParser.DiamondContext;
import org.modal.antlr.ModalFormulaParser.ForbiddenContext;
import org.modal.antlr.ModalFormulaParser.FormulaContext;
import org.modal.antlr.ModalFormulaParser.IdContext;
import org.modal.antlr.ModalFormulaParser.IffContext;
import org.modal.antlr.ModalFormulaParser.ImpliesContext;
import org.modal.antlr.ModalFormulaParser.NotContext;
import org.modal.antlr.ModalFormulaParser.ObligationContext;
import org.modal.antlr.ModalFormulaParser.OrContext;
import org.modal.antlr.ModalFormulaParser.ParContext;
import org.modal.antlr.ModalFormulaParser.PermissionContext;
import org.modal.antlr.ModalFormulaParser.VarContext;
import org.modal.formula.Always;
import org.modal.formula.And;
import org.modal.formula.Atom;
import org.modal.formula.Eventually;
import org.modal.formula.Forbidden;
import org.modal.formula.Formula;
import org.modal.formula.Implies;
import org.modal.formula.Not;
import org.modal.formula.Obligation;
import org.modal.formula.Or;
import org.modal.formula.Permission;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.logging.Logger;

/**
 * PARSER FORMULE MODALI - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Implementa un visitor sull'albero di parsing generato dalla grammatica ModalFormula,
 * costruendo la rappresentazione immutabile della formula con precedenze e associatività
 * corrette.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->, ↔): A <-> B ~ (A -> B) & (B -> A)
 * - Implicazione (->, →): associativa a destra
 * - Disgiunzione (|, ∨) e congiunzione (&, ∧): associative a sinistra
 * - Operatori unari prefissi: ! ~ ¬, [] □, <> ◊ ◇, OBL, PERM, FORB
 * - Atomi: identificatori, eventualmente con argomenti P(a, b)
 *
 * Le catene di operatori binari vengono costruite come alberi binari annidati a sinistra,
 * poiché il modello {@link Formula} ha solo connettivi binari.
 */
public class ModalFormulaParser extends ModalFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(ModalFormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Esegue l'intera pipeline ANTLR (lexing, parsing, visita) su una formula testuale.
     *
     * @param formulaText formula in notazione infissa
     * @return formula costruita
     * @throws IllegalArgumentException se il testo è vuoto o sintatticamente errato
     */
    public static Formula parse(String formulaText) {
        if (formulaText == null || formulaText.trim().isEmpty()) {
            throw new IllegalArgumentException("Formula vuota: impossibile effettuare il parsing");
        }

        CharStream input = CharStreams.fromString(formulaText);
        ModalFormulaLexer lexer = new ModalFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        org.modal.antlr.ModalFormulaParser parser = new org.modal.antlr.ModalFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new ModalFormulaParser().visit(tree);

        LOGGER.fine("Formula analizzata: " + formula);
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region CONNETTIVI BINARI

    /**
     * Gestisce catene di biimplicazioni: A <-> B <-> C ~ (A <-> B) & (B <-> C),
     * ciascuna espansa in (A -> B) & (B -> A).
     */
    @Override
    public Formula visitIff(IffContext ctx) {
        if (ctx.IFF().isEmpty()) {
            return visit(ctx.implication(0));
        }

        LOGGER.finest("Elaborazione catena biimplicazioni: " + ctx.IFF().size() + " operatori");

        List<Formula> links = new ArrayList<>();
        Formula previous = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            Formula current = visit(ctx.implication(i));
            links.add(new And(new Implies(previous, current), new Implies(current, previous)));
            previous = current;
        }
        return foldLeft(links, And::new);
    }

    /**
     * Implicazione associativa a destra: A -> B -> C ~ A -> (B -> C).
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return new Implies(antecedent, visit(ctx.implication()));
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        List<Formula> operands = new ArrayList<>();
        for (var conjunctionCtx : ctx.conjunction()) {
            operands.add(visit(conjunctionCtx));
        }
        return foldLeft(operands, Or::new);
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        List<Formula> operands = new ArrayList<>();
        for (var unaryCtx : ctx.unary()) {
            operands.add(visit(unaryCtx));
        }
        return foldLeft(operands, And::new);
    }

    //endregion

    //region OPERATORI UNARI

    @Override
    public Formula visitNot(NotContext ctx) {
        return new Not(visit(ctx.unary()));
    }

    @Override
    public Formula visitBox(BoxContext ctx) {
        return new Always(visit(ctx.unary()));
    }

    @Override
    public Formula visitDiamond(DiamondContext ctx) {
        return new Eventually(visit(ctx.unary()));
    }

    @Override
    public Formula visitObligation(ObligationContext ctx) {
        return new Obligation(visit(ctx.unary()));
    }

    @Override
    public Formula visitPermission(PermissionContext ctx) {
        return new Permission(visit(ctx.unary()));
    }

    @Override
    public Formula visitForbidden(ForbiddenContext ctx) {
        return new Forbidden(visit(ctx.unary()));
    }

    //endregion

    //region ATOMI E PARENTESI

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    /**
     * Il primo identificatore è il nome del predicato, i successivi sono gli argomenti.
     */
    @Override
    public Formula visitId(IdContext ctx) {
        List<TerminalNode> identifiers = ctx.IDENTIFIER();
        String name = identifiers.get(0).getText();

        List<String> args = new ArrayList<>();
        for (int i = 1; i < identifiers.size(); i++) {
            args.add(identifiers.get(i).getText());
        }

        LOGGER.finest("Elaborazione atomo: " + name + " " + args);
        return new Atom(name, args);
    }

    //endregion

    //region SUPPORTO

    private static Formula foldLeft(List<Formula> operands, BinaryOperator<Formula> constructor) {
        Formula result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = constructor.apply(result, operands.get(i));
        }
        return result;
    }

    /**
     * Converte gli errori sintattici di ANTLR in eccezioni invece di stamparli su stderr.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException(
                    "Errore di sintassi alla riga " + line + ", colonna " + charPositionInLine + ": " + msg, e);
        }
    }

    //endregion
}
