package org.modal.tableaux;

import org.modal.formula.Always;
import org.modal.formula.And;
import org.modal.formula.Atom;
import org.modal.formula.Eventually;
import org.modal.formula.Forbidden;
import org.modal.formula.Formula;
import org.modal.formula.FormulaVisitor;
import org.modal.formula.Implies;
import org.modal.formula.Not;
import org.modal.formula.Obligation;
import org.modal.formula.Or;
import org.modal.formula.Permission;
import org.modal.formula.SignedFormula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESPANSIONE TABLEAUX - Applicazione di una regola a una formula con segno
 *
 * Un'istanza espande una sola formula in un solo mondo di un ramo. Le regole
 * non biforcanti modificano il ramo e restituiscono una lista con il ramo stesso;
 * le regole biforcanti restituiscono due rami indipendenti (copia profonda).
 *
 * REGOLE MODALI:
 * - □a vera: a in ogni mondo accessibile (raggiungibile se la logica è transitiva),
 *   mondo forzato se la logica è seriale e non ci sono successori
 * - □a falsa, ◊a vera: nuovo mondo accessibile con ¬a / a
 * - ◊a falsa: ¬a in ogni mondo accessibile, nessun mondo creato
 *
 * REGOLE DEONTICHE:
 * - O(a) vera, P(a) falsa, F(a) vera: universali, mondo forzato se nessuno è accessibile
 * - O(a) falsa, P(a) vera, F(a) falsa: esistenziali, creano sempre un mondo
 * I mondi deontici hanno solo l'arco dal mondo corrente e non ricevono storici.
 */
final class TableauxExpansion implements FormulaVisitor<List<TableauxBranch>> {

    private static final Logger LOGGER = Logger.getLogger(TableauxExpansion.class.getName());

    //region PRIORITÀ DELLE REGOLE

    /** Regole α: non biforcano e non creano mondi */
    static final int PRIORITY_ALPHA = 0;

    /** □ vera, ◊ falsa */
    static final int PRIORITY_MODAL_UNIVERSAL = 1;

    /** Regole che creano mondi */
    static final int PRIORITY_WORLD_CREATION = 2;

    /** O vera, P falsa, F vera */
    static final int PRIORITY_DEONTIC_UNIVERSAL = 3;

    /** Regole β: biforcano il ramo */
    static final int PRIORITY_BETA = 4;

    //endregion

    private final TableauxBranch branch;
    private final int worldId;
    private final SignedFormula source;
    private final boolean negated;
    private final ModalLogicType logicType;
    private final ProofTrace trace;
    private final TableauxStatistics statistics;

    TableauxExpansion(TableauxBranch branch, int worldId, SignedFormula source, ModalLogicType logicType,
                      ProofTrace trace, TableauxStatistics statistics) {
        this.branch = branch;
        this.worldId = worldId;
        this.source = source;
        this.negated = source.negated();
        this.logicType = logicType;
        this.trace = trace;
        this.statistics = statistics;
    }

    /**
     * Applica la regola corrispondente alla formula sorgente.
     *
     * @return rami successori (uno o due)
     */
    List<TableauxBranch> apply() {
        return source.formula().accept(this);
    }

    /**
     * Priorità di espansione di una formula con segno: valori minori vengono espansi prima.
     */
    static int priorityOf(SignedFormula signedFormula) {
        return signedFormula.formula().accept(new RulePriority(signedFormula.negated()));
    }

    //region CONNETTIVI PROPOSIZIONALI

    @Override
    public List<TableauxBranch> visitAtom(Atom atom) {
        throw new IllegalStateException("Gli atomi non richiedono espansione: " + atom);
    }

    @Override
    public List<TableauxBranch> visitNot(Not not) {
        return alpha(negated ? "doppia negazione" : "negazione", new SignedFormula(not.operand(), !negated));
    }

    @Override
    public List<TableauxBranch> visitAnd(And and) {
        if (negated) {
            return beta("congiunzione negata", SignedFormula.negative(and.left()), SignedFormula.negative(and.right()));
        }
        return alpha("congiunzione", SignedFormula.positive(and.left()), SignedFormula.positive(and.right()));
    }

    @Override
    public List<TableauxBranch> visitOr(Or or) {
        if (negated) {
            return alpha("disgiunzione negata", SignedFormula.negative(or.left()), SignedFormula.negative(or.right()));
        }
        return beta("disgiunzione", SignedFormula.positive(or.left()), SignedFormula.positive(or.right()));
    }

    @Override
    public List<TableauxBranch> visitImplies(Implies implies) {
        if (negated) {
            return alpha("implicazione negata",
                    SignedFormula.positive(implies.left()), SignedFormula.negative(implies.right()));
        }
        return beta("implicazione", SignedFormula.negative(implies.left()), SignedFormula.positive(implies.right()));
    }

    private List<TableauxBranch> alpha(String ruleName, SignedFormula... conclusions) {
        World world = branch.getWorld(worldId);
        List<String> effects = new ArrayList<>();
        for (SignedFormula conclusion : conclusions) {
            world.addFormula(conclusion);
            effects.add(describe(worldId, conclusion));
        }
        trace.recordExpansion(ruleName, worldId, source, String.join(", ", effects));
        return List.of(branch);
    }

    private List<TableauxBranch> beta(String ruleName, SignedFormula left, SignedFormula right) {
        TableauxBranch leftBranch = branch.copy();
        TableauxBranch rightBranch = branch;
        leftBranch.getWorld(worldId).addFormula(left);
        rightBranch.getWorld(worldId).addFormula(right);
        statistics.incrementBranchSplits();

        trace.recordExpansion(ruleName, worldId, source,
                "ramo 1: " + describe(worldId, left) + " | ramo 2: " + describe(worldId, right));
        return List.of(leftBranch, rightBranch);
    }

    //endregion

    //region OPERATORI MODALI

    @Override
    public List<TableauxBranch> visitAlways(Always always) {
        Formula body = always.operand();
        if (negated) {
            return modalExistential("box negato", SignedFormula.negative(body));
        }

        branch.recordBox(worldId, body);
        Set<Integer> targets = modalTargets();
        List<String> effects = new ArrayList<>();
        if (targets.isEmpty() && logicType.isSerial()) {
            int successor = createSuccessor();
            effects.add("nuovo mondo seriale w" + successor);
            targets.add(successor);
        }
        if (logicType.isReflexive()) {
            targets.add(worldId);
        }
        addToWorlds(targets, SignedFormula.positive(body), effects);
        trace.recordExpansion("box", worldId, source, joinEffects(effects));
        return List.of(branch);
    }

    @Override
    public List<TableauxBranch> visitEventually(Eventually eventually) {
        Formula body = eventually.operand();
        if (!negated) {
            return modalExistential("diamond", SignedFormula.positive(body));
        }

        branch.recordNegatedDiamond(worldId, body);
        Set<Integer> targets = modalTargets();
        if (logicType.isReflexive()) {
            targets.add(worldId);
        }
        List<String> effects = new ArrayList<>();
        addToWorlds(targets, SignedFormula.negative(body), effects);
        trace.recordExpansion("diamond negato", worldId, source, joinEffects(effects));
        return List.of(branch);
    }

    private List<TableauxBranch> modalExistential(String ruleName, SignedFormula conclusion) {
        int successor = createSuccessor();
        branch.getWorld(successor).addFormula(conclusion);
        trace.recordExpansion(ruleName, worldId, source,
                "nuovo mondo w" + successor + " (w" + worldId + " → w" + successor + "), "
                        + describe(successor, conclusion));
        return List.of(branch);
    }

    /**
     * Mondi su cui agiscono le regole universali aletiche: accessibili in un passo,
     * oppure raggiungibili con la chiusura transitiva nelle logiche transitive.
     */
    private Set<Integer> modalTargets() {
        if (logicType.isTransitive()) {
            return new LinkedHashSet<>(branch.getReachableWorlds(worldId));
        }
        return branch.getAccessibleWorlds(worldId);
    }

    /**
     * Crea un mondo accessibile dal mondo corrente rispettando le condizioni della logica
     * e vi propaga gli storici di □ e ¬◊ dei mondi che lo vedono.
     *
     * PROCESSO:
     * 1. arco w → w' (più w' → w' nelle logiche riflessive)
     * 2. S4: archi da ogni antenato di w; S5: archi in entrambe le direzioni con ogni mondo
     * 3. propagazione degli storici delle sorgenti: w (K, T, D), w e antenati (S4), tutti (S5)
     * 4. corpi delle □ vere ancora non espanse in w
     */
    private int createSuccessor() {
        Set<Integer> ancestors = logicType.isTransitive() ? branch.getAncestors(worldId) : Set.of();
        Set<Integer> existing = new LinkedHashSet<>(branch.getWorlds().keySet());

        World successor = branch.createWorld();
        int successorId = successor.getId();
        statistics.incrementWorldsCreated();

        branch.addAccessibility(worldId, successorId);
        if (logicType.isReflexive()) {
            branch.addAccessibility(successorId, successorId);
        }

        Set<Integer> sources = new LinkedHashSet<>();
        sources.add(worldId);
        if (logicType.isEuclidean()) {
            for (Integer other : existing) {
                branch.addAccessibility(other, successorId);
                branch.addAccessibility(successorId, other);
            }
            sources.addAll(existing);
        } else if (logicType.isTransitive()) {
            for (Integer ancestor : ancestors) {
                branch.addAccessibility(ancestor, successorId);
            }
            sources.addAll(ancestors);
        }

        for (Integer sourceId : sources) {
            for (Formula body : branch.getBoxHistory(sourceId)) {
                successor.addFormula(body, false);
            }
            for (Formula body : branch.getNegatedDiamondHistory(sourceId)) {
                successor.addFormula(body, true);
            }
        }

        World current = branch.getWorld(worldId);
        for (Formula formula : current.getFormulas()) {
            if (formula instanceof Always && !current.isExpanded(SignedFormula.positive(formula))) {
                successor.addFormula(((Always) formula).operand(), false);
            }
        }

        LOGGER.fine("Creato mondo w" + successorId + " da w" + worldId + " (logica " + logicType + ")");
        return successorId;
    }

    //endregion

    //region OPERATORI DEONTICI

    @Override
    public List<TableauxBranch> visitObligation(Obligation obligation) {
        if (negated) {
            return deonticExistential("obbligo negato", SignedFormula.negative(obligation.operand()));
        }
        return deonticUniversal("obbligo", SignedFormula.positive(obligation.operand()));
    }

    @Override
    public List<TableauxBranch> visitPermission(Permission permission) {
        if (negated) {
            return deonticUniversal("permesso negato", SignedFormula.negative(permission.operand()));
        }
        return deonticExistential("permesso", SignedFormula.positive(permission.operand()));
    }

    @Override
    public List<TableauxBranch> visitForbidden(Forbidden forbidden) {
        if (negated) {
            return deonticExistential("divieto negato", SignedFormula.positive(forbidden.operand()));
        }
        return deonticUniversal("divieto", SignedFormula.negative(forbidden.operand()));
    }

    private List<TableauxBranch> deonticUniversal(String ruleName, SignedFormula conclusion) {
        Set<Integer> targets = branch.getAccessibleWorlds(worldId);
        List<String> effects = new ArrayList<>();
        if (targets.isEmpty()) {
            int ideal = createDeonticWorld();
            effects.add("nuovo mondo ideale w" + ideal);
            targets.add(ideal);
        }
        addToWorlds(targets, conclusion, effects);
        trace.recordExpansion(ruleName, worldId, source, joinEffects(effects));
        return List.of(branch);
    }

    private List<TableauxBranch> deonticExistential(String ruleName, SignedFormula conclusion) {
        int ideal = createDeonticWorld();
        branch.getWorld(ideal).addFormula(conclusion);
        trace.recordExpansion(ruleName, worldId, source,
                "nuovo mondo ideale w" + ideal + " (w" + worldId + " → w" + ideal + "), " + describe(ideal, conclusion));
        return List.of(branch);
    }

    private int createDeonticWorld() {
        World ideal = branch.createWorld();
        statistics.incrementWorldsCreated();
        branch.addAccessibility(worldId, ideal.getId());
        LOGGER.fine("Creato mondo deontico w" + ideal.getId() + " da w" + worldId);
        return ideal.getId();
    }

    //endregion

    //region SUPPORTO

    private void addToWorlds(Set<Integer> targets, SignedFormula conclusion, List<String> effects) {
        for (Integer target : targets) {
            branch.getWorld(target).addFormula(conclusion);
            effects.add(describe(target, conclusion));
        }
    }

    private static String describe(int id, SignedFormula formula) {
        return "w" + id + ": " + formula;
    }

    private static String joinEffects(List<String> effects) {
        return effects.isEmpty() ? "nessun mondo accessibile" : String.join(", ", effects);
    }

    /**
     * Classifica le regole per l'ordine di espansione all'interno di un ramo.
     */
    private static final class RulePriority implements FormulaVisitor<Integer> {

        private final boolean negated;

        RulePriority(boolean negated) {
            this.negated = negated;
        }

        @Override
        public Integer visitAtom(Atom atom) {
            throw new IllegalStateException("Gli atomi non hanno regola di espansione: " + atom);
        }

        @Override
        public Integer visitNot(Not not) {
            return PRIORITY_ALPHA;
        }

        @Override
        public Integer visitAnd(And and) {
            return negated ? PRIORITY_BETA : PRIORITY_ALPHA;
        }

        @Override
        public Integer visitOr(Or or) {
            return negated ? PRIORITY_ALPHA : PRIORITY_BETA;
        }

        @Override
        public Integer visitImplies(Implies implies) {
            return negated ? PRIORITY_ALPHA : PRIORITY_BETA;
        }

        @Override
        public Integer visitAlways(Always always) {
            return negated ? PRIORITY_WORLD_CREATION : PRIORITY_MODAL_UNIVERSAL;
        }

        @Override
        public Integer visitEventually(Eventually eventually) {
            return negated ? PRIORITY_MODAL_UNIVERSAL : PRIORITY_WORLD_CREATION;
        }

        @Override
        public Integer visitObligation(Obligation obligation) {
            return negated ? PRIORITY_WORLD_CREATION : PRIORITY_DEONTIC_UNIVERSAL;
        }

        @Override
        public Integer visitPermission(Permission permission) {
            return negated ? PRIORITY_DEONTIC_UNIVERSAL : PRIORITY_WORLD_CREATION;
        }

        @Override
        public Integer visitForbidden(Forbidden forbidden) {
            return negated ? PRIORITY_WORLD_CREATION : PRIORITY_DEONTIC_UNIVERSAL;
        }
    }

    //endregion
}
