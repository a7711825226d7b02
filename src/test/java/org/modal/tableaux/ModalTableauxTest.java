package org.modal.tableaux;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.modal.formula.Always;
import org.modal.formula.Eventually;
import org.modal.formula.Formula;
import org.modal.formula.Implies;
import org.modal.formula.Not;
import org.modal.formula.Or;
import org.modal.parser.ModalFormulaParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModalTableauxTest {

    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");

    private static final Formula K_AXIOM = new Implies(
            new Always(new Implies(P, Q)), new Implies(new Always(P), new Always(Q)));
    private static final Formula T_AXIOM = new Implies(new Always(P), P);
    private static final Formula D_AXIOM = new Implies(new Always(P), new Eventually(P));
    private static final Formula AXIOM_4 = new Implies(new Always(P), new Always(new Always(P)));
    private static final Formula B_AXIOM = new Implies(P, new Always(new Eventually(P)));
    private static final Formula AXIOM_5 = new Implies(new Eventually(P), new Always(new Eventually(P)));

    private static TableauxResult prove(Formula formula, ModalLogicType logic) {
        return new ModalTableaux(logic).prove(formula);
    }

    private static TableauxResult prove(String formula, ModalLogicType logic) {
        return prove(ModalFormulaParser.parse(formula), logic);
    }

    //region ASSIOMI

    @ParameterizedTest
    @EnumSource(ModalLogicType.class)
    void identityIsValidEverywhere(ModalLogicType logic) {
        TableauxResult result = prove(new Implies(P, P), logic);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getStatus()).isEqualTo(TableauxResult.Status.VALID);
        assertThat(result.getOpenBranch()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ModalLogicType.class)
    void distributionAxiomIsValidEverywhere(ModalLogicType logic) {
        assertThat(prove(K_AXIOM, logic).isValid()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"T", "S4", "S5"})
    void reflexivityAxiomHoldsInReflexiveLogics(ModalLogicType logic) {
        assertThat(prove(T_AXIOM, logic).isValid()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"K", "D"})
    void reflexivityAxiomFailsWithoutReflexivity(ModalLogicType logic) {
        assertThat(prove(T_AXIOM, logic).isValid()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"D", "T", "S4", "S5"})
    void serialityAxiomHoldsInSerialLogics(ModalLogicType logic) {
        assertThat(prove(D_AXIOM, logic).isValid()).isTrue();
    }

    @Test
    void serialityAxiomFailsInK() {
        assertThat(prove(D_AXIOM, ModalLogicType.K).isValid()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"S4", "S5"})
    void transitivityAxiomHoldsInTransitiveLogics(ModalLogicType logic) {
        assertThat(prove(AXIOM_4, logic).isValid()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"K", "T", "D"})
    void transitivityAxiomFailsWithoutTransitivity(ModalLogicType logic) {
        TableauxResult result = prove(AXIOM_4, logic);

        assertThat(result.isValid()).isFalse();
        assertThat(result.isBounded()).isFalse();
    }

    @Test
    void symmetryAndEuclideanAxiomsHoldInS5() {
        assertThat(prove(B_AXIOM, ModalLogicType.S5).isValid()).isTrue();
        assertThat(prove(AXIOM_5, ModalLogicType.S5).isValid()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"K", "T", "D", "S4"})
    void symmetryAndEuclideanAxiomsFailBelowS5(ModalLogicType logic) {
        assertThat(prove(B_AXIOM, logic).isValid()).isFalse();
        assertThat(prove(AXIOM_5, logic).isValid()).isFalse();
    }

    //endregion

    //region SCENARI

    @Test
    void reflexivityAxiomInKLeavesASingleWorldWithPFalse() {
        TableauxResult result = prove(T_AXIOM, ModalLogicType.K);

        assertThat(result.getStatus()).isEqualTo(TableauxResult.Status.INVALID);
        TableauxBranch branch = result.getOpenBranch().orElseThrow();
        assertThat(branch.getWorlds()).containsOnlyKeys(0);
        assertThat(branch.getAccessibleWorlds(0)).isEmpty();
        assertThat(branch.getWorld(0).contains(P, true)).isTrue();
        assertThat(branch.getWorld(0).contains(P, false)).isFalse();
    }

    @Test
    void reflexivityAxiomInTClosesEveryBranch() {
        TableauxResult result = prove(T_AXIOM, ModalLogicType.T);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getClosedBranches()).isEqualTo(result.getTotalBranches());
        assertThat(result.getTotalBranches()).isPositive();
    }

    @Test
    void disjunctionSplitsTheTableau() {
        TableauxResult result = prove(new Implies(new Or(P, Q), P), ModalLogicType.K);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getTotalBranches()).isEqualTo(2);
        assertThat(result.getClosedBranches()).isEqualTo(1);
        assertThat(result.getStatistics().getBranchSplits()).isEqualTo(1);
        assertThat(result.getOpenBranch().orElseThrow().getWorld(0).contains(Q, false)).isTrue();
    }

    @Test
    void seriallyForcedWorldCarriesTheBoxBody() {
        TableauxResult result = prove(T_AXIOM, ModalLogicType.D);

        TableauxBranch branch = result.getOpenBranch().orElseThrow();
        assertThat(branch.getAccessibleWorlds(0)).containsExactly(1);
        assertThat(branch.getWorld(1).contains(P, false)).isTrue();
        assertThat(result.getStatistics().getWorldsCreated()).isEqualTo(1);
    }

    @ParameterizedTest
    @EnumSource(value = ModalLogicType.class, names = {"T", "S4", "S5"})
    void everyWorldIsReflexiveInReflexiveLogics(ModalLogicType logic) {
        TableauxResult result = prove(new Implies(new Eventually(P), new Eventually(Q)), logic);

        TableauxBranch branch = result.getOpenBranch().orElseThrow();
        assertThat(branch.getWorldCount()).isGreaterThan(1);
        for (Integer world : branch.getWorlds().keySet()) {
            assertThat(branch.getAccessibleWorlds(world)).contains(world);
        }
    }

    @Test
    void s5MakesCreatedWorldsMutuallyAccessible() {
        TableauxResult result = prove("<>P & <>Q -> P", ModalLogicType.S5);

        TableauxBranch branch = result.getOpenBranch().orElseThrow();
        assertThat(branch.getWorldCount()).isEqualTo(3);
        for (Integer from : branch.getWorlds().keySet()) {
            assertThat(branch.getAccessibleWorlds(from)).containsExactlyInAnyOrder(0, 1, 2);
        }
    }

    @Test
    void negatedDiamondReachesWorldsCreatedAfterIt() {
        TableauxResult result = prove("!(!<>P & <>(P & Q))", ModalLogicType.K);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getClosedBranches()).isEqualTo(result.getTotalBranches());
    }

    @Test
    void negatedDiamondOfAnAncestorReachesGrandchildrenInS4() {
        String formula = "!(!<>P & <><>P)";

        assertThat(prove(formula, ModalLogicType.S4).isValid()).isTrue();
        assertThat(prove(formula, ModalLogicType.K).isValid()).isFalse();
    }

    @Test
    void proofTraceStartsFromTheNegatedFormula() {
        TableauxResult result = prove(T_AXIOM, ModalLogicType.T);

        assertThat(result.getProofSteps()).isNotEmpty();
        assertThat(result.getProofSteps().get(0)).startsWith("Inizio");
        assertThat(result.getProofSteps()).anyMatch(step -> step.startsWith("[box]"));
        assertThat(result.getProofSteps()).anyMatch(step -> step.startsWith("Ramo chiuso"));
        assertThatThrownBy(() -> result.getProofSteps().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void atomicFormulaIsInvalidWithoutExpansion() {
        TableauxResult result = prove(P, ModalLogicType.S5);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getStatistics().getRuleApplications()).isZero();
        assertThat(result.getOpenBranch().orElseThrow().getWorldCount()).isEqualTo(1);
    }

    //endregion

    //region LIMITI

    @Test
    void exhaustedWorldLimitGivesInconclusiveVerdict() {
        Formula formula = new Not(new Always(new Eventually(P)));
        TableauxResult result = new ModalTableaux(ModalLogicType.S4, new TableauxLimits(5, 50)).prove(formula);

        assertThat(result.isValid()).isFalse();
        assertThat(result.isBounded()).isTrue();
        assertThat(result.getStatus()).isEqualTo(TableauxResult.Status.INCONCLUSIVE);
        assertThat(result.getOpenBranch().orElseThrow().getWorldCount()).isEqualTo(5);
    }

    @Test
    void exhaustedDepthGivesInconclusiveVerdict() {
        Formula formula = new Not(new Always(new Eventually(P)));
        TableauxResult result = new ModalTableaux(ModalLogicType.S4, new TableauxLimits(100, 4)).prove(formula);

        assertThat(result.getStatus()).isEqualTo(TableauxResult.Status.INCONCLUSIVE);
        assertThat(result.getStatistics().getRounds()).isEqualTo(4);
    }

    @Test
    void sameFormulaTerminatesInK() {
        TableauxResult result = new ModalTableaux(ModalLogicType.K, new TableauxLimits(5, 50))
                .prove(new Not(new Always(new Eventually(P))));

        assertThat(result.isValid()).isFalse();
        assertThat(result.isBounded()).isFalse();
        assertThat(result.getStatus()).isEqualTo(TableauxResult.Status.INVALID);
    }

    @Test
    void limitsMustBePositive() {
        assertThatThrownBy(() -> new TableauxLimits(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableauxLimits(10, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(TableauxLimits.defaults()).isEqualTo(new TableauxLimits(100, 50));
    }

    //endregion

    //region DEONTICA

    @Test
    void obligationImpliesPermission() {
        assertThat(prove("OBL(P) -> PERM(P)", ModalLogicType.K).isValid()).isTrue();
    }

    @Test
    void forbiddenExcludesPermission() {
        assertThat(prove("FORB(P) -> !PERM(P)", ModalLogicType.K).isValid()).isTrue();
    }

    @Test
    void conflictingObligationsAreInconsistent() {
        assertThat(prove("!(OBL(P) & OBL(!P))", ModalLogicType.K).isValid()).isTrue();
    }

    @Test
    void obligationDoesNotImplyFactInK() {
        TableauxResult result = prove("OBL(P) -> P", ModalLogicType.K);

        assertThat(result.isValid()).isFalse();
        TableauxBranch branch = result.getOpenBranch().orElseThrow();
        assertThat(branch.getAccessibleWorlds(0)).containsExactly(1);
        assertThat(branch.getWorld(1).contains(P, false)).isTrue();
    }

    @Test
    void deonticOperatorsShareTheReflexiveRelationInT() {
        assertThat(prove("OBL(P) -> P", ModalLogicType.T).isValid()).isTrue();
    }

    //endregion

    @Test
    void staticHelpersDefaultToK() {
        assertThat(ModalTableaux.proveFormula(T_AXIOM).getLogicType()).isEqualTo(ModalLogicType.K);
        assertThat(ModalTableaux.proveFormula(T_AXIOM).isValid()).isFalse();
        assertThat(ModalTableaux.proveFormula(T_AXIOM, ModalLogicType.T).isValid()).isTrue();
        assertThat(new ModalTableaux().getLimits()).isEqualTo(TableauxLimits.defaults());
    }
}
