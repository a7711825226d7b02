package org.modal.tableaux;

import org.junit.jupiter.api.Test;
import org.modal.formula.Formula;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableauxBranchTest {

    private static final Formula P = Formula.atom("P");

    @Test
    void worldIdsStartAtZeroAndAreNeverReused() {
        TableauxBranch branch = new TableauxBranch();

        assertThat(branch.createWorld().getId()).isZero();
        assertThat(branch.createWorld().getId()).isEqualTo(1);

        branch.addWorld(new World(7));
        assertThat(branch.createWorld().getId()).isEqualTo(8);
        assertThat(branch.getWorldCount()).isEqualTo(4);
    }

    @Test
    void copyIsFullyIndependent() {
        TableauxBranch original = new TableauxBranch();
        World root = original.createWorld();
        root.addFormula(P, false);
        original.recordBox(0, P);

        TableauxBranch copy = original.copy();
        copy.getWorld(0).addFormula(P, true);
        World extra = copy.createWorld();
        copy.addAccessibility(0, extra.getId());
        copy.recordNegatedDiamond(0, P);
        copy.close();

        assertThat(original.getWorld(0).hasContradiction()).isFalse();
        assertThat(original.getWorldCount()).isEqualTo(1);
        assertThat(original.getAccessibleWorlds(0)).isEmpty();
        assertThat(original.getNegatedDiamondHistory(0)).isEmpty();
        assertThat(original.getNextWorldId()).isEqualTo(1);
        assertThat(original.isClosed()).isFalse();

        assertThat(copy.getBoxHistory(0)).containsExactly(P);
        assertThat(copy.getNextWorldId()).isEqualTo(2);
    }

    @Test
    void accessibleWorldsAreReturnedAsCopy() {
        TableauxBranch branch = new TableauxBranch();
        branch.createWorld();
        branch.createWorld();
        branch.addAccessibility(0, 1);

        branch.getAccessibleWorlds(0).add(99);

        assertThat(branch.getAccessibleWorlds(0)).containsExactly(1);
    }

    @Test
    void reachableWorldsFollowTheTransitiveClosure() {
        TableauxBranch branch = new TableauxBranch();
        for (int i = 0; i < 4; i++) {
            branch.createWorld();
        }
        branch.addAccessibility(0, 1);
        branch.addAccessibility(1, 2);
        branch.addAccessibility(2, 3);

        assertThat(branch.getReachableWorlds(0)).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(branch.getReachableWorlds(3)).isEmpty();
    }

    @Test
    void ancestorsTerminateOnCycles() {
        TableauxBranch branch = new TableauxBranch();
        for (int i = 0; i < 3; i++) {
            branch.createWorld();
        }
        branch.addAccessibility(0, 1);
        branch.addAccessibility(1, 0);
        branch.addAccessibility(1, 1);
        branch.addAccessibility(1, 2);

        assertThat(branch.getAncestors(2)).containsExactlyInAnyOrder(0, 1);
        assertThat(branch.getAncestors(0)).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    void missingWorldsFailFast() {
        TableauxBranch branch = new TableauxBranch();
        branch.createWorld();

        assertThatThrownBy(() -> branch.getWorld(5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> branch.addAccessibility(0, 5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> branch.getAncestors(5)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> branch.addWorld(new World(0))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findsContradictionAndResets() {
        TableauxBranch branch = new TableauxBranch();
        branch.createWorld();
        World second = branch.createWorld();
        second.addFormula(P, false);
        second.addFormula(P, true);

        assertThat(branch.findContradiction()).hasValueSatisfying(world -> assertThat(world.getId()).isEqualTo(1));

        branch.close();
        branch.reset();

        assertThat(branch.isClosed()).isFalse();
        assertThat(branch.getWorldCount()).isZero();
        assertThat(branch.findContradiction()).isEmpty();
        assertThat(branch.createWorld().getId()).isZero();
    }
}
