package org.modal.formula;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaTest {

    @Test
    void independentlyBuiltTreesAreEqualAndHashAlike() {
        Formula first = new Implies(new Always(Formula.atom("P")), Formula.atom("P"));
        Formula second = new Implies(new Always(new Atom("P")), new Atom("P"));

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(new HashSet<>(List.of(first, second))).hasSize(1);
    }

    @Test
    void differentConnectivesAreNotEqual() {
        Formula p = Formula.atom("P");
        Formula q = Formula.atom("Q");

        assertThat(new And(p, q)).isNotEqualTo(new Or(p, q));
        assertThat(new And(p, q)).isNotEqualTo(new And(q, p));
        assertThat(new Obligation(p)).isNotEqualTo(new Always(p));
    }

    @Test
    void atomArgumentsTakePartInEquality() {
        assertThat(Formula.atom("Paga", "x", "y")).isEqualTo(new Atom("Paga", List.of("x", "y")));
        assertThat(Formula.atom("Paga", "x")).isNotEqualTo(Formula.atom("Paga", "y"));
        assertThat(Formula.atom("Paga", "x")).isNotEqualTo(Formula.atom("Paga"));
    }

    @Test
    void atomRejectsBlankName() {
        assertThatThrownBy(() -> new Atom("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void atomArgumentsAreCopied() {
        List<String> args = new java.util.ArrayList<>(List.of("x"));
        Atom atom = new Atom("R", args);
        args.add("y");

        assertThat(atom.args()).containsExactly("x");
        assertThatThrownBy(() -> atom.args().add("z")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void onlyAtomsAreAtomic() {
        assertThat(Formula.atom("P").isAtomic()).isTrue();
        assertThat(new Not(Formula.atom("P")).isAtomic()).isFalse();
        assertThat(new Permission(Formula.atom("P")).isAtomic()).isFalse();
    }

    @Test
    void rendersWithLogicalSymbols() {
        Formula p = Formula.atom("P");
        Formula q = Formula.atom("Q");

        assertThat(new Implies(new Always(p), new Eventually(q))).hasToString("(□P → ◊Q)");
        assertThat(new And(new Not(p), new Or(p, q))).hasToString("(¬P ∧ (P ∨ Q))");
        assertThat(new Obligation(p)).hasToString("O(P)");
        assertThat(new Permission(p)).hasToString("P(P)");
        assertThat(new Forbidden(p)).hasToString("F(P)");
        assertThat(Formula.atom("Paga", "x", "y")).hasToString("Paga(x, y)");
    }

    @Test
    void visitorReachesTheMatchingVariant() {
        FormulaVisitor<String> namer = new FormulaVisitor<>() {
            @Override
            public String visitAtom(Atom atom) {
                return "atom";
            }

            @Override
            public String visitNot(Not not) {
                return "not";
            }

            @Override
            public String visitAnd(And and) {
                return "and";
            }

            @Override
            public String visitOr(Or or) {
                return "or";
            }

            @Override
            public String visitImplies(Implies implies) {
                return "implies";
            }

            @Override
            public String visitAlways(Always always) {
                return "always";
            }

            @Override
            public String visitEventually(Eventually eventually) {
                return "eventually";
            }

            @Override
            public String visitObligation(Obligation obligation) {
                return "obligation";
            }

            @Override
            public String visitPermission(Permission permission) {
                return "permission";
            }

            @Override
            public String visitForbidden(Forbidden forbidden) {
                return "forbidden";
            }
        };

        Formula p = Formula.atom("P");
        assertThat(p.accept(namer)).isEqualTo("atom");
        assertThat(new Eventually(p).accept(namer)).isEqualTo("eventually");
        assertThat(new Forbidden(p).accept(namer)).isEqualTo("forbidden");
    }

    @Test
    void signedFormulasDifferByPolarity() {
        SignedFormula positive = SignedFormula.positive(Formula.atom("P"));
        SignedFormula negative = SignedFormula.negative(Formula.atom("P"));

        assertThat(positive).isNotEqualTo(negative);
        assertThat(negative).isEqualTo(new SignedFormula(new Atom("P"), true));
        assertThat(positive).hasToString("P");
        assertThat(negative).hasToString("¬P");
    }
}
