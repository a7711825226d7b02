package org.modal.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.modal.formula.Always;
import org.modal.formula.And;
import org.modal.formula.Eventually;
import org.modal.formula.Forbidden;
import org.modal.formula.Formula;
import org.modal.formula.Implies;
import org.modal.formula.Not;
import org.modal.formula.Obligation;
import org.modal.formula.Or;
import org.modal.formula.Permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModalFormulaParserTest {

    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");
    private static final Formula R = Formula.atom("R");

    @Test
    void parsesTheKAxiom() {
        Formula parsed = ModalFormulaParser.parse("[](P -> Q) -> ([]P -> []Q)");

        Formula expected = new Implies(
                new Always(new Implies(P, Q)),
                new Implies(new Always(P), new Always(Q)));
        assertThat(parsed).isEqualTo(expected);
    }

    @Test
    void asciiAndUnicodeNotationsAgree() {
        assertThat(ModalFormulaParser.parse("□P → ◊P"))
                .isEqualTo(ModalFormulaParser.parse("[]P -> <>P"));
        assertThat(ModalFormulaParser.parse("¬(P ∧ Q) ∨ R"))
                .isEqualTo(ModalFormulaParser.parse("!(P & Q) | R"));
        assertThat(ModalFormulaParser.parse("◇P")).isEqualTo(new Eventually(P));
        assertThat(ModalFormulaParser.parse("~P")).isEqualTo(new Not(P));
    }

    @Test
    void implicationIsRightAssociative() {
        assertThat(ModalFormulaParser.parse("P -> Q -> R"))
                .isEqualTo(new Implies(P, new Implies(Q, R)));
    }

    @Test
    void conjunctionBindsTighterThanDisjunction() {
        assertThat(ModalFormulaParser.parse("P | Q & R"))
                .isEqualTo(new Or(P, new And(Q, R)));
        assertThat(ModalFormulaParser.parse("P & Q & R"))
                .isEqualTo(new And(new And(P, Q), R));
    }

    @Test
    void unaryOperatorsBindTighterThanBinary() {
        assertThat(ModalFormulaParser.parse("[]P & Q"))
                .isEqualTo(new And(new Always(P), Q));
        assertThat(ModalFormulaParser.parse("!<>P"))
                .isEqualTo(new Not(new Eventually(P)));
    }

    @Test
    void biconditionalBecomesTwoImplications() {
        assertThat(ModalFormulaParser.parse("P <-> Q"))
                .isEqualTo(new And(new Implies(P, Q), new Implies(Q, P)));
    }

    @Test
    void parsesDeonticOperators() {
        assertThat(ModalFormulaParser.parse("OBL(P) -> PERM(P)"))
                .isEqualTo(new Implies(new Obligation(P), new Permission(P)));
        assertThat(ModalFormulaParser.parse("FORB(P & Q)"))
                .isEqualTo(new Forbidden(new And(P, Q)));
    }

    @Test
    void parsesPredicateArguments() {
        assertThat(ModalFormulaParser.parse("OBL(Paga(mario, tassa))"))
                .isEqualTo(new Obligation(Formula.atom("Paga", "mario", "tassa")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"P &", "(P -> Q", "P Q", "[]", "P # Q"})
    void rejectsMalformedInput(String text) {
        assertThatThrownBy(() -> ModalFormulaParser.parse(text))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Errore di sintassi");
    }

    @Test
    void rejectsBlankInput() {
        assertThatThrownBy(() -> ModalFormulaParser.parse("   "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
