package org.modal.formula;

import java.util.Objects;

/**
 * Possibilità (diamond): ◊φ è vera in w se φ è vera in almeno un mondo accessibile da w.
 */
public final class Eventually implements Formula {

    private final Formula operand;

    public Eventually(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Eventually non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitEventually(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Eventually) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "◊" + operand;
    }
}
