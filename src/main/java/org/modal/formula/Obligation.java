package org.modal.formula;

import java.util.Objects;

/**
 * Obbligo deontico: O(φ), φ vale in ogni mondo ideale accessibile.
 */
public final class Obligation implements Formula {

    private final Formula operand;

    public Obligation(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Obligation non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitObligation(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Obligation) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "O(" + operand + ")";
    }
}
