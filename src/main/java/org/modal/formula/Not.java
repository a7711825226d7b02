package org.modal.formula;

import java.util.Objects;

/**
 * Negazione: ¬φ.
 */
public final class Not implements Formula {

    private final Formula operand;

    public Not(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Not non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Not) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "¬" + operand;
    }
}
