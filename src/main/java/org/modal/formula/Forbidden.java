package org.modal.formula;

import java.util.Objects;

/**
 * Divieto deontico: F(φ) equivale a O(¬φ).
 */
public final class Forbidden implements Formula {

    private final Formula operand;

    public Forbidden(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Forbidden non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitForbidden(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Forbidden) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "F(" + operand + ")";
    }
}
