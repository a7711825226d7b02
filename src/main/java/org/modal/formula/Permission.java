package org.modal.formula;

import java.util.Objects;

/**
 * Permesso deontico: P(φ), φ vale in almeno un mondo ideale accessibile.
 */
public final class Permission implements Formula {

    private final Formula operand;

    public Permission(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Permission non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitPermission(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Permission) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "P(" + operand + ")";
    }
}
