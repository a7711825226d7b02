package org.modal.formula;

import java.util.Objects;

/**
 * Necessità (box): □φ è vera in w se φ è vera in ogni mondo accessibile da w.
 */
public final class Always implements Formula {

    private final Formula operand;

    public Always(Formula operand) {
        this.operand = Objects.requireNonNull(operand, "Operando di Always non può essere null");
    }

    public Formula operand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAlways(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return operand.equals(((Always) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), operand);
    }

    @Override
    public String toString() {
        return "□" + operand;
    }
}
