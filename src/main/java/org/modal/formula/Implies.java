package org.modal.formula;

import java.util.Objects;

/**
 * Implicazione materiale: φ → ψ, falsa solo con antecedente vero e conseguente falso.
 */
public final class Implies implements Formula {

    private final Formula left;
    private final Formula right;

    public Implies(Formula left, Formula right) {
        this.left = Objects.requireNonNull(left, "Operando sinistro di Implies non può essere null");
        this.right = Objects.requireNonNull(right, "Operando destro di Implies non può essere null");
    }

    public Formula left() {
        return left;
    }

    public Formula right() {
        return right;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitImplies(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Implies other = (Implies) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass().getSimpleName(), left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " → " + right + ")";
    }
}
