package org.modal.formula;

import java.util.List;
import java.util.Objects;

/**
 * Proposizione atomica o predicato con argomenti opachi.
 * Gli argomenti non vengono interpretati: P(a) e P(b) sono atomi distinti.
 */
public final class Atom implements Formula {

    private final String name;
    private final List<String> args;

    /**
     * @param name nome del predicato (non vuoto)
     * @param args argomenti del predicato, copiati in una lista immutabile
     */
    public Atom(String name, List<String> args) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome dell'atomo non può essere null o vuoto");
        }
        Objects.requireNonNull(args, "Lista argomenti non può essere null");
        this.name = name;
        this.args = List.copyOf(args);
    }

    public Atom(String name) {
        this(name, List.of());
    }

    public String name() {
        return name;
    }

    public List<String> args() {
        return args;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Atom other = (Atom) obj;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return name;
        }
        return name + "(" + String.join(", ", args) + ")";
    }
}
