package org.modal.tableaux;

import java.util.Objects;

/**
 * Limiti di ricerca del tableaux. Sono l'unica protezione contro ricerche che non
 * terminano naturalmente (tipicamente sotto la chiusura transitiva di S4/S5).
 */
public final class TableauxLimits {

    public static final int DEFAULT_MAX_WORLDS = 100;
    public static final int DEFAULT_MAX_DEPTH = 50;

    private final int maxWorlds;
    private final int maxDepth;

    /**
     * @param maxWorlds numero massimo di mondi per ramo
     * @param maxDepth numero massimo di round di espansione
     * @throws IllegalArgumentException se uno dei due limiti non è positivo
     */
    public TableauxLimits(int maxWorlds, int maxDepth) {
        if (maxWorlds <= 0) {
            throw new IllegalArgumentException("maxWorlds deve essere > 0, ricevuto: " + maxWorlds);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth deve essere > 0, ricevuto: " + maxDepth);
        }
        this.maxWorlds = maxWorlds;
        this.maxDepth = maxDepth;
    }

    public static TableauxLimits defaults() {
        return new TableauxLimits(DEFAULT_MAX_WORLDS, DEFAULT_MAX_DEPTH);
    }

    public int maxWorlds() {
        return maxWorlds;
    }

    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        TableauxLimits other = (TableauxLimits) obj;
        return maxWorlds == other.maxWorlds && maxDepth == other.maxDepth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxWorlds, maxDepth);
    }

    @Override
    public String toString() {
        return "TableauxLimits{maxWorlds=" + maxWorlds + ", maxDepth=" + maxDepth + "}";
    }
}
