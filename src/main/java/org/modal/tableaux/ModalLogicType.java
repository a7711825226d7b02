package org.modal.tableaux;

import java.util.Locale;

/**
 * LOGICHE MODALI SUPPORTATE - Condizioni sulla relazione di accessibilità
 *
 * Ogni logica corrisponde a una classe di frame di Kripke:
 * - K: nessun vincolo
 * - T: riflessività
 * - D: serialità (ogni mondo vede almeno un mondo)
 * - S4: riflessività e transitività
 * - S5: relazione di equivalenza (riflessiva, transitiva, euclidea)
 *
 * La riflessività implica la serialità, quindi T, S4 e S5 sono anche seriali.
 */
public enum ModalLogicType {

    K("K", false, false, false, false,
            "nessun vincolo sulla relazione di accessibilità"),
    T("T", true, true, false, false,
            "la relazione di accessibilità è riflessiva"),
    D("D", false, true, false, false,
            "la relazione di accessibilità è seriale"),
    S4("S4", true, true, true, false,
            "la relazione di accessibilità è riflessiva e transitiva"),
    S5("S5", true, true, true, true,
            "la relazione di accessibilità è una relazione di equivalenza");

    private final String displayName;
    private final boolean reflexive;
    private final boolean serial;
    private final boolean transitive;
    private final boolean euclidean;
    private final String frameDescription;

    ModalLogicType(String displayName, boolean reflexive, boolean serial, boolean transitive,
                   boolean euclidean, String frameDescription) {
        this.displayName = displayName;
        this.reflexive = reflexive;
        this.serial = serial;
        this.transitive = transitive;
        this.euclidean = euclidean;
        this.frameDescription = frameDescription;
    }

    /**
     * Risolve il nome di una logica senza distinzione tra maiuscole e minuscole.
     *
     * @param name nome della logica (K, T, D, S4, S5)
     * @return logica corrispondente
     * @throws IllegalArgumentException se il nome non corrisponde a nessuna logica
     */
    public static ModalLogicType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome logica non può essere null");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ModalLogicType type : values()) {
            if (type.displayName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Logica modale non supportata: " + name + ". Supportate: K, T, D, S4, S5");
    }

    public String getName() {
        return displayName;
    }

    public boolean isReflexive() {
        return reflexive;
    }

    public boolean isSerial() {
        return serial;
    }

    public boolean isTransitive() {
        return transitive;
    }

    /** Solo S5: i mondi creati diventano mutuamente accessibili con tutti gli altri. */
    public boolean isEuclidean() {
        return euclidean;
    }

    public String getFrameDescription() {
        return frameDescription;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
