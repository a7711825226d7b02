package org.modal.countermodel;

import org.modal.tableaux.ModalLogicType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * STRUTTURA DI KRIPKE - Mondi, relazione di accessibilità e valutazione degli atomi
 *
 * Costruita dall'estrattore a partire da un ramo aperto e poi usata in sola lettura.
 * Un atomo non presente nella valutazione di un mondo è falso in quel mondo.
 *
 * FORMATO toMap() / toJson():
 * - worlds: lista ordinata degli id
 * - accessibility: id → lista ordinata degli id accessibili
 * - valuation: id → lista ordinata degli atomi veri
 * - initial_world: id del mondo iniziale
 * - logic_type: nome della logica
 */
public class KripkeStructure {

    private final ModalLogicType logicType;
    private final SortedSet<Integer> worlds;
    private final Map<Integer, SortedSet<Integer>> accessibility;
    private final Map<Integer, SortedSet<String>> valuation;
    private int initialWorld;

    public KripkeStructure() {
        this(ModalLogicType.K);
    }

    public KripkeStructure(ModalLogicType logicType) {
        this.logicType = Objects.requireNonNull(logicType, "Logica della struttura non può essere null");
        this.worlds = new TreeSet<>();
        this.accessibility = new TreeMap<>();
        this.valuation = new TreeMap<>();
        this.initialWorld = 0;
    }

    //region COSTRUZIONE

    public void addWorld(int worldId) {
        if (worldId < 0) {
            throw new IllegalArgumentException("ID mondo deve essere >= 0, ricevuto: " + worldId);
        }
        worlds.add(worldId);
        accessibility.putIfAbsent(worldId, new TreeSet<>());
        valuation.putIfAbsent(worldId, new TreeSet<>());
    }

    /**
     * @throws IllegalArgumentException se uno dei due mondi non appartiene alla struttura
     */
    public void addAccessibility(int from, int to) {
        requireWorld(from);
        requireWorld(to);
        accessibility.get(from).add(to);
    }

    public void setAtomTrue(int worldId, String atom) {
        requireWorld(worldId);
        if (atom == null || atom.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome atomo non può essere vuoto");
        }
        valuation.get(worldId).add(atom);
    }

    public void setInitialWorld(int worldId) {
        requireWorld(worldId);
        this.initialWorld = worldId;
    }

    //endregion

    //region INTERROGAZIONE

    public boolean isAtomTrue(int worldId, String atom) {
        SortedSet<String> atoms = valuation.get(worldId);
        return atoms != null && atoms.contains(atom);
    }

    /**
     * @return copia dell'insieme dei mondi accessibili, vuota per mondi sconosciuti
     */
    public Set<Integer> getAccessibleWorlds(int worldId) {
        return new TreeSet<>(accessibility.getOrDefault(worldId, Collections.emptySortedSet()));
    }

    public Set<String> getTrueAtoms(int worldId) {
        return new TreeSet<>(valuation.getOrDefault(worldId, Collections.emptySortedSet()));
    }

    public Set<Integer> getWorlds() {
        return Collections.unmodifiableSortedSet(worlds);
    }

    public Map<Integer, Set<Integer>> getAccessibility() {
        Map<Integer, Set<Integer>> view = new TreeMap<>();
        accessibility.forEach((id, targets) -> view.put(id, Collections.unmodifiableSortedSet(targets)));
        return Collections.unmodifiableMap(view);
    }

    public Map<Integer, Set<String>> getValuation() {
        Map<Integer, Set<String>> view = new TreeMap<>();
        valuation.forEach((id, atoms) -> view.put(id, Collections.unmodifiableSortedSet(atoms)));
        return Collections.unmodifiableMap(view);
    }

    public int getInitialWorld() {
        return initialWorld;
    }

    public ModalLogicType getLogicType() {
        return logicType;
    }

    public int getWorldCount() {
        return worlds.size();
    }

    /**
     * Numero totale di coppie nella relazione di accessibilità.
     */
    public int countRelations() {
        int relations = 0;
        for (SortedSet<Integer> targets : accessibility.values()) {
            relations += targets.size();
        }
        return relations;
    }

    //endregion

    //region SERIALIZZAZIONE

    public Map<String, Object> toMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("worlds", new ArrayList<>(worlds));

        Map<String, Object> relation = new LinkedHashMap<>();
        accessibility.forEach((id, targets) -> relation.put(String.valueOf(id), new ArrayList<>(targets)));
        data.put("accessibility", relation);

        Map<String, Object> atoms = new LinkedHashMap<>();
        valuation.forEach((id, trueAtoms) -> atoms.put(String.valueOf(id), new ArrayList<>(trueAtoms)));
        data.put("valuation", atoms);

        data.put("initial_world", initialWorld);
        data.put("logic_type", logicType.getName());
        return data;
    }

    public String toJson() {
        return JsonSupport.toPrettyJson(toMap());
    }

    //endregion

    private void requireWorld(int worldId) {
        if (!worlds.contains(worldId)) {
            throw new IllegalArgumentException("Mondo w" + worldId + " non presente nella struttura di Kripke");
        }
    }

    @Override
    public String toString() {
        return "KripkeStructure{logica=" + logicType + ", mondi=" + worlds + ", accessibilità=" + accessibility
                + ", valutazione=" + valuation + "}";
    }
}
