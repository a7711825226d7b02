package org.modal.tableaux;

import org.modal.formula.Formula;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * RAMO DEL TABLEAUX - Stato mutabile di un modello parziale candidato
 *
 * Possiede in esclusiva tutti i mondi del ramo, la relazione di accessibilità e gli
 * storici di espansione per mondo. Quando una regola biforca, il ramo viene copiato
 * in profondità: i due rami divergono senza condividere alcuno stato mutabile.
 *
 * STRUTTURE DATI:
 * - worlds: id → mondo (ogni mondo creato ha una voce)
 * - accessibility: id → insieme di id accessibili (ogni mondo ha una voce, anche vuota)
 * - boxHistory: id → corpi delle formule □a espanse positivamente nel mondo
 * - negDiamondHistory: id → corpi delle formule ◊a espanse negativamente nel mondo
 *
 * INVARIANTI:
 * - nextWorldId cresce monotonicamente e non viene mai riutilizzato (radice = 0)
 * - il flag closed passa solo da false a true, salvo reset() esplicito
 * - riferire un mondo inesistente è un errore di programmazione (IllegalStateException)
 */
public class TableauxBranch {

    private final Map<Integer, World> worlds;
    private final Map<Integer, Set<Integer>> accessibility;
    private final Map<Integer, Set<Formula>> boxHistory;
    private final Map<Integer, Set<Formula>> negDiamondHistory;
    private int nextWorldId;
    private boolean closed;

    public TableauxBranch() {
        this.worlds = new TreeMap<>();
        this.accessibility = new TreeMap<>();
        this.boxHistory = new TreeMap<>();
        this.negDiamondHistory = new TreeMap<>();
        this.nextWorldId = 0;
        this.closed = false;
    }

    /**
     * Copia profonda del ramo: mondi, insiemi di accessibilità e storici sono nuovi oggetti.
     *
     * @return ramo indipendente con lo stesso contenuto
     */
    public TableauxBranch copy() {
        TableauxBranch copy = new TableauxBranch();
        worlds.forEach((id, world) -> copy.worlds.put(id, world.copy()));
        accessibility.forEach((id, targets) -> copy.accessibility.put(id, new LinkedHashSet<>(targets)));
        boxHistory.forEach((id, bodies) -> copy.boxHistory.put(id, new LinkedHashSet<>(bodies)));
        negDiamondHistory.forEach((id, bodies) -> copy.negDiamondHistory.put(id, new LinkedHashSet<>(bodies)));
        copy.nextWorldId = nextWorldId;
        copy.closed = closed;
        return copy;
    }

    //region GESTIONE MONDI

    /**
     * Crea un nuovo mondo con il prossimo identificatore libero e relazione di accessibilità vuota.
     */
    public World createWorld() {
        World world = new World(nextWorldId++);
        worlds.put(world.getId(), world);
        accessibility.put(world.getId(), new LinkedHashSet<>());
        return world;
    }

    /**
     * Registra un mondo costruito esternamente. Il contatore degli identificatori viene
     * portato oltre l'id del mondo, così che createWorld() non lo riutilizzi.
     *
     * @param world mondo da registrare
     * @throws IllegalStateException se esiste già un mondo con lo stesso id
     */
    public void addWorld(World world) {
        if (worlds.containsKey(world.getId())) {
            throw new IllegalStateException("Mondo w" + world.getId() + " già presente nel ramo");
        }
        worlds.put(world.getId(), world);
        accessibility.putIfAbsent(world.getId(), new LinkedHashSet<>());
        nextWorldId = Math.max(nextWorldId, world.getId() + 1);
    }

    public World getWorld(int id) {
        World world = worlds.get(id);
        if (world == null) {
            throw new IllegalStateException("Mondo w" + id + " non presente nel ramo");
        }
        return world;
    }

    public Map<Integer, World> getWorlds() {
        return Collections.unmodifiableMap(worlds);
    }

    public int getWorldCount() {
        return worlds.size();
    }

    public int getNextWorldId() {
        return nextWorldId;
    }

    //endregion

    //region RELAZIONE DI ACCESSIBILITÀ

    public void addAccessibility(int from, int to) {
        requireWorld(from);
        requireWorld(to);
        accessibility.get(from).add(to);
    }

    /**
     * @return copia dell'insieme dei mondi direttamente accessibili da {@code id}
     */
    public Set<Integer> getAccessibleWorlds(int id) {
        requireWorld(id);
        return new LinkedHashSet<>(accessibility.get(id));
    }

    /**
     * Vista in sola lettura della relazione di accessibilità (id → id accessibili).
     */
    public Map<Integer, Set<Integer>> getAccessibility() {
        Map<Integer, Set<Integer>> view = new LinkedHashMap<>();
        accessibility.forEach((id, targets) -> view.put(id, Collections.unmodifiableSet(targets)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Mondi raggiungibili da {@code id} con almeno un passo (chiusura transitiva, BFS in avanti).
     */
    public Set<Integer> getReachableWorlds(int id) {
        requireWorld(id);
        return breadthFirst(id, accessibility);
    }

    /**
     * Antenati transitivi di {@code id}: mondi da cui esiste un cammino verso {@code id}.
     * BFS sulla relazione inversa; l'insieme dei visitati protegge dai cicli (S5, riflessività).
     */
    public Set<Integer> getAncestors(int id) {
        requireWorld(id);
        Map<Integer, Set<Integer>> reverse = new TreeMap<>();
        accessibility.forEach((from, targets) -> {
            for (Integer to : targets) {
                reverse.computeIfAbsent(to, key -> new LinkedHashSet<>()).add(from);
            }
        });
        return breadthFirst(id, reverse);
    }

    private static Set<Integer> breadthFirst(int start, Map<Integer, Set<Integer>> edges) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            Integer current = queue.poll();
            for (Integer next : edges.getOrDefault(current, Set.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    //endregion

    //region STORICI DI ESPANSIONE

    public void recordBox(int worldId, Formula body) {
        requireWorld(worldId);
        boxHistory.computeIfAbsent(worldId, key -> new LinkedHashSet<>()).add(body);
    }

    public Set<Formula> getBoxHistory(int worldId) {
        requireWorld(worldId);
        return new LinkedHashSet<>(boxHistory.getOrDefault(worldId, Set.of()));
    }

    public void recordNegatedDiamond(int worldId, Formula body) {
        requireWorld(worldId);
        negDiamondHistory.computeIfAbsent(worldId, key -> new LinkedHashSet<>()).add(body);
    }

    public Set<Formula> getNegatedDiamondHistory(int worldId) {
        requireWorld(worldId);
        return new LinkedHashSet<>(negDiamondHistory.getOrDefault(worldId, Set.of()));
    }

    //endregion

    //region CHIUSURA

    /**
     * @return il primo mondo (per id) che contiene una contraddizione, se esiste
     */
    public Optional<World> findContradiction() {
        for (World world : worlds.values()) {
            if (world.hasContradiction()) {
                return Optional.of(world);
            }
        }
        return Optional.empty();
    }

    public void close() {
        this.closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Riporta il ramo allo stato iniziale vuoto: nessun mondo, contatore a 0, ramo aperto.
     */
    public void reset() {
        worlds.clear();
        accessibility.clear();
        boxHistory.clear();
        negDiamondHistory.clear();
        nextWorldId = 0;
        closed = false;
    }

    //endregion

    private void requireWorld(int id) {
        if (!worlds.containsKey(id)) {
            throw new IllegalStateException("Mondo w" + id + " non presente nel ramo");
        }
    }

    @Override
    public String toString() {
        return "TableauxBranch{mondi=" + worlds.keySet() + ", accessibilità=" + accessibility
                + ", chiuso=" + closed + "}";
    }
}
