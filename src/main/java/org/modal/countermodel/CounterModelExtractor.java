package org.modal.countermodel;

import org.modal.formula.Formula;
import org.modal.tableaux.ModalLogicType;
import org.modal.tableaux.ModalProofException;
import org.modal.tableaux.TableauxBranch;
import org.modal.tableaux.TableauxResult;
import org.modal.tableaux.World;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ESTRATTORE DI CONTROMODELLI - Da ramo aperto a struttura di Kripke
 *
 * PROCESSO:
 * 1. Ogni mondo del ramo diventa un mondo della struttura (stessi id)
 * 2. La relazione di accessibilità viene copiata senza modifiche
 * 3. Gli atomi asseriti veri in un mondo diventano veri nella valutazione;
 *    tutti gli altri atomi sono falsi
 * 4. Il mondo iniziale è w0 (o il mondo con id minimo se w0 manca)
 *
 * Estrarre da un ramo chiuso è un errore d'uso e solleva {@link ModalProofException}.
 */
public class CounterModelExtractor {

    private static final Logger LOGGER = Logger.getLogger(CounterModelExtractor.class.getName());

    private final ModalLogicType logicType;

    public CounterModelExtractor() {
        this(ModalLogicType.K);
    }

    public CounterModelExtractor(ModalLogicType logicType) {
        this.logicType = Objects.requireNonNull(logicType, "Logica modale non può essere null");
    }

    public static CounterModel extractCounterModel(Formula formula, TableauxBranch branch, ModalLogicType logicType) {
        return new CounterModelExtractor(logicType).extract(formula, branch);
    }

    /**
     * Estrae il contromodello dal ramo testimone di un risultato non valido.
     *
     * @throws ModalProofException se il risultato è valido
     */
    public static CounterModel extractCounterModel(TableauxResult result) {
        TableauxBranch openBranch = result.getOpenBranch().orElseThrow(() -> new ModalProofException(
                "La formula " + result.getFormula() + " è valida in " + result.getLogicType()
                        + ": nessun contromodello"));
        return extractCounterModel(result.getFormula(), openBranch, result.getLogicType());
    }

    /**
     * @param formula formula di cui il ramo è testimone di non validità
     * @param branch ramo aperto
     * @return contromodello con spiegazione
     * @throws ModalProofException se il ramo è chiuso
     */
    public CounterModel extract(Formula formula, TableauxBranch branch) {
        Objects.requireNonNull(formula, "Formula non può essere null");
        Objects.requireNonNull(branch, "Ramo non può essere null");
        if (branch.isClosed()) {
            throw new ModalProofException("Impossibile estrarre un contromodello da un ramo chiuso");
        }

        KripkeStructure kripke = buildStructure(branch);
        List<String> explanation = buildExplanation(formula, kripke);

        LOGGER.fine("Contromodello estratto: " + kripke.getWorldCount() + " mondi, "
                + kripke.countRelations() + " relazioni");
        return new CounterModel(formula, kripke, explanation);
    }

    private KripkeStructure buildStructure(TableauxBranch branch) {
        KripkeStructure kripke = new KripkeStructure(logicType);

        for (World world : branch.getWorlds().values()) {
            kripke.addWorld(world.getId());
            for (Formula formula : world.getFormulas()) {
                if (formula.isAtomic()) {
                    kripke.setAtomTrue(world.getId(), formula.toString());
                }
            }
        }

        for (Map.Entry<Integer, Set<Integer>> entry : branch.getAccessibility().entrySet()) {
            for (Integer target : entry.getValue()) {
                kripke.addAccessibility(entry.getKey(), target);
            }
        }

        Set<Integer> worlds = kripke.getWorlds();
        if (!worlds.isEmpty()) {
            kripke.setInitialWorld(worlds.contains(0) ? 0 : worlds.iterator().next());
        }
        return kripke;
    }

    private List<String> buildExplanation(Formula formula, KripkeStructure kripke) {
        List<String> explanation = new ArrayList<>();
        explanation.add("La formula " + formula + " non è valida nella logica " + logicType);
        explanation.add("Il contromodello ha " + kripke.getWorldCount() + " mondi");

        Set<String> initialAtoms = kripke.getTrueAtoms(kripke.getInitialWorld());
        if (initialAtoms.isEmpty()) {
            explanation.add("Nel mondo w" + kripke.getInitialWorld() + " nessun atomo è vero");
        } else {
            explanation.add("Nel mondo w" + kripke.getInitialWorld() + " sono veri: " + String.join(", ", initialAtoms));
        }

        explanation.add("La relazione di accessibilità contiene " + kripke.countRelations() + " coppie");
        explanation.add("Logica " + logicType + ": " + logicType.getFrameDescription());
        return explanation;
    }

    public ModalLogicType getLogicType() {
        return logicType;
    }
}
