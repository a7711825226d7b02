package org.modal.formula;

import java.util.Arrays;

/**
 * FORMULA MODALE - Tipo somma chiuso per formule proposizionali, modali e deontiche
 *
 * Ogni costrutto del linguaggio è una classe final immutabile di questo package.
 * L'uguaglianza e l'hash sono strutturali: due alberi costruiti
 * indipendentemente con la stessa forma sono uguali e hanno lo stesso hash. Su questa
 * proprietà si basano tutti i controlli di appartenenza e di contraddizione del tableaux.
 *
 * COSTRUTTI:
 * - Atom(name, args): proposizione atomica o predicato opaco
 * - Not, And, Or, Implies: connettivi proposizionali
 * - Always (□), Eventually (◊): operatori modali aletici
 * - Obligation (O), Permission (P), Forbidden (F): operatori deontici
 *
 * Il dispatch sulle varianti avviene tramite {@link FormulaVisitor}: aggiungere una
 * variante obbliga ad aggiornare ogni visitor.
 */
public interface Formula {

    /**
     * Applica il visitor alla variante concreta della formula.
     *
     * @param visitor visitor da applicare
     * @param <R> tipo del risultato
     * @return risultato prodotto dal visitor
     */
    <R> R accept(FormulaVisitor<R> visitor);

    /**
     * Indica se la formula è atomica, cioè non richiede espansione nel tableaux.
     */
    default boolean isAtomic() {
        return false;
    }

    /**
     * Costruisce un atomo con eventuali argomenti.
     *
     * @param name nome del predicato
     * @param args argomenti opachi del predicato
     * @return atomo costruito
     */
    static Atom atom(String name, String... args) {
        return new Atom(name, Arrays.asList(args));
    }
}
