package org.modal.formula;

/**
 * Visitor esaustivo sulle varianti di {@link Formula}.
 *
 * @param <R> tipo del risultato della visita
 */
public interface FormulaVisitor<R> {

    R visitAtom(Atom atom);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitImplies(Implies implies);

    R visitAlways(Always always);

    R visitEventually(Eventually eventually);

    R visitObligation(Obligation obligation);

    R visitPermission(Permission permission);

    R visitForbidden(Forbidden forbidden);
}
