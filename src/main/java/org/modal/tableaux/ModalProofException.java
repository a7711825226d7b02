package org.modal.tableaux;

/**
 * Errore d'uso della procedura di prova, ad esempio l'estrazione di un contromodello
 * da un ramo chiuso.
 */
public class ModalProofException extends IllegalStateException {

    public ModalProofException(String message) {
        super(message);
    }
}
