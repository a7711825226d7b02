package org.modal.countermodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serializzazione JSON condivisa dalle strutture del contromodello.
 */
final class JsonSupport {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private JsonSupport() {
    }

    /**
     * @throws IllegalStateException se Jackson non riesce a serializzare il valore
     */
    static String toPrettyJson(Object value) {
        try {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serializzazione JSON fallita: " + e.getOriginalMessage(), e);
        }
    }
}
