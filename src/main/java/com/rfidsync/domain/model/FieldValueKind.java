package com.rfidsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Forma en tiempo de ejecución del valor de un campo de contacto.
 * El directorio devuelve valores sin tipo fijo; se clasifican en el punto de uso.
 */
public enum FieldValueKind {

    /** Campo sin valor (ausente o null JSON) */
    ABSENT,

    /** Cadena de texto */
    STRING,

    /** Lista de registros (selección múltiple) */
    LIST,

    /** Cualquier otra forma: número, booleano, objeto suelto */
    OTHER;

    /**
     * Clasifica un nodo JSON.
     *
     * @param node valor crudo del campo, puede ser null
     * @return la forma del valor
     */
    public static FieldValueKind of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ABSENT;
        }
        if (node.isTextual()) {
            return STRING;
        }
        if (node.isArray()) {
            return LIST;
        }
        return OTHER;
    }
}
