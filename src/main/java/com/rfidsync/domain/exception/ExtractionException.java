package com.rfidsync.domain.exception;

/**
 * Excepción lanzada cuando un campo de un contacto no tiene la forma esperada.
 * Su alcance es un solo contacto: nunca aborta un ciclo de sincronización.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ExtractionException tagIdNotString(String fieldName) {
        return new ExtractionException("El valor del campo '" + fieldName + "' no es texto");
    }

    public static ExtractionException tagIdNotNumeric(String value, Throwable cause) {
        return new ExtractionException("No se puede convertir el tag '" + value + "' a número", cause);
    }

    public static ExtractionException nonPositiveTagId(long value) {
        return new ExtractionException("non-positive tag id: " + value);
    }

    public static ExtractionException trainingNotList(String fieldName) {
        return new ExtractionException("El valor del campo '" + fieldName + "' no es una lista");
    }

    public static ExtractionException trainingItemInvalid(int index) {
        return new ExtractionException("La capacitación #" + index + " no es un registro con Label de texto");
    }

    public static ExtractionException trainingLabelTooLong(int index, int maxLength) {
        return new ExtractionException("La capacitación #" + index + " supera los " + maxLength + " caracteres");
    }

    /**
     * Añade el id del contacto al mensaje.
     */
    public static ExtractionException forContact(long contactId, ExtractionException cause) {
        return new ExtractionException("Contacto " + contactId + ": " + cause.getMessage(), cause);
    }
}
