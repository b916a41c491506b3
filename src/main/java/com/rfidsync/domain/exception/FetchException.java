package com.rfidsync.domain.exception;

/**
 * Excepción lanzada cuando el directorio no responde o rechaza la petición.
 * Aborta el ciclo antes de cualquier escritura.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FetchException unreachable(String url, Throwable cause) {
        return new FetchException("No se pudo contactar el directorio: " + url, cause);
    }

    public static FetchException rejected(String url, int status) {
        return new FetchException("El directorio rechazó la petición " + url + " (HTTP " + status + ")");
    }

    public static FetchException emptyBody(String url) {
        return new FetchException("Respuesta vacía del directorio: " + url);
    }
}
