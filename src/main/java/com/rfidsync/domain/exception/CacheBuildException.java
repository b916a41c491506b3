package com.rfidsync.domain.exception;

/**
 * Excepción lanzada cuando la lectura de la base para construir la cache es inconsistente.
 */
public class CacheBuildException extends RuntimeException {

    public CacheBuildException(String message) {
        super(message);
    }

    public CacheBuildException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CacheBuildException orphanLink(long tagId, String training) {
        return new CacheBuildException(
                String.format("Vínculo huérfano: el tag %d tiene la capacitación '%s' pero ningún miembro", tagId, training));
    }

    public static CacheBuildException readFailed(Throwable cause) {
        return new CacheBuildException("Error leyendo la base local para construir la cache", cause);
    }
}
