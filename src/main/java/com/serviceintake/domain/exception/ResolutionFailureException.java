package com.serviceintake.domain.exception;

/**
 * Excepción lanzada cuando no se puede resolver el registro esperado tras un
 * conflicto. El llamador puede reintentar la operación completa.
 */
public class ResolutionFailureException extends RuntimeException {

    public ResolutionFailureException(String message) {
        super(message);
    }

    public ResolutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * El conflicto se produjo pero la relectura no encontró el registro.
     */
    public static ResolutionFailureException missingAfterConflict(Object key) {
        return new ResolutionFailureException(
                "El cliente no se encontró tras un conflicto de inserción: " + key);
    }

    /**
     * El conflicto se repitió después de la relectura.
     */
    public static ResolutionFailureException conflictPersisted(Object key, Throwable cause) {
        return new ResolutionFailureException(
                "El conflicto persiste después de reintentar: " + key, cause);
    }

    /**
     * El cliente referenciado no existe.
     */
    public static ResolutionFailureException customerNotFound(Long customerId) {
        return new ResolutionFailureException("Cliente no encontrado: " + customerId);
    }
}
