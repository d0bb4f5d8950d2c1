package com.serviceintake.domain.exception;

/**
 * Excepción que indica que otra transacción insertó primero la misma clave
 * única. Es contención esperada: se recupera releyendo el registro ganador y
 * nunca llega al llamador.
 */
public class IdentityConflictException extends RuntimeException {

    public IdentityConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Conflicto al insertar un cliente.
     */
    public static IdentityConflictException customer(Object key, Throwable cause) {
        return new IdentityConflictException("Cliente insertado concurrentemente: " + key, cause);
    }

    /**
     * Conflicto al insertar un vehículo.
     */
    public static IdentityConflictException vehicle(Long customerId, String plate, Throwable cause) {
        return new IdentityConflictException(
                String.format("Vehículo %s insertado concurrentemente para el cliente %d", plate, customerId), cause);
    }
}
