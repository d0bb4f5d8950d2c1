package com.serviceintake.infrastructure.persistence;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * Identifica qué restricción rechazó una escritura.
 *
 * <p>
 * Solo una violación de las restricciones únicas de identidad indica que otra
 * transacción ganó la carrera. Longitudes, nulos o claves foráneas son
 * errores de datos y no deben tratarse como conflicto.
 */
final class UniqueConstraints {

    static final String CUSTOMER_IDENTITY = "uk_customer_identity";
    static final String VEHICLE_CUSTOMER_PLATE = "uk_vehicle_customer_plate";

    private UniqueConstraints() {
    }

    /**
     * Indica si la excepción proviene de la restricción indicada.
     *
     * @param e          Excepción traducida por Spring
     * @param constraint Nombre de la restricción única
     * @return true si alguna causa nombra la restricción
     */
    static boolean isViolationOf(DataIntegrityViolationException e, String constraint) {
        String expected = constraint.toLowerCase(Locale.ROOT);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException
                    && mentions(((ConstraintViolationException) cause).getConstraintName(), expected)) {
                return true;
            }
            // H2 y MySQL incluyen el nombre del índice en el mensaje del driver
            if (mentions(cause.getMessage(), expected)) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static boolean mentions(String text, String constraint) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(constraint);
    }
}
