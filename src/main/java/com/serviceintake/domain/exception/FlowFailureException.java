package com.serviceintake.domain.exception;

import lombok.Getter;

/**
 * Excepción lanzada cuando falla un paso del flujo completo.
 * Cuando llega al llamador la transacción ya fue revertida: no queda ningún
 * cliente, vehículo ni orden parcial.
 */
@Getter
public class FlowFailureException extends RuntimeException {

    private final FlowStep step;

    public FlowFailureException(FlowStep step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    /**
     * Fallo en un paso concreto del flujo.
     */
    public static FlowFailureException at(FlowStep step, Throwable cause) {
        return new FlowFailureException(step,
                String.format("Fallo en el paso %s: %s", step, cause.getMessage()), cause);
    }

    /**
     * El llamador canceló el flujo antes de confirmarlo.
     */
    public static FlowFailureException cancelled() {
        return new FlowFailureException(FlowStep.COMMIT, "Flujo cancelado antes de confirmar", null);
    }
}
