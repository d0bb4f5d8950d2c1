package com.serviceintake.domain.exception;

/**
 * Paso de un flujo completo en el que se produjo un fallo.
 */
public enum FlowStep {

    CUSTOMER,

    VEHICLE,

    ORDER,

    VISIT,

    COMMIT
}
