package com.serviceintake.domain.model;

/**
 * Estado del cliente dentro del taller.
 */
public enum CustomerStatus {

    /** Cliente recién llegado o registrado */
    ARRIVED,

    /** Cliente con un servicio en curso */
    IN_SERVICE,

    /** Cliente que ya se retiró */
    DEPARTED
}
