package com.serviceintake.domain.model;

/**
 * Tipo de orden generada en una interacción con el cliente.
 */
public enum OrderType {

    SERVICE,

    SALES,

    INQUIRY
}
