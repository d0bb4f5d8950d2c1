package com.serviceintake.domain.model;

/**
 * Resultado de resolver un cliente: el registro canónico y si fue creado en
 * esta llamada.
 */
public record CustomerResolution(Customer customer, boolean created) {

    public static CustomerResolution created(Customer customer) {
        return new CustomerResolution(customer, true);
    }

    public static CustomerResolution existing(Customer customer) {
        return new CustomerResolution(customer, false);
    }
}
