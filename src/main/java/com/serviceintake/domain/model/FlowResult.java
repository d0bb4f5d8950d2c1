package com.serviceintake.domain.model;

import java.util.Optional;

/**
 * Resultado de un flujo completo ya confirmado.
 *
 * @param customer        Cliente canónico, con la visita ya registrada
 * @param vehicle         Vehículo resuelto o null
 * @param order           Orden creada
 * @param createdCustomer true si el cliente se creó en este flujo
 */
public record FlowResult(
        Customer customer,
        Vehicle vehicle,
        ServiceOrder order,
        boolean createdCustomer) {

    public Optional<Vehicle> vehicleIfPresent() {
        return Optional.ofNullable(vehicle);
    }
}
