package com.serviceintake.domain.port;

import com.serviceintake.domain.model.Vehicle;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para la persistencia de vehículos.
 */
public interface VehicleRepository {

    /**
     * Busca un vehículo por cliente y matrícula canónica.
     */
    Optional<Vehicle> findByCustomerAndPlate(Long customerId, String plate);

    /**
     * Obtiene los vehículos de un cliente.
     */
    List<Vehicle> findByCustomer(Long customerId);

    /**
     * Inserta un vehículo nuevo.
     *
     * @throws com.serviceintake.domain.exception.IdentityConflictException si
     *         el par (cliente, matrícula) ya fue insertado por otra transacción
     */
    Vehicle insert(Vehicle vehicle);

    /**
     * Actualiza los datos descriptivos de un vehículo existente.
     */
    Vehicle update(Vehicle vehicle);
}
