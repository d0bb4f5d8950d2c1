package com.serviceintake.domain.port;

import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.IdentityKey;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Puerto (interfaz) para la persistencia de clientes.
 * La implementación debe garantizar la unicidad de la tupla de identidad.
 */
public interface CustomerRepository {

    /**
     * Busca un cliente por igualdad exacta de su tupla de identidad.
     *
     * @param key Identidad normalizada
     * @return Optional con el cliente si existe
     */
    Optional<Customer> findByIdentity(IdentityKey key);

    /**
     * Busca un cliente por su id.
     *
     * @param id Id del cliente
     * @return Optional con el cliente si existe
     */
    Optional<Customer> findById(Long id);

    /**
     * Inserta un cliente nuevo y lo sincroniza inmediatamente con el almacén.
     *
     * @param customer Cliente a insertar
     * @return Cliente con id asignado
     * @throws com.serviceintake.domain.exception.IdentityConflictException si
     *         otra transacción ya insertó la misma identidad
     */
    Customer insert(Customer customer);

    /**
     * Incrementa de forma atómica el contador de visitas y avanza la fecha de
     * última visita sin retrocederla.
     *
     * @param customerId Id del cliente
     * @param visitedAt  Instante de la visita
     * @return Cliente actualizado
     */
    Customer incrementVisits(Long customerId, LocalDateTime visitedAt);
}
