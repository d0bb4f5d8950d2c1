package com.serviceintake.application.service;

import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.port.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Registra visitas de clientes: suma una al contador y avanza la fecha de
 * última visita.
 *
 * <p>
 * Debe invocarse una sola vez por interacción con el cliente (una orden, no
 * cada entidad tocada dentro de ella). La idempotencia depende de la
 * transacción del llamador.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisitTracker {

    private final CustomerRepository customerRepository;
    private final Clock clock;

    /**
     * Registra una visita del cliente.
     *
     * @param customer Cliente persistido
     * @return Cliente con el contador y la fecha actualizados
     */
    public Customer recordVisit(Customer customer) {
        LocalDateTime now = LocalDateTime.now(clock);
        Customer updated = customerRepository.incrementVisits(customer.getId(), now);
        log.info("Visita registrada: cliente={} total={} última={}",
                updated.getId(), updated.getTotalVisits(), updated.getLastVisit());
        return updated;
    }
}
