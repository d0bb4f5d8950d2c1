package com.serviceintake.application.service;

import com.serviceintake.domain.exception.IdentityConflictException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.CustomerResolution;
import com.serviceintake.domain.model.IdentityKey;
import com.serviceintake.domain.port.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Implementación del resolvedor de clientes.
 *
 * <p>
 * Protocolo: buscar por tupla exacta; si no existe, insertar de forma
 * optimista. Si la restricción única rechaza la inserción porque otra
 * transacción llegó primero, esta transacción se revierte y se relee el
 * registro ganador en una transacción nueva. No se usan bloqueos de
 * aplicación: el almacén es el único árbitro.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerResolverImpl implements CustomerResolver {

    private final IdentityMatcher identityMatcher;
    private final CustomerRepository customerRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public CustomerResolution resolveOrCreate(Integer branch, String fullName, String phone,
            String organizationName, String taxNumber) {
        return resolve(identityMatcher.keyOf(branch, fullName, phone, organizationName, taxNumber));
    }

    @Override
    public CustomerResolution resolveOrCreate(CandidateIdentity candidate) {
        return resolve(identityMatcher.keyOf(candidate));
    }

    @Override
    public CustomerResolution resolveInCurrentTransaction(IdentityKey key, boolean allowInsert) {
        Optional<Customer> existing = identityMatcher.find(key);
        if (existing.isPresent()) {
            return CustomerResolution.existing(existing.get());
        }

        if (!allowInsert) {
            throw ResolutionFailureException.missingAfterConflict(key);
        }

        Customer created = customerRepository.insert(Customer.arriving(key, LocalDateTime.now(clock)));
        return CustomerResolution.created(created);
    }

    private CustomerResolution resolve(IdentityKey key) {
        try {
            return transactionTemplate.execute(status -> resolveInCurrentTransaction(key, true));
        } catch (IdentityConflictException e) {
            log.warn("Conflicto concurrente al crear cliente {}, releyendo registro ganador", key);
        }

        CustomerResolution resolution = transactionTemplate.execute(status -> resolveInCurrentTransaction(key, false));
        log.info("Cliente {} resuelto tras conflicto: id={}", key, resolution.customer().getId());
        return resolution;
    }
}
