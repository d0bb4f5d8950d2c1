package com.serviceintake.infrastructure.persistence;

import com.serviceintake.domain.exception.IdentityConflictException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.IdentityKey;
import com.serviceintake.domain.port.CustomerRepository;
import com.serviceintake.infrastructure.persistence.entity.CustomerEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Implementación del puerto CustomerRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerRepositoryImpl implements CustomerRepository {

    private final JpaCustomerRepository customerRepository;

    @Override
    public Optional<Customer> findByIdentity(IdentityKey key) {
        return customerRepository.findByBranchAndFullNameAndPhoneAndOrganizationNameAndTaxNumber(
                key.branch(),
                key.fullName(),
                key.phone(),
                key.organizationName(),
                key.taxNumber())
                .map(this::toDomain);
    }

    @Override
    public Optional<Customer> findById(Long id) {
        return customerRepository.findById(id).map(this::toDomain);
    }

    @Override
    public Customer insert(Customer customer) {
        try {
            CustomerEntity saved = customerRepository.saveAndFlush(toEntity(customer));
            log.info("Cliente insertado: id={} {}", saved.getId(), customer.identityKey());
            return toDomain(saved);
        } catch (DataIntegrityViolationException e) {
            if (!UniqueConstraints.isViolationOf(e, UniqueConstraints.CUSTOMER_IDENTITY)) {
                throw e;
            }
            // Otra transacción insertó la misma identidad primero
            throw IdentityConflictException.customer(customer.identityKey(), e);
        }
    }

    @Override
    @Transactional
    public Customer incrementVisits(Long customerId, LocalDateTime visitedAt) {
        int updated = customerRepository.incrementVisits(customerId, visitedAt);
        if (updated == 0) {
            throw ResolutionFailureException.customerNotFound(customerId);
        }
        return customerRepository.findById(customerId)
                .map(this::toDomain)
                .orElseThrow(() -> ResolutionFailureException.customerNotFound(customerId));
    }

    /**
     * Convierte un Customer de dominio a una entidad JPA.
     */
    private CustomerEntity toEntity(Customer customer) {
        return CustomerEntity.builder()
                .id(customer.getId())
                .branch(customer.getBranch())
                .fullName(customer.getFullName())
                .phone(customer.getPhone())
                .organizationName(customer.getOrganizationName())
                .taxNumber(customer.getTaxNumber())
                .arrivalTime(customer.getArrivalTime())
                .currentStatus(customer.getCurrentStatus())
                .lastVisit(customer.getLastVisit())
                .totalVisits(customer.getTotalVisits())
                .build();
    }

    /**
     * Convierte una entidad JPA a un Customer de dominio.
     */
    private Customer toDomain(CustomerEntity entity) {
        return Customer.builder()
                .id(entity.getId())
                .branch(entity.getBranch())
                .fullName(entity.getFullName())
                .phone(entity.getPhone())
                .organizationName(entity.getOrganizationName())
                .taxNumber(entity.getTaxNumber())
                .arrivalTime(entity.getArrivalTime())
                .currentStatus(entity.getCurrentStatus())
                .lastVisit(entity.getLastVisit())
                .totalVisits(entity.getTotalVisits())
                .build();
    }
}
