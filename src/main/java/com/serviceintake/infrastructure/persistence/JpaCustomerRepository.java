package com.serviceintake.infrastructure.persistence;

import com.serviceintake.infrastructure.persistence.entity.CustomerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con customers.
 */
@Repository
public interface JpaCustomerRepository extends JpaRepository<CustomerEntity, Long> {

    /**
     * Busca un cliente por igualdad exacta de la tupla de identidad.
     */
    Optional<CustomerEntity> findByBranchAndFullNameAndPhoneAndOrganizationNameAndTaxNumber(
            Integer branch, String fullName, String phone, String organizationName, String taxNumber);

    /**
     * Suma una visita y avanza last_visit solo si el nuevo instante es
     * posterior.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CustomerEntity c SET c.totalVisits = c.totalVisits + 1, "
            + "c.lastVisit = CASE WHEN c.lastVisit < :visitedAt THEN :visitedAt ELSE c.lastVisit END "
            + "WHERE c.id = :id")
    int incrementVisits(@Param("id") Long id, @Param("visitedAt") LocalDateTime visitedAt);
}
