package com.serviceintake.infrastructure.persistence;

import com.serviceintake.infrastructure.persistence.entity.ServiceOrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repositorio JPA para operaciones con service_orders.
 */
@Repository
public interface JpaServiceOrderRepository extends JpaRepository<ServiceOrderEntity, Long> {

    List<ServiceOrderEntity> findByCustomerIdOrderByIdAsc(Long customerId);
}
