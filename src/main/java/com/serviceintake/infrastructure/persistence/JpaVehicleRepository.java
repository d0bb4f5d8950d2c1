package com.serviceintake.infrastructure.persistence;

import com.serviceintake.infrastructure.persistence.entity.VehicleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con vehicles.
 */
@Repository
public interface JpaVehicleRepository extends JpaRepository<VehicleEntity, Long> {

    Optional<VehicleEntity> findByCustomerIdAndPlate(Long customerId, String plate);

    List<VehicleEntity> findByCustomerIdOrderByIdAsc(Long customerId);
}
