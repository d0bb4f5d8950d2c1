package com.serviceintake.infrastructure.persistence;

import com.serviceintake.domain.exception.IdentityConflictException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import com.serviceintake.domain.model.Vehicle;
import com.serviceintake.domain.port.VehicleRepository;
import com.serviceintake.infrastructure.persistence.entity.VehicleEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del puerto VehicleRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VehicleRepositoryImpl implements VehicleRepository {

    private final JpaVehicleRepository vehicleRepository;
    private final JpaCustomerRepository customerRepository;

    @Override
    public Optional<Vehicle> findByCustomerAndPlate(Long customerId, String plate) {
        return vehicleRepository.findByCustomerIdAndPlate(customerId, plate)
                .map(this::toDomain);
    }

    @Override
    public List<Vehicle> findByCustomer(Long customerId) {
        return vehicleRepository.findByCustomerIdOrderByIdAsc(customerId)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    public Vehicle insert(Vehicle vehicle) {
        VehicleEntity entity = VehicleEntity.builder()
                .customer(customerRepository.getReferenceById(vehicle.getCustomerId()))
                .plate(vehicle.getPlate())
                .make(vehicle.getMake())
                .model(vehicle.getModel())
                .year(vehicle.getYear())
                .build();
        try {
            VehicleEntity saved = vehicleRepository.saveAndFlush(entity);
            log.info("Vehículo insertado: id={} placa={} cliente={}",
                    saved.getId(), saved.getPlate(), vehicle.getCustomerId());
            return toDomain(saved);
        } catch (DataIntegrityViolationException e) {
            if (!UniqueConstraints.isViolationOf(e, UniqueConstraints.VEHICLE_CUSTOMER_PLATE)) {
                throw e;
            }
            throw IdentityConflictException.vehicle(vehicle.getCustomerId(), vehicle.getPlate(), e);
        }
    }

    @Override
    public Vehicle update(Vehicle vehicle) {
        VehicleEntity entity = vehicleRepository.findById(vehicle.getId())
                .orElseThrow(() -> new ResolutionFailureException("Vehículo no encontrado: " + vehicle.getId()));
        entity.setMake(vehicle.getMake());
        entity.setModel(vehicle.getModel());
        entity.setYear(vehicle.getYear());
        return toDomain(vehicleRepository.saveAndFlush(entity));
    }

    /**
     * Convierte una entidad JPA a un Vehicle de dominio.
     */
    private Vehicle toDomain(VehicleEntity entity) {
        return Vehicle.builder()
                .id(entity.getId())
                .customerId(entity.getCustomer().getId())
                .plate(entity.getPlate())
                .make(entity.getMake())
                .model(entity.getModel())
                .year(entity.getYear())
                .build();
    }
}
