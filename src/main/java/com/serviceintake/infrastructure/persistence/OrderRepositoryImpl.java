package com.serviceintake.infrastructure.persistence;

import com.serviceintake.domain.model.ServiceOrder;
import com.serviceintake.domain.port.OrderRepository;
import com.serviceintake.infrastructure.persistence.entity.ServiceOrderEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementación del puerto OrderRepository usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderRepositoryImpl implements OrderRepository {

    private final JpaServiceOrderRepository orderRepository;
    private final JpaCustomerRepository customerRepository;
    private final JpaVehicleRepository vehicleRepository;

    @Override
    public ServiceOrder insert(ServiceOrder order) {
        ServiceOrderEntity entity = ServiceOrderEntity.builder()
                .customer(customerRepository.getReferenceById(order.getCustomerId()))
                .vehicle(order.getVehicleId() != null
                        ? vehicleRepository.getReferenceById(order.getVehicleId())
                        : null)
                .type(order.getType())
                .channel(order.getChannel())
                .sourceReference(order.getSourceReference())
                .notes(order.getNotes())
                .createdAt(order.getCreatedAt())
                .build();

        ServiceOrderEntity saved = orderRepository.saveAndFlush(entity);
        log.info("Orden {} creada: id={} cliente={} canal={}",
                saved.getType(), saved.getId(), order.getCustomerId(), saved.getChannel());
        return toDomain(saved, order.getCustomerId(), order.getVehicleId());
    }

    @Override
    public List<ServiceOrder> findByCustomer(Long customerId) {
        return orderRepository.findByCustomerIdOrderByIdAsc(customerId)
                .stream()
                .map(entity -> toDomain(entity, customerId,
                        entity.getVehicle() != null ? entity.getVehicle().getId() : null))
                .collect(Collectors.toList());
    }

    /**
     * Convierte una entidad JPA a una ServiceOrder de dominio.
     */
    private ServiceOrder toDomain(ServiceOrderEntity entity, Long customerId, Long vehicleId) {
        return ServiceOrder.builder()
                .id(entity.getId())
                .customerId(customerId)
                .vehicleId(vehicleId)
                .type(entity.getType())
                .channel(entity.getChannel())
                .sourceReference(entity.getSourceReference())
                .notes(entity.getNotes())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
