package com.serviceintake.application.service;

import com.serviceintake.application.dto.CustomerDto;
import com.serviceintake.application.dto.ServiceOrderDto;
import com.serviceintake.application.dto.VehicleDto;
import com.serviceintake.domain.port.CustomerRepository;
import com.serviceintake.domain.port.OrderRepository;
import com.serviceintake.domain.port.VehicleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Consultas de solo lectura sobre clientes y sus entidades dependientes.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CustomerQueryService {

    private final CustomerRepository customerRepository;
    private final VehicleRepository vehicleRepository;
    private final OrderRepository orderRepository;

    public Optional<CustomerDto> findCustomer(Long customerId) {
        return customerRepository.findById(customerId).map(CustomerDto::fromDomain);
    }

    public List<VehicleDto> getVehicles(Long customerId) {
        return vehicleRepository.findByCustomer(customerId).stream()
                .map(VehicleDto::fromDomain)
                .collect(Collectors.toList());
    }

    public List<ServiceOrderDto> getOrders(Long customerId) {
        return orderRepository.findByCustomer(customerId).stream()
                .map(ServiceOrderDto::fromDomain)
                .collect(Collectors.toList());
    }
}
