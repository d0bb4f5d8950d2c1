package com.serviceintake.application.dto;

import com.serviceintake.domain.model.FlowResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO con el resultado de un flujo completo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowResultDto {

    private CustomerDto customer;
    private VehicleDto vehicle;
    private ServiceOrderDto order;
    private boolean createdCustomer;

    public static FlowResultDto fromDomain(FlowResult result) {
        return FlowResultDto.builder()
                .customer(CustomerDto.fromDomain(result.customer()))
                .vehicle(result.vehicleIfPresent().map(VehicleDto::fromDomain).orElse(null))
                .order(ServiceOrderDto.fromDomain(result.order()))
                .createdCustomer(result.createdCustomer())
                .build();
    }
}
