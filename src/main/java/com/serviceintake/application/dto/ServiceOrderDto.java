package com.serviceintake.application.dto;

import com.serviceintake.domain.model.ServiceOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO para transferencia de datos de orden.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOrderDto {

    private Long id;
    private Long customerId;
    private Long vehicleId;
    private String type;
    private String channel;
    private String sourceReference;
    private String notes;
    private String createdAt;

    public static ServiceOrderDto fromDomain(ServiceOrder order) {
        return ServiceOrderDto.builder()
                .id(order.getId())
                .customerId(order.getCustomerId())
                .vehicleId(order.getVehicleId())
                .type(order.getType().name())
                .channel(order.getChannel().name())
                .sourceReference(order.getSourceReference())
                .notes(order.getNotes())
                .createdAt(CustomerDto.format(order.getCreatedAt()))
                .build();
    }
}
