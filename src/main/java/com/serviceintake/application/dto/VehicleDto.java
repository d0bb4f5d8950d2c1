package com.serviceintake.application.dto;

import com.serviceintake.domain.model.Vehicle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO para transferencia de datos de vehículo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleDto {

    private Long id;
    private Long customerId;
    private String plate;
    private String make;
    private String model;
    private Integer year;

    public static VehicleDto fromDomain(Vehicle vehicle) {
        return VehicleDto.builder()
                .id(vehicle.getId())
                .customerId(vehicle.getCustomerId())
                .plate(vehicle.getPlate())
                .make(vehicle.getMake())
                .model(vehicle.getModel())
                .year(vehicle.getYear())
                .build();
    }
}
