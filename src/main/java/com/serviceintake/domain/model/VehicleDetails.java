package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Atributos de vehículo suministrados por un punto de entrada.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleDetails {

    private String plate;

    private String make;

    private String model;

    private Integer year;
}
