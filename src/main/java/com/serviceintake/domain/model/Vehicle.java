package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Modelo de dominio que representa un vehículo de un cliente.
 * Se identifica por el par (customerId, plate).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vehicle {

    private Long id;

    private Long customerId;

    /** Matrícula canónica: mayúsculas, sin espacios ni guiones */
    private String plate;

    private String make;

    private String model;

    private Integer year;
}
