package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio de una orden. Inmutable una vez creada.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOrder {

    private Long id;

    private Long customerId;

    /** Vehículo de la orden, null en flujos sin vehículo */
    private Long vehicleId;

    private OrderType type;

    private IntakeChannel channel;

    private String sourceReference;

    private String notes;

    private LocalDateTime createdAt;
}
