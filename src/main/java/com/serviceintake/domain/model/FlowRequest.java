package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Solicitud completa de un punto de entrada: cliente, vehículo opcional y
 * orden.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowRequest {

    private IntakeChannel channel;

    private CandidateIdentity customer;

    /** Opcional: null en flujos sin vehículo */
    private VehicleDetails vehicle;

    private OrderDetails order;
}
