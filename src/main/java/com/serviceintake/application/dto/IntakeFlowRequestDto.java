package com.serviceintake.application.dto;

import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.VehicleDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cuerpo de la petición de un flujo completo enviado por un punto de entrada.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntakeFlowRequestDto {

    private IntakeChannel channel;
    private CandidateIdentity customer;
    private VehicleDetails vehicle;
    private OrderDetails order;

    public FlowRequest toFlowRequest() {
        return FlowRequest.builder()
                .channel(channel)
                .customer(customer)
                .vehicle(vehicle)
                .order(order)
                .build();
    }
}
