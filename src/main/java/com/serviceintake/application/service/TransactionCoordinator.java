package com.serviceintake.application.service;

import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.FlowResult;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.VehicleDetails;

/**
 * Punto único por el que todos los puntos de entrada registran una
 * interacción completa: cliente, vehículo opcional, orden y visita.
 */
public interface TransactionCoordinator {

    /**
     * Ejecuta el flujo completo como una sola unidad atómica.
     *
     * @param request Solicitud del punto de entrada
     * @return Resultado confirmado
     * @throws com.serviceintake.domain.exception.IdentityValidationException si
     *         la identidad no tiene datos suficientes (nada se toca)
     * @throws com.serviceintake.domain.exception.ResolutionFailureException si
     *         un conflicto no pudo resolverse (reintentable)
     * @throws com.serviceintake.domain.exception.FlowFailureException si falla
     *         un paso; la unidad completa ya fue revertida
     */
    FlowResult createCompleteFlow(FlowRequest request);

    /**
     * Variante con los atributos por separado.
     *
     * @param vehicle Atributos del vehículo o null para un flujo sin vehículo
     */
    default FlowResult createCompleteFlow(IntakeChannel channel, CandidateIdentity customer,
            VehicleDetails vehicle, OrderDetails order) {
        return createCompleteFlow(FlowRequest.builder()
                .channel(channel)
                .customer(customer)
                .vehicle(vehicle)
                .order(order)
                .build());
    }
}
