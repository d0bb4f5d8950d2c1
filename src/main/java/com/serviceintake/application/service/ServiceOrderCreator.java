package com.serviceintake.application.service;

import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.ServiceOrder;
import com.serviceintake.domain.model.Vehicle;
import com.serviceintake.domain.port.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Crea la orden de un flujo ligada al cliente y vehículo ya resueltos.
 */
@Component
@RequiredArgsConstructor
public class ServiceOrderCreator {

    /** Longitud máxima de las notas en la tabla service_orders */
    public static final int MAX_NOTES_LENGTH = 500;

    /** Longitud máxima de la referencia del llamador en la tabla service_orders */
    public static final int MAX_REFERENCE_LENGTH = 64;

    private final OrderRepository orderRepository;
    private final Clock clock;

    /**
     * Crea la orden.
     *
     * @param customer        Cliente resuelto
     * @param vehicle         Vehículo resuelto o null
     * @param details         Tipo y notas de la orden
     * @param channel         Punto de entrada
     * @param sourceReference Referencia estable del llamador, opcional
     * @return Orden persistida
     */
    public ServiceOrder create(Customer customer, Vehicle vehicle, OrderDetails details,
            IntakeChannel channel, String sourceReference) {
        validate(details, sourceReference);
        if (vehicle != null && !customer.getId().equals(vehicle.getCustomerId())) {
            throw new IllegalStateException(String.format(
                    "El vehículo %d no pertenece al cliente %d", vehicle.getId(), customer.getId()));
        }

        return orderRepository.insert(ServiceOrder.builder()
                .customerId(customer.getId())
                .vehicleId(vehicle != null ? vehicle.getId() : null)
                .type(details.getType())
                .channel(channel)
                .sourceReference(emptyToNull(sourceReference))
                .notes(emptyToNull(details.getNotes()))
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    /**
     * Comprueba que la orden indica su tipo y que sus textos caben en el
     * almacén.
     *
     * @throws IdentityValidationException si la orden no es válida
     */
    public void validate(OrderDetails details, String sourceReference) {
        if (details == null || details.getType() == null) {
            throw IdentityValidationException.missingOrderType();
        }
        String notes = emptyToNull(details.getNotes());
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw IdentityValidationException.tooLong("notes", MAX_NOTES_LENGTH);
        }
        String reference = emptyToNull(sourceReference);
        if (reference != null && reference.length() > MAX_REFERENCE_LENGTH) {
            throw IdentityValidationException.tooLong("sourceReference", MAX_REFERENCE_LENGTH);
        }
    }

    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
