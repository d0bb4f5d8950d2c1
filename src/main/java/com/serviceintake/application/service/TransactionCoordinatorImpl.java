package com.serviceintake.application.service;

import com.serviceintake.domain.exception.FlowFailureException;
import com.serviceintake.domain.exception.FlowStep;
import com.serviceintake.domain.exception.IdentityConflictException;
import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.exception.ResolutionFailureException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.CustomerResolution;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.FlowResult;
import com.serviceintake.domain.model.IdentityKey;
import com.serviceintake.domain.model.ServiceOrder;
import com.serviceintake.domain.model.Vehicle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Implementación del coordinador de flujos completos.
 *
 * <p>
 * Orden de los pasos dentro de una única transacción: cliente, vehículo,
 * orden y visita. Cualquier fallo revierte la unidad completa. Si otra
 * transacción crea antes el mismo cliente o vehículo, la unidad se revierte y
 * se ejecuta una vez más en modo relectura.
 *
 * <p>
 * Los datos de cliente, vehículo y orden se validan antes de abrir la
 * transacción: una solicitud inválida no llega al almacén.
 *
 * <p>
 * La visita se registra una sola vez por flujo: si el cliente se crea en el
 * flujo, la inserción ya cuenta como su primera visita.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionCoordinatorImpl implements TransactionCoordinator {

    private final FallbackIdentityPolicy fallbackIdentityPolicy;
    private final IdentityMatcher identityMatcher;
    private final CustomerResolver customerResolver;
    private final VehicleResolver vehicleResolver;
    private final ServiceOrderCreator orderCreator;
    private final VisitTracker visitTracker;
    private final TransactionTemplate transactionTemplate;

    @Override
    public FlowResult createCompleteFlow(FlowRequest request) {
        if (request.getCustomer() == null) {
            throw IdentityValidationException.emptyIdentity(null);
        }
        CandidateIdentity candidate = fallbackIdentityPolicy.apply(request.getCustomer(), request.getChannel());
        IdentityKey key = identityMatcher.keyOf(candidate);
        vehicleResolver.validate(request.getVehicle());
        orderCreator.validate(request.getOrder(), candidate.getSourceReference());

        log.info("Iniciando flujo {} para {}", request.getChannel(), key);

        FlowResult result;
        try {
            result = runUnit(request, candidate, key, true);
        } catch (IdentityConflictException e) {
            log.warn("Conflicto concurrente en flujo {} ({}), reintentando en modo relectura",
                    request.getChannel(), e.getMessage());
            try {
                result = runUnit(request, candidate, key, false);
            } catch (IdentityConflictException again) {
                throw ResolutionFailureException.conflictPersisted(key, again);
            }
        }

        log.info("Flujo {} confirmado: cliente={} (nuevo={}) vehículo={} orden={} visitas={}",
                request.getChannel(),
                result.customer().getId(),
                result.createdCustomer(),
                result.vehicleIfPresent().map(Vehicle::getId).orElse(null),
                result.order().getId(),
                result.customer().getTotalVisits());
        return result;
    }

    private FlowResult runUnit(FlowRequest request, CandidateIdentity candidate, IdentityKey key,
            boolean allowInsert) {
        try {
            return transactionTemplate.execute(status -> executeSteps(request, candidate, key, allowInsert));
        } catch (TransactionException | DataAccessException e) {
            // Fallo al confirmar: los pasos terminaron pero el almacén rechazó el commit
            log.error("Error confirmando flujo {}: {}", request.getChannel(), e.getMessage());
            throw FlowFailureException.at(FlowStep.COMMIT, e);
        }
    }

    private FlowResult executeSteps(FlowRequest request, CandidateIdentity candidate, IdentityKey key,
            boolean allowInsert) {
        CustomerResolution resolution = step(FlowStep.CUSTOMER,
                () -> customerResolver.resolveInCurrentTransaction(key, allowInsert));
        Customer customer = resolution.customer();

        Vehicle vehicle = step(FlowStep.VEHICLE,
                () -> vehicleResolver.resolveOrCreate(customer, request.getVehicle()).orElse(null));

        ServiceOrder order = step(FlowStep.ORDER,
                () -> orderCreator.create(customer, vehicle, request.getOrder(),
                        request.getChannel(), candidate.getSourceReference()));

        Customer visited = resolution.created()
                ? customer
                : step(FlowStep.VISIT, () -> visitTracker.recordVisit(customer));

        if (Thread.currentThread().isInterrupted()) {
            log.warn("Flujo {} cancelado antes de confirmar, revirtiendo", request.getChannel());
            throw FlowFailureException.cancelled();
        }

        return new FlowResult(visited, vehicle, order, resolution.created());
    }

    /**
     * Ejecuta un paso y etiqueta sus fallos con el nombre del paso. Los
     * conflictos, validaciones y fallos de resolución se propagan tal cual.
     */
    private <T> T step(FlowStep step, Supplier<T> action) {
        try {
            return action.get();
        } catch (IdentityConflictException | IdentityValidationException
                | ResolutionFailureException | FlowFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Fallo en el paso {} del flujo: {}", step, e.getMessage());
            throw FlowFailureException.at(step, e);
        }
    }
}
