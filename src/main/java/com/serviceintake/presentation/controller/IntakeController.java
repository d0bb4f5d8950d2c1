package com.serviceintake.presentation.controller;

import com.serviceintake.application.dto.CustomerDto;
import com.serviceintake.application.dto.CustomerResolutionDto;
import com.serviceintake.application.dto.FlowResultDto;
import com.serviceintake.application.dto.IntakeFlowRequestDto;
import com.serviceintake.application.dto.ServiceOrderDto;
import com.serviceintake.application.dto.VehicleDto;
import com.serviceintake.application.service.CustomerQueryService;
import com.serviceintake.application.service.CustomerResolver;
import com.serviceintake.application.service.TransactionCoordinator;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.FlowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controlador REST usado por los puntos de entrada (captura de facturas,
 * recepción de órdenes, asistente de registro, alta rápida) para registrar
 * interacciones y resolver clientes.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class IntakeController {

    private final TransactionCoordinator transactionCoordinator;
    private final CustomerResolver customerResolver;
    private final CustomerQueryService customerQueryService;

    /**
     * Registra un flujo completo: cliente, vehículo opcional, orden y visita.
     *
     * @param request Datos ya extraídos por el punto de entrada
     * @return Resultado del flujo
     */
    @PostMapping("/intake/flows")
    public ResponseEntity<FlowResultDto> createFlow(@RequestBody IntakeFlowRequestDto request) {
        log.info("Solicitud de flujo completo desde {}", request.getChannel());
        FlowResult result = transactionCoordinator.createCompleteFlow(request.toFlowRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(FlowResultDto.fromDomain(result));
    }

    /**
     * Resuelve un cliente sin crear orden ni registrar visita.
     */
    @PostMapping("/customers/resolve")
    public ResponseEntity<CustomerResolutionDto> resolveCustomer(@RequestBody CandidateIdentity candidate) {
        return ResponseEntity.ok(CustomerResolutionDto.fromDomain(customerResolver.resolveOrCreate(candidate)));
    }

    /**
     * Obtiene un cliente por su id.
     */
    @GetMapping("/customers/{id}")
    public ResponseEntity<CustomerDto> getCustomer(@PathVariable Long id) {
        return customerQueryService.findCustomer(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Obtiene los vehículos de un cliente.
     */
    @GetMapping("/customers/{id}/vehicles")
    public ResponseEntity<List<VehicleDto>> getVehicles(@PathVariable Long id) {
        return ResponseEntity.ok(customerQueryService.getVehicles(id));
    }

    /**
     * Obtiene las órdenes de un cliente.
     */
    @GetMapping("/customers/{id}/orders")
    public ResponseEntity<List<ServiceOrderDto>> getOrders(@PathVariable Long id) {
        return ResponseEntity.ok(customerQueryService.getOrders(id));
    }
}
