package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identidad candidata tal como la entrega un punto de entrada, sin normalizar.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidateIdentity {

    private Integer branch;

    private String fullName;

    private String phone;

    private String organizationName;

    private String taxNumber;

    /**
     * Identificador estable del trabajo o registro que origina la llamada
     * (número de factura, documento, orden). Opcional.
     */
    private String sourceReference;
}
