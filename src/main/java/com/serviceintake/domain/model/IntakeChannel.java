package com.serviceintake.domain.model;

import lombok.Getter;

/**
 * Punto de entrada que origina una interacción con el cliente.
 * El código corto se usa para construir identidades de respaldo.
 */
@Getter
public enum IntakeChannel {

    INVOICE_CAPTURE("INV"),

    DOCUMENT_INGESTION("DOC"),

    ORDER_INTAKE("ORD"),

    REGISTRATION_WIZARD("REG"),

    QUICK_CREATE("QCK");

    private final String code;

    IntakeChannel(String code) {
        this.code = code;
    }
}
