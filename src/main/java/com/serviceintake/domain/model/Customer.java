package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa un cliente.
 * La tupla (branch, fullName, phone, organizationName, taxNumber) es su
 * identidad y no cambia después de la creación.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    private Long id;

    /** Sucursal a la que pertenece el cliente */
    private Integer branch;

    private String fullName;

    /** Teléfono normalizado (ver PhoneNormalizer) */
    private String phone;

    private String organizationName;

    private String taxNumber;

    private LocalDateTime arrivalTime;

    private CustomerStatus currentStatus;

    private LocalDateTime lastVisit;

    /** Número de visitas registradas, al menos 1 una vez creado */
    private Integer totalVisits;

    /**
     * Crea un cliente nuevo para la identidad dada, con su primera visita
     * registrada en el instante indicado.
     *
     * @param key Identidad normalizada
     * @param now Instante de llegada
     * @return Cliente sin persistir
     */
    public static Customer arriving(IdentityKey key, LocalDateTime now) {
        return Customer.builder()
                .branch(key.branch())
                .fullName(key.fullName())
                .phone(key.phone())
                .organizationName(key.organizationName())
                .taxNumber(key.taxNumber())
                .arrivalTime(now)
                .currentStatus(CustomerStatus.ARRIVED)
                .lastVisit(now)
                .totalVisits(1)
                .build();
    }

    /**
     * Obtiene la identidad del cliente.
     */
    public IdentityKey identityKey() {
        return new IdentityKey(branch, fullName, phone, organizationName, taxNumber);
    }
}
