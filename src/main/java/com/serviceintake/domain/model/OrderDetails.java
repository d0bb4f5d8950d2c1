package com.serviceintake.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Atributos de la orden a crear en un flujo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetails {

    private OrderType type;

    private String notes;
}
