package com.serviceintake.application.dto;

import com.serviceintake.domain.model.CustomerResolution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO con el cliente resuelto y si fue creado.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerResolutionDto {

    private CustomerDto customer;
    private boolean created;

    public static CustomerResolutionDto fromDomain(CustomerResolution resolution) {
        return new CustomerResolutionDto(CustomerDto.fromDomain(resolution.customer()), resolution.created());
    }
}
