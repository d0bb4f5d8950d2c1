package com.serviceintake.application.dto;

import com.serviceintake.domain.model.Customer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * DTO para transferencia de datos de cliente.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDto {

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Long id;
    private Integer branch;
    private String fullName;
    private String phone;
    private String organizationName;
    private String taxNumber;
    private String status;
    private String arrivalTime;
    private String lastVisit;
    private Integer totalVisits;

    /**
     * Convierte un modelo de dominio a DTO.
     */
    public static CustomerDto fromDomain(Customer customer) {
        return CustomerDto.builder()
                .id(customer.getId())
                .branch(customer.getBranch())
                .fullName(customer.getFullName())
                .phone(customer.getPhone())
                .organizationName(customer.getOrganizationName())
                .taxNumber(customer.getTaxNumber())
                .status(customer.getCurrentStatus() != null ? customer.getCurrentStatus().name() : null)
                .arrivalTime(format(customer.getArrivalTime()))
                .lastVisit(format(customer.getLastVisit()))
                .totalVisits(customer.getTotalVisits())
                .build();
    }

    static String format(LocalDateTime value) {
        return value != null ? value.format(DATE_FORMAT) : "N/A";
    }
}
