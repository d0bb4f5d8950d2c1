package com.serviceintake.infrastructure.persistence.entity;

import com.serviceintake.domain.model.CustomerStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla customers.
 * La restricción uk_customer_identity es el único árbitro de unicidad.
 *
 * <p>
 * La comparación de la tupla es exacta y distingue mayúsculas, acentos y
 * espacios finales, igual que la búsqueda de IdentityMatcher. En MySQL las
 * columnas de identidad deben usar una collation binaria (utf8mb4_bin): con la
 * collation por defecto (*_ai_ci) "jane doe" y "Jane Doe" chocarían en el
 * índice pero la relectura tras el conflicto sí las distinguiría.
 */
@Entity
@Table(name = "customers", uniqueConstraints = @UniqueConstraint(
        name = "uk_customer_identity",
        columnNames = { "branch_id", "full_name", "phone", "organization_name", "tax_number" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private Integer branch;

    @Column(name = "full_name", nullable = false, updatable = false, length = 150)
    private String fullName;

    @Column(name = "phone", nullable = false, updatable = false, length = 32)
    private String phone;

    @Column(name = "organization_name", nullable = false, updatable = false, length = 150)
    private String organizationName;

    @Column(name = "tax_number", nullable = false, updatable = false, length = 32)
    private String taxNumber;

    @Column(name = "arrival_time", nullable = false)
    private LocalDateTime arrivalTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_status", nullable = false, length = 20)
    private CustomerStatus currentStatus;

    @Column(name = "last_visit", nullable = false)
    private LocalDateTime lastVisit;

    @Column(name = "total_visits", nullable = false)
    private Integer totalVisits;
}
