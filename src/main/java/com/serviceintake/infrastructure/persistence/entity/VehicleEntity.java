package com.serviceintake.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Entidad JPA que mapea a la tabla vehicles.
 */
@Entity
@Table(name = "vehicles", uniqueConstraints = @UniqueConstraint(
        name = "uk_vehicle_customer_plate",
        columnNames = { "customer_id", "plate" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VehicleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CustomerEntity customer;

    @Column(name = "plate", nullable = false, updatable = false, length = 20)
    private String plate;

    @Column(name = "make", length = 60)
    private String make;

    @Column(name = "model", length = 60)
    private String model;

    @Column(name = "model_year")
    private Integer year;
}
