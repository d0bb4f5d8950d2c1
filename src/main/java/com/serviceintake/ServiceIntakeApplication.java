package com.serviceintake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Service Intake Identity - Aplicación Principal
 *
 * Resolución única de clientes para todos los puntos de entrada del taller:
 * - Captura de facturas e ingesta de documentos
 * - Recepción de órdenes, asistente de registro y alta rápida
 * - Vehículos y órdenes creados en la misma unidad atómica
 */
@SpringBootApplication
@EnableScheduling
public class ServiceIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceIntakeApplication.class, args);
    }
}
