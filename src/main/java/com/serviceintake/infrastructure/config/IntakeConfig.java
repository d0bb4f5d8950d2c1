package com.serviceintake.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuración de reloj y transacciones programáticas para la resolución de
 * identidades.
 */
@Configuration
@Slf4j
public class IntakeConfig {

    @Value("${identity.flow.transaction-timeout-seconds:30}")
    private int transactionTimeoutSeconds;

    /**
     * Reloj con precisión de milisegundos, la misma que guardan las columnas
     * TIMESTAMP.
     */
    @Bean
    public Clock intakeClock() {
        return Clock.tick(Clock.systemDefaultZone(), Duration.ofMillis(1));
    }

    /**
     * Plantilla para las unidades de trabajo de cliente, vehículo y orden.
     */
    @Bean
    public TransactionTemplate intakeTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(transactionTimeoutSeconds);
        log.info("Transacciones de ingreso configuradas: READ_COMMITTED, timeout={}s", transactionTimeoutSeconds);
        return template;
    }
}
