package com.serviceintake.application.service;

import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.IntakeChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asigna una identidad de respaldo documentada a los clientes sin
 * identificar.
 *
 * <p>
 * Si la candidata no trae nombre, teléfono, organización ni número fiscal
 * pero sí una referencia estable de origen, el nombre pasa a ser
 * {@code "Walk-in <CANAL>-<referencia>"} (por ejemplo {@code Walk-in INV-4711}).
 * La etiqueta solo depende de la referencia y del canal, así la misma visita
 * sin identificar siempre resuelve al mismo cliente. Nunca se usa la matrícula
 * ni otros atributos transitorios.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackIdentityPolicy {

    public static final String LABEL_PREFIX = "Walk-in ";

    private final PhoneNormalizer phoneNormalizer;

    /**
     * Aplica la política a una candidata.
     *
     * @param candidate Identidad candidata
     * @param channel   Punto de entrada
     * @return La misma candidata si tiene datos, o una copia con el nombre de
     *         respaldo
     * @throws IdentityValidationException si no hay datos ni referencia
     */
    public CandidateIdentity apply(CandidateIdentity candidate, IntakeChannel channel) {
        if (channel == null) {
            throw IdentityValidationException.missingChannel();
        }
        if (hasIdentifyingData(candidate)) {
            return candidate;
        }

        String reference = trimToEmpty(candidate.getSourceReference());
        if (reference.isEmpty()) {
            throw IdentityValidationException.emptyIdentity(candidate.getBranch());
        }

        String label = fallbackName(channel, reference);
        log.info("Cliente sin identificar desde {}: se usa identidad de respaldo '{}'", channel, label);
        return candidate.toBuilder()
                .fullName(label)
                .build();
    }

    /**
     * Construye el nombre de respaldo de una referencia.
     */
    public static String fallbackName(IntakeChannel channel, String reference) {
        return LABEL_PREFIX + channel.getCode() + "-" + reference.trim();
    }

    private boolean hasIdentifyingData(CandidateIdentity candidate) {
        return !trimToEmpty(candidate.getFullName()).isEmpty()
                || !phoneNormalizer.normalize(candidate.getPhone()).isEmpty()
                || !trimToEmpty(candidate.getOrganizationName()).isEmpty()
                || !trimToEmpty(candidate.getTaxNumber()).isEmpty();
    }

    private String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
