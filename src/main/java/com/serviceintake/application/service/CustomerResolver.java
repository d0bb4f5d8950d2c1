package com.serviceintake.application.service;

import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.CustomerResolution;
import com.serviceintake.domain.model.IdentityKey;

/**
 * Servicio que resuelve "quién es este cliente" creando el registro una sola
 * vez aunque varios llamadores compitan por la misma identidad.
 */
public interface CustomerResolver {

    /**
     * Devuelve el cliente de la identidad o lo crea si no existe, en su propia
     * transacción. No debe invocarse dentro de otra transacción: para eso está
     * {@link #resolveInCurrentTransaction(IdentityKey, boolean)}.
     *
     * @return Cliente canónico y si fue creado en esta llamada
     * @throws com.serviceintake.domain.exception.IdentityValidationException si
     *         la identidad no tiene datos suficientes
     * @throws com.serviceintake.domain.exception.ResolutionFailureException si
     *         tras un conflicto no se encuentra el registro ganador
     */
    CustomerResolution resolveOrCreate(Integer branch, String fullName, String phone,
            String organizationName, String taxNumber);

    /**
     * Igual que {@link #resolveOrCreate(Integer, String, String, String, String)}
     * a partir de una identidad candidata.
     */
    CustomerResolution resolveOrCreate(CandidateIdentity candidate);

    /**
     * Resuelve el cliente dentro de la transacción en curso, sin reintentos.
     * Quien controla la transacción es responsable de revertirla y reintentar
     * en modo relectura si se lanza un conflicto.
     *
     * @param key         Identidad normalizada
     * @param allowInsert false para releer sin insertar tras un conflicto
     * @throws com.serviceintake.domain.exception.IdentityConflictException si
     *         otra transacción insertó la misma identidad
     * @throws com.serviceintake.domain.exception.ResolutionFailureException en
     *         modo relectura si el cliente no existe
     */
    CustomerResolution resolveInCurrentTransaction(IdentityKey key, boolean allowInsert);
}
