package com.serviceintake.application.service;

import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.IdentityKey;
import com.serviceintake.domain.port.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Busca clientes por igualdad exacta de la tupla de identidad.
 * No hay coincidencia aproximada: dos tuplas coinciden solo si todos sus
 * atributos normalizados son iguales, distinguiendo mayúsculas y acentos.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdentityMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Longitud máxima de nombre y organización en la tabla customers */
    public static final int MAX_NAME_LENGTH = 150;

    /** Longitud máxima de teléfono y número fiscal en la tabla customers */
    public static final int MAX_CODE_LENGTH = 32;

    private final PhoneNormalizer phoneNormalizer;
    private final CustomerRepository customerRepository;

    /**
     * Busca el cliente de la tupla indicada.
     *
     * @return Optional con el único cliente que coincide
     */
    public Optional<Customer> find(Integer branch, String fullName, String phone,
            String organizationName, String taxNumber) {
        return find(keyOf(branch, fullName, phone, organizationName, taxNumber));
    }

    /**
     * Busca el cliente de una identidad ya normalizada.
     */
    public Optional<Customer> find(IdentityKey key) {
        Optional<Customer> match = customerRepository.findByIdentity(key);
        log.debug("Búsqueda de identidad {} -> {}", key,
                match.map(c -> "cliente " + c.getId()).orElse("sin coincidencia"));
        return match;
    }

    /**
     * Normaliza y valida una identidad candidata.
     *
     * @throws IdentityValidationException si la sucursal no es válida, todos
     *                                     los atributos están vacíos o alguno
     *                                     excede su longitud máxima
     */
    public IdentityKey keyOf(CandidateIdentity candidate) {
        return keyOf(candidate.getBranch(), candidate.getFullName(), candidate.getPhone(),
                candidate.getOrganizationName(), candidate.getTaxNumber());
    }

    /**
     * Normaliza y valida los atributos de identidad.
     */
    public IdentityKey keyOf(Integer branch, String fullName, String phone,
            String organizationName, String taxNumber) {
        if (branch == null || branch <= 0) {
            throw IdentityValidationException.invalidBranch(branch);
        }

        IdentityKey key = new IdentityKey(
                branch,
                normalizeText(fullName),
                phoneNormalizer.normalize(phone),
                normalizeText(organizationName),
                normalizeTaxNumber(taxNumber));

        if (key.isBlank()) {
            throw IdentityValidationException.emptyIdentity(branch);
        }
        checkLength("fullName", key.fullName(), MAX_NAME_LENGTH);
        checkLength("phone", key.phone(), MAX_CODE_LENGTH);
        checkLength("organizationName", key.organizationName(), MAX_NAME_LENGTH);
        checkLength("taxNumber", key.taxNumber(), MAX_CODE_LENGTH);
        return key;
    }

    private void checkLength(String field, String value, int maxLength) {
        if (value.length() > maxLength) {
            throw IdentityValidationException.tooLong(field, maxLength);
        }
    }

    private String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    private String normalizeTaxNumber(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll("").toUpperCase();
    }
}
