package com.serviceintake.application.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normaliza teléfonos a una forma canónica comparable por igualdad.
 * Es determinista y total: una entrada inutilizable devuelve {@link #EMPTY}.
 *
 * <ul>
 * <li>Se descartan las extensiones ("x", "ext", "#" y lo que sigue).</li>
 * <li>Con prefijo "+" o "00" el número es internacional: "+" seguido de los
 * dígitos.</li>
 * <li>Sin prefijo y con código de país configurado se quitan los ceros
 * troncales y se antepone "+código".</li>
 * <li>Sin código de país configurado se devuelven solo los dígitos.</li>
 * </ul>
 */
@Component
public class PhoneNormalizer {

    /** Valor canónico de un teléfono ausente o inutilizable */
    public static final String EMPTY = "";

    private static final int MIN_DIGITS = 4;

    private static final Pattern EXTENSION = Pattern.compile("(?i)\\s*(ext\\.?|x|#).*$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final String defaultCountryCode;

    public PhoneNormalizer(@Value("${identity.phone.default-country-code:}") String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode == null
                ? EMPTY
                : NON_DIGITS.matcher(defaultCountryCode).replaceAll("");
    }

    /**
     * Normaliza un teléfono.
     *
     * @param raw Teléfono tal como lo escribió el usuario o lo extrajo el OCR
     * @return Forma canónica, o {@link #EMPTY} si no hay número utilizable
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }

        String trimmed = EXTENSION.matcher(raw.trim()).replaceFirst("");
        boolean international = trimmed.startsWith("+");
        String digits = NON_DIGITS.matcher(trimmed).replaceAll("");

        if (!international && digits.startsWith("00")) {
            international = true;
            digits = digits.substring(2);
        }

        if (digits.length() < MIN_DIGITS) {
            return EMPTY;
        }

        if (international) {
            return "+" + digits;
        }

        if (defaultCountryCode.isEmpty()) {
            return digits;
        }

        String national = stripTrunkPrefix(digits);
        return national.length() < MIN_DIGITS ? EMPTY : "+" + defaultCountryCode + national;
    }

    private String stripTrunkPrefix(String digits) {
        int start = 0;
        while (start < digits.length() && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}
