package com.serviceintake.domain.model;

/**
 * Tupla de identidad ya normalizada. Los atributos de texto nunca son null:
 * un valor ausente se representa con la cadena vacía para que la restricción
 * única del almacén los trate como iguales.
 */
public record IdentityKey(
        Integer branch,
        String fullName,
        String phone,
        String organizationName,
        String taxNumber) {

    /**
     * Verifica si la tupla no aporta ningún atributo identificador.
     */
    public boolean isBlank() {
        return fullName.isEmpty()
                && phone.isEmpty()
                && organizationName.isEmpty()
                && taxNumber.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("[branch=%s, name='%s', phone='%s', org='%s', tax='%s']",
                branch, fullName, phone, organizationName, taxNumber);
    }
}
