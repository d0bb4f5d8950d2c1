package com.serviceintake.domain.exception;

/**
 * Excepción lanzada cuando los datos de una solicitud no son válidos: una
 * identidad sin datos suficientes, un atributo que excede su longitud o una
 * orden sin tipo. Se lanza antes de cualquier acceso al almacén.
 */
public class IdentityValidationException extends RuntimeException {

    public IdentityValidationException(String message) {
        super(message);
    }

    /**
     * Excepción cuando falta la sucursal o no es válida.
     */
    public static IdentityValidationException invalidBranch(Integer branch) {
        return new IdentityValidationException("Sucursal inválida: " + branch);
    }

    /**
     * Excepción cuando todos los atributos de identidad están vacíos.
     */
    public static IdentityValidationException emptyIdentity(Integer branch) {
        return new IdentityValidationException(
                "La identidad no tiene nombre, teléfono, organización ni número fiscal (sucursal " + branch + ")");
    }

    /**
     * Excepción cuando no se indica el punto de entrada.
     */
    public static IdentityValidationException missingChannel() {
        return new IdentityValidationException("Debe indicarse el punto de entrada de la solicitud");
    }

    /**
     * Excepción cuando un atributo excede la longitud que admite el almacén.
     */
    public static IdentityValidationException tooLong(String field, int maxLength) {
        return new IdentityValidationException(
                String.format("El campo %s excede la longitud máxima de %d caracteres", field, maxLength));
    }

    /**
     * Excepción cuando la orden no indica su tipo.
     */
    public static IdentityValidationException missingOrderType() {
        return new IdentityValidationException("La orden debe indicar su tipo");
    }
}
