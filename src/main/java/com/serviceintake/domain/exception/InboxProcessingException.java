package com.serviceintake.domain.exception;

/**
 * Excepción lanzada cuando ocurre un error con los archivos del buzón de
 * ingesta.
 */
public class InboxProcessingException extends RuntimeException {

    public InboxProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando no se puede leer el archivo.
     */
    public static InboxProcessingException cannotRead(String filePath, Throwable cause) {
        return new InboxProcessingException("No se puede leer el archivo: " + filePath, cause);
    }

    /**
     * Excepción cuando no se puede mover el archivo fuera del buzón.
     */
    public static InboxProcessingException cannotArchive(String filePath, Throwable cause) {
        return new InboxProcessingException("Error moviendo archivo del buzón: " + filePath, cause);
    }
}
