package com.serviceintake.domain.port;

import com.serviceintake.domain.model.InboxFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Puerto (interfaz) para la lectura de archivos del buzón de ingesta de
 * documentos.
 */
public interface IntakeInboxReader {

    /**
     * Lee un archivo del buzón y convierte sus filas en solicitudes.
     *
     * @param filePath Ruta del archivo
     * @return Contenido leído
     */
    InboxFile readFromFile(Path filePath);

    /**
     * Obtiene los archivos pendientes de procesar.
     */
    List<Path> getPendingFiles();

    /**
     * Mueve un archivo procesado al directorio de historial.
     *
     * @param filePath Archivo procesado
     * @return Nueva ruta del archivo
     */
    Path moveToHistory(Path filePath);

    /**
     * Aparta un archivo que no pudo leerse para que no bloquee las siguientes
     * ejecuciones.
     *
     * @param filePath Archivo ilegible
     * @return Nueva ruta del archivo
     */
    Path moveToRejected(Path filePath);
}
