package com.serviceintake.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Contenido leído de un archivo del buzón de ingesta.
 *
 * @param path          Archivo de origen
 * @param requests      Filas válidas convertidas en solicitudes
 * @param rejectedLines Filas descartadas por formato inválido
 */
public record InboxFile(Path path, List<FlowRequest> requests, int rejectedLines) {
}
