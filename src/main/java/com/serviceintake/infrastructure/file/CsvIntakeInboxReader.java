package com.serviceintake.infrastructure.file;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.serviceintake.domain.exception.InboxProcessingException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.InboxFile;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.OrderType;
import com.serviceintake.domain.model.VehicleDetails;
import com.serviceintake.domain.port.IntakeInboxReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Implementación del puerto IntakeInboxReader para archivos CSV dejados por
 * la ingesta de documentos.
 *
 * Formato: source_reference,branch,full_name,phone,organization_name,
 * tax_number,plate,make,model,year,order_type,notes (con cabecera).
 */
@Component
@Slf4j
public class CsvIntakeInboxReader implements IntakeInboxReader {

    private static final int MIN_COLUMNS = 6;

    @Value("${intake.inbox-path:./intake_inbox}")
    private String inboxPath;

    @Value("${intake.history-path:./intake_history}")
    private String historyPath;

    @Value("${intake.rejected-path:./intake_rejected}")
    private String rejectedPath;

    @Override
    public InboxFile readFromFile(Path filePath) {
        log.info("Leyendo archivo del buzón: {}", filePath);
        List<FlowRequest> requests = new ArrayList<>();
        int rejected = 0;

        try (CSVReader reader = new CSVReader(Files.newBufferedReader(filePath, StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();

            // Saltar header
            for (int i = 1; i < lines.size(); i++) {
                try {
                    requests.add(parseLine(lines.get(i)));
                } catch (IllegalArgumentException e) {
                    rejected++;
                    log.warn("Línea {} del archivo {} descartada: {}", i + 1, filePath, e.getMessage());
                }
            }

        } catch (IOException | CsvException e) {
            throw InboxProcessingException.cannotRead(filePath.toString(), e);
        }

        log.info("Leídas {} solicitudes del archivo {} ({} descartadas)", requests.size(), filePath, rejected);
        return new InboxFile(filePath, requests, rejected);
    }

    @Override
    public List<Path> getPendingFiles() {
        Path inboxDir = Paths.get(inboxPath);

        if (!Files.exists(inboxDir)) {
            log.debug("Directorio del buzón no existe: {}", inboxDir);
            return new ArrayList<>();
        }

        try (Stream<Path> files = Files.list(inboxDir)) {
            List<Path> csvFiles = files
                    .filter(path -> path.toString().endsWith(".csv"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());

            log.info("Encontrados {} archivos pendientes en el buzón", csvFiles.size());
            return csvFiles;

        } catch (IOException e) {
            throw InboxProcessingException.cannotRead(inboxDir.toString(), e);
        }
    }

    @Override
    public Path moveToHistory(Path filePath) {
        Path target = moveTo(Paths.get(historyPath), filePath);
        log.info("Archivo movido a historial: {} -> {}", filePath, target);
        return target;
    }

    @Override
    public Path moveToRejected(Path filePath) {
        Path target = moveTo(Paths.get(rejectedPath), filePath);
        log.warn("Archivo apartado como rechazado: {} -> {}", filePath, target);
        return target;
    }

    /**
     * Mueve el archivo al directorio indicado sin pisar archivos previos con
     * el mismo nombre.
     */
    private Path moveTo(Path targetDir, Path filePath) {
        try {
            if (!Files.exists(targetDir)) {
                Files.createDirectories(targetDir);
                log.info("Directorio creado: {}", targetDir);
            }

            Path targetPath = targetDir.resolve(filePath.getFileName());

            // Si ya existe, agregar sufijo
            if (Files.exists(targetPath)) {
                String fileName = filePath.getFileName().toString();
                int dot = fileName.lastIndexOf('.');
                String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
                String extension = dot > 0 ? fileName.substring(dot) : "";
                int counter = 1;

                do {
                    targetPath = targetDir.resolve(
                            String.format("%s_%d%s", baseName, counter++, extension));
                } while (Files.exists(targetPath));
            }

            return Files.move(filePath, targetPath);

        } catch (IOException e) {
            throw InboxProcessingException.cannotArchive(filePath.toString(), e);
        }
    }

    /**
     * Parsea una línea CSV a una solicitud de flujo.
     *
     * @throws IllegalArgumentException si la línea no tiene el formato esperado
     */
    private FlowRequest parseLine(String[] fields) {
        if (fields.length < MIN_COLUMNS) {
            throw new IllegalArgumentException("formato incompleto: " + fields.length + " campos");
        }

        String sourceReference = field(fields, 0);
        CandidateIdentity customer = CandidateIdentity.builder()
                .sourceReference(sourceReference.isEmpty() ? null : sourceReference)
                .branch(parseInteger(field(fields, 1), "branch"))
                .fullName(field(fields, 2))
                .phone(field(fields, 3))
                .organizationName(field(fields, 4))
                .taxNumber(field(fields, 5))
                .build();

        String plate = field(fields, 6);
        VehicleDetails vehicle = plate.isEmpty() ? null : VehicleDetails.builder()
                .plate(plate)
                .make(field(fields, 7))
                .model(field(fields, 8))
                .year(field(fields, 9).isEmpty() ? null : parseInteger(field(fields, 9), "year"))
                .build();

        return FlowRequest.builder()
                .channel(IntakeChannel.DOCUMENT_INGESTION)
                .customer(customer)
                .vehicle(vehicle)
                .order(OrderDetails.builder()
                        .type(parseOrderType(field(fields, 10)))
                        .notes(field(fields, 11))
                        .build())
                .build();
    }

    private String field(String[] fields, int index) {
        return index < fields.length && fields[index] != null ? fields[index].trim() : "";
    }

    /**
     * Un tipo vacío se interpreta como orden de servicio.
     */
    private OrderType parseOrderType(String value) {
        if (value.isEmpty()) {
            return OrderType.SERVICE;
        }
        try {
            return OrderType.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("tipo de orden desconocido: " + value);
        }
    }

    private Integer parseInteger(String value, String column) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("valor no numérico en " + column + ": '" + value + "'");
        }
    }
}
