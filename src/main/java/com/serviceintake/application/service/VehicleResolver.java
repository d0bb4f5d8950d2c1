package com.serviceintake.application.service;

import com.serviceintake.domain.exception.IdentityValidationException;
import com.serviceintake.domain.model.Customer;
import com.serviceintake.domain.model.Vehicle;
import com.serviceintake.domain.model.VehicleDetails;
import com.serviceintake.domain.port.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Busca o crea el vehículo de un cliente por matrícula.
 *
 * <p>
 * Los datos descriptivos se completan solo si están vacíos en el registro:
 * un valor ya guardado nunca se sobrescribe (gana la primera escritura).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VehicleResolver {

    private static final Pattern PLATE_SEPARATORS = Pattern.compile("[\\s\\-.]");

    /** Longitud máxima de la matrícula canónica en la tabla vehicles */
    public static final int MAX_PLATE_LENGTH = 20;

    /** Longitud máxima de marca y modelo en la tabla vehicles */
    public static final int MAX_DESCRIPTION_LENGTH = 60;

    private final VehicleRepository vehicleRepository;

    /**
     * Resuelve el vehículo a partir de sus atributos.
     *
     * @see #resolveOrCreate(Customer, String, VehicleDetails)
     */
    @Transactional
    public Optional<Vehicle> resolveOrCreate(Customer customer, VehicleDetails details) {
        if (details == null) {
            return Optional.empty();
        }
        return resolveOrCreate(customer, details.getPlate(), details);
    }

    /**
     * Resuelve el vehículo del cliente con la matrícula indicada.
     *
     * @param customer   Cliente propietario, ya persistido
     * @param plate      Matrícula; vacía o null para un flujo sin vehículo
     * @param attributes Marca, modelo y año suministrados (pueden ser null)
     * @return Vehículo encontrado o creado, o vacío si no hay matrícula
     * @throws IdentityValidationException si algún atributo excede su longitud
     */
    @Transactional
    public Optional<Vehicle> resolveOrCreate(Customer customer, String plate, VehicleDetails attributes) {
        String canonicalPlate = normalizePlate(plate);
        if (canonicalPlate.isEmpty()) {
            log.debug("Flujo sin matrícula para el cliente {}: no se crea vehículo", customer.getId());
            return Optional.empty();
        }

        VehicleDetails incoming = attributes != null ? attributes : new VehicleDetails();
        validate(canonicalPlate, incoming);
        Optional<Vehicle> existing = vehicleRepository.findByCustomerAndPlate(customer.getId(), canonicalPlate);

        if (existing.isPresent()) {
            return Optional.of(fillMissing(existing.get(), incoming));
        }

        Vehicle created = vehicleRepository.insert(Vehicle.builder()
                .customerId(customer.getId())
                .plate(canonicalPlate)
                .make(blankToNull(incoming.getMake()))
                .model(blankToNull(incoming.getModel()))
                .year(incoming.getYear())
                .build());
        return Optional.of(created);
    }

    /**
     * Comprueba que los atributos del vehículo caben en el almacén. Una
     * solicitud sin vehículo o sin matrícula siempre es válida.
     *
     * @throws IdentityValidationException si algún atributo excede su longitud
     */
    public void validate(VehicleDetails details) {
        if (details != null) {
            validate(normalizePlate(details.getPlate()), details);
        }
    }

    private void validate(String canonicalPlate, VehicleDetails details) {
        checkLength("plate", canonicalPlate, MAX_PLATE_LENGTH);
        checkLength("make", details.getMake(), MAX_DESCRIPTION_LENGTH);
        checkLength("model", details.getModel(), MAX_DESCRIPTION_LENGTH);
    }

    private static void checkLength(String field, String value, int maxLength) {
        if (value != null && value.trim().length() > maxLength) {
            throw IdentityValidationException.tooLong(field, maxLength);
        }
    }

    /**
     * Convierte una matrícula a su forma canónica.
     *
     * @return Matrícula en mayúsculas sin separadores, o cadena vacía
     */
    public static String normalizePlate(String plate) {
        if (plate == null) {
            return "";
        }
        return PLATE_SEPARATORS.matcher(plate.trim()).replaceAll("").toUpperCase();
    }

    private Vehicle fillMissing(Vehicle vehicle, VehicleDetails incoming) {
        boolean changed = false;

        if (isBlank(vehicle.getMake()) && !isBlank(incoming.getMake())) {
            vehicle.setMake(incoming.getMake().trim());
            changed = true;
        }
        if (isBlank(vehicle.getModel()) && !isBlank(incoming.getModel())) {
            vehicle.setModel(incoming.getModel().trim());
            changed = true;
        }
        if (vehicle.getYear() == null && incoming.getYear() != null) {
            vehicle.setYear(incoming.getYear());
            changed = true;
        }

        if (!changed) {
            return vehicle;
        }

        log.info("Completando datos del vehículo {} ({})", vehicle.getId(), vehicle.getPlate());
        return vehicleRepository.update(vehicle);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
