package com.serviceintake.application.scheduler;

import com.serviceintake.application.service.TransactionCoordinator;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.InboxFile;
import com.serviceintake.domain.port.IntakeInboxReader;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Job programado que importa los archivos del buzón de ingesta de documentos.
 * Cada fila pasa por el coordinador de flujos como una unidad independiente:
 * una fila que falla no afecta a las demás.
 */
@Component
@Slf4j
public class IntakeImportJob {

    /** Valor de cron que desactiva la programación */
    public static final String DISABLED = "-";

    private final IntakeInboxReader inboxReader;
    private final TransactionCoordinator transactionCoordinator;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @Value("${intake.import.cron:0 */5 * * * *}")
    @Getter
    private String cronExpression;

    private ScheduledFuture<?> scheduledTask;

    // --- Tracking de la última ejecución ---
    @Getter
    private LocalDateTime lastRunTime;
    @Getter
    private int lastRunImported;
    @Getter
    private int lastRunFailed;
    @Getter
    private boolean lastRunSuccess;
    @Getter
    private String lastRunError;

    public IntakeImportJob(IntakeInboxReader inboxReader,
            TransactionCoordinator transactionCoordinator,
            TaskScheduler taskScheduler,
            Clock clock) {
        this.inboxReader = inboxReader;
        this.transactionCoordinator = transactionCoordinator;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * Programa la importación al arrancar la aplicación.
     */
    @PostConstruct
    public void init() {
        if (DISABLED.equals(cronExpression)) {
            log.info("Importación del buzón desactivada");
            return;
        }
        scheduledTask = taskScheduler.schedule(this::processInbox, new CronTrigger(cronExpression));
        log.info("Importación del buzón programada con cron: {}", cronExpression);
    }

    /**
     * Procesa todos los archivos pendientes del buzón. Un archivo ilegible se
     * aparta como rechazado y la importación continúa con el siguiente.
     */
    public synchronized void processInbox() {
        lastRunTime = LocalDateTime.now(clock);
        int imported = 0;
        int failed = 0;
        int failedFiles = 0;

        try {
            List<Path> pendingFiles = inboxReader.getPendingFiles();
            if (pendingFiles.isEmpty()) {
                log.debug("No hay archivos pendientes en el buzón");
            }

            for (Path file : pendingFiles) {
                InboxFile inboxFile;
                try {
                    inboxFile = inboxReader.readFromFile(file);
                } catch (RuntimeException e) {
                    failedFiles++;
                    log.error("Error leyendo archivo {}: {}", file.getFileName(), e.getMessage(), e);
                    reject(file);
                    continue;
                }
                failed += inboxFile.rejectedLines();

                for (FlowRequest request : inboxFile.requests()) {
                    try {
                        transactionCoordinator.createCompleteFlow(request);
                        imported++;
                    } catch (RuntimeException e) {
                        failed++;
                        log.error("No se pudo importar la referencia {} de {}: {}",
                                request.getCustomer().getSourceReference(), file.getFileName(), e.getMessage());
                    }
                }

                inboxReader.moveToHistory(file);
            }

            lastRunSuccess = failedFiles == 0;
            lastRunError = failedFiles > 0 ? failedFiles + " archivos con errores" : null;
            log.info("Importación del buzón completada: {} importadas, {} fallidas, {} archivos con errores",
                    imported, failed, failedFiles);

        } catch (RuntimeException e) {
            lastRunSuccess = false;
            lastRunError = e.getMessage();
            log.error("Error en la importación del buzón: {}", e.getMessage(), e);
        } finally {
            lastRunImported = imported;
            lastRunFailed = failed;
        }
    }

    private void reject(Path file) {
        try {
            inboxReader.moveToRejected(file);
        } catch (RuntimeException e) {
            log.error("No se pudo apartar el archivo {}: {}", file.getFileName(), e.getMessage());
        }
    }

    /**
     * Indica si hay una importación programada activa.
     */
    public boolean isScheduled() {
        return scheduledTask != null && !scheduledTask.isCancelled();
    }
}
