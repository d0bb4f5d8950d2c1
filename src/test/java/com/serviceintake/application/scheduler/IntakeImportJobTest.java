package com.serviceintake.application.scheduler;

import com.serviceintake.application.service.TransactionCoordinator;
import com.serviceintake.domain.exception.FlowFailureException;
import com.serviceintake.domain.exception.FlowStep;
import com.serviceintake.domain.exception.InboxProcessingException;
import com.serviceintake.domain.model.CandidateIdentity;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.FlowResult;
import com.serviceintake.domain.model.InboxFile;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderDetails;
import com.serviceintake.domain.model.OrderType;
import com.serviceintake.domain.port.IntakeInboxReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntakeImportJobTest {

    @Mock
    private IntakeInboxReader inboxReader;

    @Mock
    private TransactionCoordinator transactionCoordinator;

    @Mock
    private TaskScheduler taskScheduler;

    private IntakeImportJob job;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneId.of("UTC"));
        job = new IntakeImportJob(inboxReader, transactionCoordinator, taskScheduler, clock);
    }

    private static FlowRequest request(String reference) {
        return FlowRequest.builder()
                .channel(IntakeChannel.DOCUMENT_INGESTION)
                .customer(CandidateIdentity.builder().branch(1).fullName("Jane Doe").sourceReference(reference).build())
                .order(OrderDetails.builder().type(OrderType.SERVICE).build())
                .build();
    }

    @Test
    void processInbox_CountsImportedAndFailedRows() {
        Path file = Path.of("inbox", "batch.csv");
        FlowRequest ok = request("DOC-1");
        FlowRequest broken = request("DOC-2");

        when(inboxReader.getPendingFiles()).thenReturn(List.of(file));
        when(inboxReader.readFromFile(file)).thenReturn(new InboxFile(file, List.of(ok, broken), 1));
        when(transactionCoordinator.createCompleteFlow(ok)).thenReturn(new FlowResult(null, null, null, false));
        when(transactionCoordinator.createCompleteFlow(broken))
                .thenThrow(FlowFailureException.at(FlowStep.ORDER, new IllegalStateException("boom")));

        job.processInbox();

        assertThat(job.getLastRunImported()).isEqualTo(1);
        assertThat(job.getLastRunFailed()).isEqualTo(2);
        assertThat(job.isLastRunSuccess()).isTrue();
        assertThat(job.getLastRunTime()).isEqualTo("2026-03-02T08:00:00");
        verify(inboxReader).moveToHistory(file);
    }

    @Test
    void processInbox_UnreadableFileIsSetAsideAndNextFileIsImported() {
        Path broken = Path.of("inbox", "a.csv");
        Path good = Path.of("inbox", "b.csv");
        FlowRequest ok = request("DOC-1");

        when(inboxReader.getPendingFiles()).thenReturn(List.of(broken, good));
        when(inboxReader.readFromFile(broken))
                .thenThrow(InboxProcessingException.cannotRead(broken.toString(), new IOException("comilla sin cerrar")));
        when(inboxReader.readFromFile(good)).thenReturn(new InboxFile(good, List.of(ok), 0));
        when(transactionCoordinator.createCompleteFlow(ok)).thenReturn(new FlowResult(null, null, null, false));

        job.processInbox();

        assertThat(job.getLastRunImported()).isEqualTo(1);
        assertThat(job.isLastRunSuccess()).isFalse();
        assertThat(job.getLastRunError()).isEqualTo("1 archivos con errores");
        verify(inboxReader).moveToRejected(broken);
        verify(inboxReader).moveToHistory(good);
        verify(inboxReader, never()).moveToHistory(broken);
    }

    @Test
    void processInbox_FailureToSetAsideDoesNotStopTheRun() {
        Path broken = Path.of("inbox", "a.csv");
        Path good = Path.of("inbox", "b.csv");

        when(inboxReader.getPendingFiles()).thenReturn(List.of(broken, good));
        when(inboxReader.readFromFile(broken))
                .thenThrow(InboxProcessingException.cannotRead(broken.toString(), new IOException("disco")));
        when(inboxReader.moveToRejected(broken))
                .thenThrow(InboxProcessingException.cannotArchive(broken.toString(), new IOException("permiso")));
        when(inboxReader.readFromFile(good)).thenReturn(new InboxFile(good, List.of(), 0));

        job.processInbox();

        verify(inboxReader).moveToHistory(good);
        verifyNoInteractions(transactionCoordinator);
    }

    @Test
    void init_DisabledCronSchedulesNothing() {
        ReflectionTestUtils.setField(job, "cronExpression", IntakeImportJob.DISABLED);

        job.init();

        assertThat(job.isScheduled()).isFalse();
        verifyNoInteractions(taskScheduler);
    }
}
