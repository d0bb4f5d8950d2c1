package com.serviceintake.infrastructure.file;

import com.serviceintake.domain.exception.InboxProcessingException;
import com.serviceintake.domain.model.FlowRequest;
import com.serviceintake.domain.model.InboxFile;
import com.serviceintake.domain.model.IntakeChannel;
import com.serviceintake.domain.model.OrderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvIntakeInboxReaderTest {

    private static final String HEADER = "source_reference,branch,full_name,phone,organization_name,"
            + "tax_number,plate,make,model,year,order_type,notes";

    @TempDir
    Path tempDir;

    private Path inbox;
    private Path history;
    private Path rejected;
    private CsvIntakeInboxReader reader;

    @BeforeEach
    void setUp() throws IOException {
        inbox = Files.createDirectories(tempDir.resolve("inbox"));
        history = tempDir.resolve("history");
        rejected = tempDir.resolve("rejected");

        reader = new CsvIntakeInboxReader();
        ReflectionTestUtils.setField(reader, "inboxPath", inbox.toString());
        ReflectionTestUtils.setField(reader, "historyPath", history.toString());
        ReflectionTestUtils.setField(reader, "rejectedPath", rejected.toString());
    }

    @Test
    void readFromFile_ParsesValidRowsAndCountsRejected() throws IOException {
        Path file = write("batch-01.csv",
                HEADER,
                "DOC-1,1,Jane Doe,555-0100,,,ab-123,Toyota,Corolla,2019,SALES,primera visita",
                "DOC-2,1,John Roe,555-0101,,,,,,,,",
                "DOC-3,abc,Broken Row,555-0102,,,,,,,,");

        InboxFile result = reader.readFromFile(file);

        assertThat(result.rejectedLines()).isEqualTo(1);
        assertThat(result.requests()).hasSize(2);

        FlowRequest withVehicle = result.requests().get(0);
        assertThat(withVehicle.getChannel()).isEqualTo(IntakeChannel.DOCUMENT_INGESTION);
        assertThat(withVehicle.getCustomer().getSourceReference()).isEqualTo("DOC-1");
        assertThat(withVehicle.getCustomer().getBranch()).isEqualTo(1);
        assertThat(withVehicle.getVehicle().getPlate()).isEqualTo("ab-123");
        assertThat(withVehicle.getVehicle().getYear()).isEqualTo(2019);
        assertThat(withVehicle.getOrder().getType()).isEqualTo(OrderType.SALES);
        assertThat(withVehicle.getOrder().getNotes()).isEqualTo("primera visita");

        FlowRequest withoutVehicle = result.requests().get(1);
        assertThat(withoutVehicle.getVehicle()).isNull();
        assertThat(withoutVehicle.getOrder().getType()).isEqualTo(OrderType.SERVICE);
    }

    @Test
    void readFromFile_RejectsUnknownOrderType() throws IOException {
        Path file = write("batch-02.csv",
                HEADER,
                "DOC-9,1,Jane Doe,555-0100,,,,,,,REPAIR,");

        InboxFile result = reader.readFromFile(file);

        assertThat(result.requests()).isEmpty();
        assertThat(result.rejectedLines()).isEqualTo(1);
    }

    @Test
    void getPendingFiles_ReturnsOnlyCsvFilesSorted() throws IOException {
        write("b.csv", HEADER);
        write("a.csv", HEADER);
        write("notes.txt", "ignorar");

        List<Path> pending = reader.getPendingFiles();

        assertThat(pending).extracting(path -> path.getFileName().toString())
                .containsExactly("a.csv", "b.csv");
    }

    @Test
    void getPendingFiles_MissingInboxReturnsEmpty() {
        ReflectionTestUtils.setField(reader, "inboxPath", tempDir.resolve("missing").toString());

        assertThat(reader.getPendingFiles()).isEmpty();
    }

    @Test
    void moveToHistory_AddsSuffixWhenNameIsTaken() throws IOException {
        Path first = write("batch.csv", HEADER);
        Path movedFirst = reader.moveToHistory(first);

        Path second = write("batch.csv", HEADER);
        Path movedSecond = reader.moveToHistory(second);

        assertThat(movedFirst.getFileName().toString()).isEqualTo("batch.csv");
        assertThat(movedSecond.getFileName().toString()).isEqualTo("batch_1.csv");
        assertThat(Files.exists(history.resolve("batch_1.csv"))).isTrue();
        assertThat(Files.exists(second)).isFalse();
    }

    @Test
    void readFromFile_UnterminatedQuoteFailsTheWholeFile() throws IOException {
        Path file = write("broken.csv",
                HEADER,
                "DOC-1,1,\"Jane Doe,555-0100,,,,,,,,");

        assertThatThrownBy(() -> reader.readFromFile(file))
                .isInstanceOf(InboxProcessingException.class)
                .hasMessageContaining("broken.csv");
    }

    @Test
    void moveToRejected_SetsFileAsideOutsideInbox() throws IOException {
        Path file = write("broken.csv", HEADER);

        Path moved = reader.moveToRejected(file);

        assertThat(moved).isEqualTo(rejected.resolve("broken.csv"));
        assertThat(Files.exists(moved)).isTrue();
        assertThat(reader.getPendingFiles()).isEmpty();
    }

    private Path write(String name, String... lines) throws IOException {
        return Files.write(inbox.resolve(name), List.of(lines), StandardCharsets.UTF_8);
    }
}
