package com.address.resolution.bulk;

import com.address.resolution.core.model.OutputField;
import com.address.resolution.core.model.OutputRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputRecordCsvWriterTest {

    private final OutputRecordCsvWriter writer = new OutputRecordCsvWriter();

    @Test
    @DisplayName("Should write the header and one row per record")
    void testWrite() throws IOException {
        OutputRecord record = new OutputRecord("香港中環皇后大道中99號", 72, Map.of(
                OutputField.CHI_REGION, "香港",
                OutputField.ENG_DISTRICT, "CENTRAL & WESTERN DISTRICT",
                OutputField.ENG_STREET_NAME, "QUEEN'S ROAD CENTRAL"), 26.0);
        StringWriter out = new StringWriter();

        long written = writer.write(out, List.of(record));

        assertEquals(1, written);
        String[] lines = out.toString().split("\\R");
        assertEquals(2, lines.length);
        assertEquals(String.join(",", OutputRecord.columns()), lines[0]);
        assertTrue(lines[1].startsWith("香港中環皇后大道中99號,72,香港,"));
        assertTrue(lines[1].endsWith(",26.0"));
    }

    @Test
    @DisplayName("Written rows read back through the CSV parser")
    void testQuotedCellsParse() throws IOException {
        OutputRecord record = new OutputRecord("九龍彌敦道594號, 地下", 60, Map.of(
                OutputField.ENG_BUILDING_NAME, "THE \"ONE\""), 12.5);
        StringWriter out = new StringWriter();
        writer.write(out, List.of(record));

        String row = out.toString().split("\\R")[1];
        List<String> cells = AddressCsvReader.parseLine(row);

        assertEquals(record.values(), cells);
        assertEquals(List.of("九龍彌敦道594號, 地下"), new AddressCsvReader("input_address")
                .read(new StringReader(out.toString())));
    }

    @Test
    @DisplayName("Empty batch writes only the header")
    void testEmpty() throws IOException {
        StringWriter out = new StringWriter();
        assertEquals(0, writer.write(out, List.of()));
        assertEquals(1, out.toString().split("\\R").length);
    }

    @Test
    @DisplayName("csvEscape quotes only when needed")
    void testEscape() {
        assertEquals("plain", OutputRecordCsvWriter.csvEscape("plain"));
        assertEquals("\"a,b\"", OutputRecordCsvWriter.csvEscape("a,b"));
        assertEquals("\"a\"\"b\"", OutputRecordCsvWriter.csvEscape("a\"b"));
        assertEquals("", OutputRecordCsvWriter.csvEscape(null));
    }
}
