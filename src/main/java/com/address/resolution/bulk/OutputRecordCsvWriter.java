package com.address.resolution.bulk;

import com.address.resolution.core.model.OutputRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes resolved addresses as CSV, one row per {@link OutputRecord}.
 *
 * <pre>
 * input_address,score,CHI_Region,chi_district,...,OGCIO_ENG_Block,match_score
 * 香港中環皇后大道中99號,72,香港,中西區,...,,26.0
 * </pre>
 */
public class OutputRecordCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(OutputRecordCsvWriter.class);

    /**
     * Writes the header and every record.
     *
     * @return the number of records written
     */
    public long write(Writer writer, List<OutputRecord> records) throws IOException {
        BufferedWriter out = writer instanceof BufferedWriter b ? b : new BufferedWriter(writer);
        writeRow(out, OutputRecord.columns());
        long written = 0;
        for (OutputRecord record : records) {
            writeRow(out, record.values());
            written++;
        }
        out.flush();
        log.info("csv.written records={}", written);
        return written;
    }

    private void writeRow(BufferedWriter out, List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            out.write(csvEscape(values.get(i)));
        }
        out.newLine();
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
