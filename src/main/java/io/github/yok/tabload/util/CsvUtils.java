package io.github.yok.tabload.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.Generated;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Helpers for rendering tabular results as CSV text.
 *
 * <p>
 * Used by the CLI to print retrieval and report results. Output uses minimal quoting and the
 * platform line separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    @Generated
    private CsvUtils() {}

    /**
     * Writes a header and rows to the given output.
     *
     * @param out destination (not closed)
     * @param headers header columns
     * @param rows records; {@code null} cells are written as empty fields
     * @throws UncheckedIOException if writing fails
     */
    public static void print(Appendable out, List<String> headers, List<List<Object>> rows) {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator(System.lineSeparator())
                .get();
        try {
            CSVPrinter printer = new CSVPrinter(out, fmt);
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to print CSV output", e);
        }
    }
}
