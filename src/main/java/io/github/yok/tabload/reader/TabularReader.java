package io.github.yok.tabload.reader;

import io.github.yok.tabload.config.SourceConfig;
import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.exception.SourceReadFailedException;
import io.github.yok.tabload.schema.ColumnDef;
import io.github.yok.tabload.schema.TableSchema;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Parses a delimited text file into a typed {@link RowSet}.
 *
 * <p>
 * <strong>Header handling:</strong>
 * </p>
 * <ul>
 * <li>With a header, every declared column must appear in it exactly once (case-insensitive, any
 * order). Unknown header names are a mismatch.</li>
 * <li>Without a header, fields are taken in declared column order.</li>
 * </ul>
 *
 * <p>
 * Blank cells become {@code null}. The whole file is materialized in memory; there is no streaming
 * between reading and loading.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TabularReader {

    private final Path filePath;

    private final char delimiter;

    private final boolean header;

    private final Charset charset;

    private final TableSchema schema;

    /**
     * Creates a reader from a validated source configuration.
     *
     * @param config validated source configuration
     * @param schema declared target schema
     */
    public TabularReader(SourceConfig config, TableSchema schema) {
        this.filePath = Paths.get(config.getFilePath());
        this.delimiter = config.getDelimiter().charAt(0);
        this.header = config.isHeader();
        this.charset = Charset.forName(config.getEncoding().trim());
        this.schema = schema;
    }

    /**
     * Reads the whole file.
     *
     * @return rows in file order
     * @throws SourceReadFailedException if the file is missing or unreadable, the header does not
     *         match the schema, a record has the wrong number of fields, or a cell does not fit its
     *         column type
     */
    public RowSet read() {
        if (!Files.isRegularFile(filePath)) {
            throw new SourceReadFailedException(filePath.toString(), "file does not exist");
        }

        CSVFormat.Builder fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setIgnoreEmptyLines(true).setIgnoreSurroundingSpaces(true);
        if (header) {
            fmt.setHeader().setSkipHeaderRecord(true);
        }

        try (Reader in = Files.newBufferedReader(filePath, charset);
                CSVParser parser = CSVParser.parse(in, fmt.get())) {
            int[] positions = header ? resolveHeader(parser.getHeaderNames()) : declaredOrder();

            List<Row> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(toRow(record, positions));
            }
            log.info("Read {} rows from {} (delimiter='{}', header={})", rows.size(), filePath,
                    delimiter, header);
            return RowSet.of(schema, rows);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            throw new SourceReadFailedException(filePath.toString(), e.getMessage(), e);
        }
    }

    /**
     * Maps each declared column to its position in the header.
     *
     * @param headerNames header names in file order
     * @return field position per declared column
     */
    private int[] resolveHeader(List<String> headerNames) {
        if (headerNames.size() == 1 && schema.size() > 1) {
            throw new SourceReadFailedException(filePath.toString(), "header has a single column '"
                    + headerNames.get(0) + "' (delimiter '" + delimiter + "' may be wrong)");
        }
        int[] positions = new int[schema.size()];
        Arrays.fill(positions, -1);
        for (int i = 0; i < headerNames.size(); i++) {
            String name = headerNames.get(i);
            Optional<ColumnDef> def = schema.find(name);
            if (def.isEmpty()) {
                throw new SourceReadFailedException(filePath.toString(),
                        "header column '" + name + "' is not declared; expected "
                                + schema.getColumnNames());
            }
            int idx = schema.getColumns().indexOf(def.get());
            if (positions[idx] >= 0) {
                throw new SourceReadFailedException(filePath.toString(),
                        "header column '" + name + "' appears more than once");
            }
            positions[idx] = i;
        }
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] < 0) {
                throw new SourceReadFailedException(filePath.toString(),
                        "header is missing column '" + schema.getColumnNames().get(i)
                                + "' (delimiter '" + delimiter + "' may be wrong)");
            }
        }
        return positions;
    }

    private int[] declaredOrder() {
        int[] positions = new int[schema.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        return positions;
    }

    private Row toRow(CSVRecord record, int[] positions) {
        if (record.size() != schema.size()) {
            throw new SourceReadFailedException(filePath.toString(),
                    "line " + record.getRecordNumber() + " has " + record.size()
                            + " fields; expected " + schema.size());
        }
        List<ColumnDef> columns = schema.getColumns();
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            ColumnDef column = columns.get(i);
            String cell = record.get(positions[i]);
            try {
                values[i] = column.getType().parse(cell);
            } catch (NumberFormatException e) {
                throw new SourceReadFailedException(filePath.toString(),
                        "line " + record.getRecordNumber() + ", column '" + column.getName()
                                + "': '" + cell + "' is not a valid "
                                + column.getType().name().toLowerCase(Locale.ROOT),
                        e);
            }
        }
        return Row.of(schema, values);
    }
}
