package io.github.yok.tabload.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.tabload.config.LoadMode;
import io.github.yok.tabload.config.TargetDescriptor;
import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.db.DbDialectHandler;
import io.github.yok.tabload.db.DbUnitConfigFactory;
import io.github.yok.tabload.exception.SinkWriteFailedException;
import io.github.yok.tabload.exception.UnsupportedModeException;
import io.github.yok.tabload.schema.ColumnDef;
import io.github.yok.tabload.schema.TableSchema;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * Writes a {@link RowSet} to the target table through DBUnit and provisions indexes afterwards.
 *
 * <p>
 * <strong>Load steps:</strong>
 * </p>
 * <ol>
 * <li>Prepare the table: {@link LoadMode#REPLACE} drops and recreates it from the declared schema,
 * {@link LoadMode#APPEND} creates it only if absent.</li>
 * <li>Insert rows in input order, in consecutive batches of {@code batchSize} rows, each one a
 * DBUnit {@link DatabaseOperation#INSERT} committed on its own.</li>
 * <li>On the embedded backend, create the {@code department}, {@code level} and {@code salary}
 * indexes with {@code CREATE INDEX IF NOT EXISTS}.</li>
 * </ol>
 *
 * <p>
 * The load is not atomic: when a batch fails, batches committed before it stay in the table and no
 * compensating delete is attempted. Index creation is a separate step, so a crash after the inserts
 * leaves the data without indexes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RelationalSink {

    /**
     * Columns indexed after a load on index-managed backends.
     */
    public static final List<String> INDEXED_COLUMNS =
            ImmutableList.of("department", "level", "salary");

    /**
     * Abstraction for the DBUnit write operation used by this sink.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet rows to insert
         * @throws DatabaseUnitException DBUnit failure
         * @throws SQLException JDBC failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet)
                throws DatabaseUnitException, SQLException;
    }

    private final TargetDescriptor target;

    private final TableSchema schema;

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    private final DbUnitConfigFactory dbUnitConfigFactory;

    // DBUnit operation executor (replaceable in tests)
    private final OperationExecutor operationExecutor;

    /**
     * Creates a sink.
     *
     * @param target target descriptor
     * @param schema declared table schema
     * @param dataSource connection source
     * @param dialect backend dialect
     * @param dbUnitConfigFactory DBUnit settings
     */
    public RelationalSink(TargetDescriptor target, TableSchema schema, DataSource dataSource,
            DbDialectHandler dialect, DbUnitConfigFactory dbUnitConfigFactory) {
        this(target, schema, dataSource, dialect, dbUnitConfigFactory,
                DatabaseOperation.INSERT::execute);
    }

    RelationalSink(TargetDescriptor target, TableSchema schema, DataSource dataSource,
            DbDialectHandler dialect, DbUnitConfigFactory dbUnitConfigFactory,
            OperationExecutor operationExecutor) {
        this.target = target;
        this.schema = schema;
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.dbUnitConfigFactory = dbUnitConfigFactory;
        this.operationExecutor = operationExecutor;
    }

    /**
     * Loads rows into the target table according to the descriptor's mode.
     *
     * @param rows rows to write; must use the sink's schema
     * @return summary of the load
     * @throws UnsupportedModeException if the descriptor carries no load mode
     * @throws SinkWriteFailedException if the schema does not match or the backend rejects a
     *         statement
     */
    public LoadResult load(RowSet rows) {
        String table = target.getTable();
        LoadMode mode = target.getMode();
        if (mode == null) {
            throw new UnsupportedModeException(null);
        }
        if (!schema.equals(rows.getSchema())) {
            throw new SinkWriteFailedException(table, "row set columns "
                    + rows.getSchema().getColumnNames() + " do not match " + schema.getColumnNames());
        }
        log.info("=== Load started (table={}, mode={}, rows={}, batchSize={}) ===", table, mode,
                rows.size(), target.getBatchSize());

        int batches;
        List<String> indexes;
        try (Connection jdbc = dataSource.getConnection()) {
            jdbc.setAutoCommit(false);
            prepareTable(jdbc, mode);
            batches = insertInBatches(jdbc, rows);
            indexes = provisionIndexes(jdbc);
        } catch (SQLException e) {
            throw new SinkWriteFailedException(table, "backend error", e);
        } catch (DatabaseUnitException e) {
            throw new SinkWriteFailedException(table, "DBUnit error", e);
        }

        LoadResult result = new LoadResult(table, mode, rows.size(), batches, indexes);
        log.info("=== Load finished: {} ===", result);
        return result;
    }

    /**
     * Counts the rows currently in the target table.
     *
     * @return row count
     * @throws SinkWriteFailedException if the table cannot be queried
     */
    public long countRows() {
        try (Connection jdbc = dataSource.getConnection();
                Statement st = jdbc.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + target.getTable())) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new SinkWriteFailedException(target.getTable(), "row count failed", e);
        }
    }

    private void prepareTable(Connection jdbc, LoadMode mode) throws SQLException {
        String table = target.getTable();
        try (Statement st = jdbc.createStatement()) {
            if (mode == LoadMode.REPLACE) {
                st.execute(dialect.dropTableSql(table));
                log.info("Table[{}] dropped (replace)", table);
            }
            st.execute(dialect.createTableSql(schema, table));
        }
        jdbc.commit();
        log.debug("Table[{}] ready", table);
    }

    /**
     * Inserts the rows batch by batch, committing after each one.
     *
     * @param jdbc open JDBC connection (auto-commit off)
     * @param rows rows to insert
     * @return number of batches
     */
    private int insertInBatches(Connection jdbc, RowSet rows)
            throws SQLException, DatabaseUnitException {
        if (rows.isEmpty()) {
            return 0;
        }
        // Created after the DDL so DBUnit's metadata cache sees the table
        IDatabaseConnection dbConn = createDbUnitConn(jdbc);
        Column[] columns = toDbUnitColumns();

        List<List<Row>> chunks = rows.partition(target.getBatchSize());
        int written = 0;
        for (int i = 0; i < chunks.size(); i++) {
            List<Row> chunk = chunks.get(i);
            DefaultTable table =
                    new DefaultTable(new DefaultTableMetaData(target.getTable(), columns));
            for (Row row : chunk) {
                table.addRow(row.toArray());
            }
            try {
                operationExecutor.insert(dbConn, new DefaultDataSet(table));
                jdbc.commit();
            } catch (SQLException | DatabaseUnitException e) {
                abortBatch(jdbc, e, i + 1, chunks.size(), written);
                throw e;
            } catch (RuntimeException e) {
                abortBatch(jdbc, e, i + 1, chunks.size(), written);
                throw new SinkWriteFailedException(target.getTable(),
                        "batch " + (i + 1) + "/" + chunks.size() + " failed", e);
            }
            written += chunk.size();
            log.info("Table[{}] batch {}/{} inserted ({} rows, {} total)", target.getTable(),
                    i + 1, chunks.size(), chunk.size(), written);
        }
        return chunks.size();
    }

    private void abortBatch(Connection jdbc, Exception cause, int batch, int total, int written) {
        rollbackQuietly(jdbc, cause);
        log.error("Table[{}] batch {}/{} failed; {} rows from earlier batches remain",
                target.getTable(), batch, total, written);
    }

    private IDatabaseConnection createDbUnitConn(Connection jdbc) throws DatabaseUnitException {
        DatabaseConnection dbConn = new DatabaseConnection(jdbc, dialect.resolveSchema(target));
        dbUnitConfigFactory.configure(dbConn.getConfig(), dialect, target.getBatchSize());
        return dbConn;
    }

    private Column[] toDbUnitColumns() {
        List<ColumnDef> defs = schema.getColumns();
        Column[] columns = new Column[defs.size()];
        for (int i = 0; i < defs.size(); i++) {
            ColumnDef def = defs.get(i);
            columns[i] = new Column(def.getName(), toDataType(def));
        }
        return columns;
    }

    private static DataType toDataType(ColumnDef def) {
        switch (def.getType()) {
            case INTEGER:
                return DataType.INTEGER;
            case DECIMAL:
                return DataType.DECIMAL;
            default:
                return DataType.VARCHAR;
        }
    }

    /**
     * Creates the indexes when the backend is index-managed and provisioning is enabled.
     *
     * @param jdbc open JDBC connection
     * @return executed index statements
     */
    private List<String> provisionIndexes(Connection jdbc) throws SQLException {
        if (!target.isCreateIndexes() || !dialect.supportsIndexManagement()) {
            log.info("Table[{}] index provisioning skipped (backend={})", target.getTable(),
                    target.getBackendType().getScheme());
            return ImmutableList.of();
        }
        List<String> executed = new ArrayList<>();
        try (Statement st = jdbc.createStatement()) {
            for (String column : INDEXED_COLUMNS) {
                if (schema.find(column).isEmpty()) {
                    continue;
                }
                String ddl = dialect.createIndexSql(target.getTable(), column);
                st.execute(ddl);
                executed.add(ddl);
                log.info("Table[{}] index ensured: {}", target.getTable(),
                        dialect.indexName(target.getTable(), column));
            }
        }
        jdbc.commit();
        return executed;
    }

    private static void rollbackQuietly(Connection jdbc, Exception cause) {
        try {
            jdbc.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
