package io.github.yok.tabload.core;

import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.exception.UnknownColumnException;
import io.github.yok.tabload.query.CompiledQuery;
import io.github.yok.tabload.query.Criteria;
import io.github.yok.tabload.query.CriteriaQueryBuilder;
import io.github.yok.tabload.query.SortSpec;
import io.github.yok.tabload.schema.ColumnDef;
import io.github.yok.tabload.schema.TableSchema;
import java.math.BigDecimal;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Answers ad hoc lookups over the loaded table.
 *
 * <p>
 * Every lookup is compiled by {@link CriteriaQueryBuilder} and executed with bound parameters
 * through {@link NamedParameterJdbcTemplate}; the convenience methods are fixed criteria on top of
 * {@link #query(Criteria, List)}, so they return exactly what the general path returns for the
 * same criteria.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RetrievalService {

    private final TableSchema schema;

    private final CriteriaQueryBuilder queryBuilder;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Creates the service.
     *
     * @param schema declared table schema
     * @param table validated table name
     * @param dataSource connection source
     */
    public RetrievalService(TableSchema schema, String table, DataSource dataSource) {
        this.schema = schema;
        this.queryBuilder = new CriteriaQueryBuilder(schema, table);
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
    }

    /**
     * Runs a criteria query.
     *
     * @param criteria filter clauses
     * @param sort sort key, or {@code null} for backend-defined order
     * @return matching rows
     * @throws UnknownColumnException if a column is not declared (nothing is executed)
     */
    public RowSet query(Criteria criteria, SortSpec sort) {
        return execute(queryBuilder.compile(criteria, sort));
    }

    /**
     * Runs a criteria query with several sort keys.
     *
     * @param criteria filter clauses
     * @param sorts sort keys in priority order
     * @return matching rows
     * @throws UnknownColumnException if a column is not declared (nothing is executed)
     */
    public RowSet query(Criteria criteria, List<SortSpec> sorts) {
        return execute(queryBuilder.compile(criteria, sorts));
    }

    public RowSet findAll() {
        return query(Criteria.none(schema), (SortSpec) null);
    }

    public RowSet findByDepartment(String department, SortSpec sort) {
        return query(Criteria.builder(schema).equalTo("department", department).build(), sort);
    }

    public RowSet findByLevel(String level, SortSpec sort) {
        return query(Criteria.builder(schema).equalTo("level", level).build(), sort);
    }

    /**
     * Returns employees earning strictly more than {@code threshold}, highest salary first.
     *
     * @param threshold exclusive lower bound
     * @return matching rows
     */
    public RowSet findBySalaryAbove(BigDecimal threshold) {
        return query(Criteria.builder(schema).greaterThan("salary", threshold).build(),
                SortSpec.desc("salary"));
    }

    /**
     * Returns employees located in any of the given cities, ordered by city then salary
     * descending.
     *
     * @param cities accepted cities; must not be empty
     * @return matching rows
     * @throws io.github.yok.tabload.exception.EmptyCriteriaValueException if {@code cities} is
     *         empty
     */
    public RowSet findByCities(List<String> cities) {
        return query(Criteria.builder(schema).in("city", cities).build(),
                List.of(SortSpec.asc("city"), SortSpec.desc("salary")));
    }

    private RowSet execute(CompiledQuery query) {
        log.debug("Executing: {} {}", query.getSql(), query.getParameters());
        List<Row> rows = jdbcTemplate.query(query.getSql(),
                new MapSqlParameterSource(query.getParameters()), rowMapper());
        log.info("Query returned {} rows", rows.size());
        return RowSet.of(schema, rows);
    }

    private RowMapper<Row> rowMapper() {
        List<ColumnDef> columns = schema.getColumns();
        return (rs, rowNum) -> {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                ColumnDef c = columns.get(i);
                values[i] = c.getType().read(rs, c.getName());
            }
            return Row.of(schema, values);
        };
    }
}
