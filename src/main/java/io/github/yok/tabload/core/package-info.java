/**
 * Core workflows: loading a {@link io.github.yok.tabload.data.RowSet} into the target table,
 * criteria retrieval and the fixed aggregate reports.
 *
 * <p>
 * Each component takes its target and {@link javax.sql.DataSource} in the constructor and opens
 * one connection per logical operation.
 * </p>
 */
package io.github.yok.tabload.core;
