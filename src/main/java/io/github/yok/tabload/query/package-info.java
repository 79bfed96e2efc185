/**
 * Criteria model and its compilation into parameterized SQL.
 *
 * <p>
 * {@link io.github.yok.tabload.query.CriteriaQueryBuilder} is the only place where SQL text for ad
 * hoc retrieval is assembled.
 * </p>
 */
package io.github.yok.tabload.query;
