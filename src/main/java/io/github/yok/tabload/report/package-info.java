/**
 * Result types of the aggregate reports.
 */
package io.github.yok.tabload.report;
