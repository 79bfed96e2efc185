/**
 * Utility package for TabLoad.
 *
 * <p>
 * Provides CLI error reporting, explicit performance measurement, CSV rendering of results and
 * masking of connection details in logs.
 * </p>
 */
package io.github.yok.tabload.util;
