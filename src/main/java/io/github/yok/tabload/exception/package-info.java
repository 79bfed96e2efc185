/**
 * Failure types raised by TabLoad.
 *
 * <p>
 * All exceptions are unchecked and extend {@link io.github.yok.tabload.exception.TabLoadException}.
 * Caller-input errors (unknown column, empty membership list, unsupported mode) are raised before
 * any statement reaches the database.
 * </p>
 */
package io.github.yok.tabload.exception;
