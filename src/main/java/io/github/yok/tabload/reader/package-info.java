/**
 * Reading of delimited source files into typed row sets.
 */
package io.github.yok.tabload.reader;
