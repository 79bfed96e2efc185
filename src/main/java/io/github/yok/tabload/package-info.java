/**
 * TabLoad: loads delimited files into a relational table and answers criteria queries and
 * aggregate reports over it.
 */
package io.github.yok.tabload;
