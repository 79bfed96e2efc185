/**
 * Configuration binding ({@code source}, {@code target} sections of {@code application.yml}),
 * validation and the immutable {@link io.github.yok.tabload.config.TargetDescriptor}.
 */
package io.github.yok.tabload.config;
