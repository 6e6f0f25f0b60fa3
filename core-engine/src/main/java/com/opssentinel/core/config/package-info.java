/**
 * Configuration loading and validation for Ops Sentinel.
 *
 * <p>
 * The YAML file is loaded by
 * {@link com.opssentinel.core.config.ConfigLoader} into a
 * {@link com.opssentinel.core.config.SentinelConfig} with monitoring,
 * response and threshold sections, and validated right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.opssentinel.core.config;
