/**
 * YAML configuration of the detection pipeline.
 *
 * <p>
 * {@link com.apisentinel.core.config.SentinelConfig} holds every tunable with
 * its default; {@link com.apisentinel.core.config.ConfigLoader} reads it with
 * SnakeYAML and validates it fail-fast.
 * </p>
 */
package com.apisentinel.core.config;
