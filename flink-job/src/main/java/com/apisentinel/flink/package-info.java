/**
 * Apache Flink streaming job for API Sentinel.
 *
 * <p>
 * Wires the core pipeline into Flink: records are consumed from Kafka, keyed
 * by endpoint, windowed and analysed, and alert changes are published back to
 * Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.apisentinel.flink.ApiSentinelJob}: main entry point</li>
 * <li>{@link com.apisentinel.flink.DegradationProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.apisentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.apisentinel.flink;
