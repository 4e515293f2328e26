/**
 * Spring configuration for the spoken-response pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.speakstream.config.ThreadPoolConfig} - synthesis and playback
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.speakstream.config.ThreadPoolMetricsConfig} - pool gauges and a
 *       periodic pool summary</li>
 *   <li>{@link com.phillippitts.speakstream.config.PipelineConfig} - the default synthesis
 *       provider</li>
 *   <li>{@link com.phillippitts.speakstream.config.properties.SpeechPipelineProperties} - typed
 *       per-session settings under {@code speech.pipeline.*}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakstream.config;
