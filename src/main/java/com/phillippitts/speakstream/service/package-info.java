/**
 * Service layer of the spoken-response pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.parser} - incremental sentence segmentation of streamed text</li>
 *   <li>{@code service.synthesis} - bounded-concurrency synthesis with failure policies</li>
 *   <li>{@code service.playback} - strict-order, interruptible playback</li>
 *   <li>{@code service.session} - per-response context wiring the three together, and the
 *       per-channel session registry</li>
 *   <li>{@code service.metrics}, {@code service.events}, {@code service.health} - observability</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Pipeline components are per-session objects, never shared singletons</li>
 *   <li>Synthesis and playback errors are reported through listeners, events and metrics,
 *       never thrown to the text producer</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakstream.service;
