/**
 * Incremental sentence segmentation of streamed response text.
 *
 * <p>{@link com.phillippitts.speakstream.service.parser.SentenceParser} turns token deltas into
 * numbered {@link com.phillippitts.speakstream.domain.TextChunk}s without false boundaries on
 * abbreviations, decimals, initials or ellipses.
 */
package com.phillippitts.speakstream.service.parser;
