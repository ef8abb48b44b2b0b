/**
 * Replay Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>byte-level layer</strong> of replay
 * decoding: the bounds-checked {@link com.questrail.replay.codec.ByteCursor},
 * the {@link com.questrail.replay.codec.PayloadExpander} and
 * {@link com.questrail.replay.codec.ContainerDecoder} seams, and the two
 * exception types that separate fatal format errors from ordinary underruns.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] file
 *        → ContainerDecoder        (signature, header, roster)
 *            → PayloadExpander     (embedded compressed body, if any)
 *        → CommandStreamDecoder    (frame markers and opcode records)
 *            → AnalyticsEngine
 * </pre>
 *
 * <h2>Error Boundaries</h2>
 * <ul>
 *   <li>{@link com.questrail.replay.codec.InvalidFormatException} is fatal and
 *       only raised for a missing or wrong signature.</li>
 *   <li>{@link com.questrail.replay.codec.BufferUnderrunException} is checked;
 *       each caller decides whether a short read is an error.</li>
 * </ul>
 */
package com.questrail.replay.codec;
