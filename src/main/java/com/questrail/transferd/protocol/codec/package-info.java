/**
 * Envelope Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> between raw frame
 * bytes and semantic {@link com.questrail.transferd.protocol.model.DaemonMessage}s.</p>
 *
 * <pre>
 *   byte[] frame
 *        → EnvelopeDecoder     (header, length, decompression)
 *            → Envelope        (post-wire, plain payload)
 *                → PayloadCodec
 *                    → Request / Response / Event
 * </pre>
 *
 * <h2>Wire layout</h2>
 * <pre>
 *   offset  size  field
 *   0       1     magic 'T' (0x54)
 *   1       1     protocol version (1)
 *   2       1     type: 1 request, 2 response, 3 event
 *   3       1     flags: bit 0 = payload deflate-compressed
 *   4       4     payload length, big-endian, as sent on the wire
 *   8       n     payload
 * </pre>
 *
 * <p>The length prefix makes framing self-delimiting: the transport uses it to
 * cut the byte stream into frames, the decoder re-validates it.</p>
 */
package com.questrail.transferd.protocol.codec;
