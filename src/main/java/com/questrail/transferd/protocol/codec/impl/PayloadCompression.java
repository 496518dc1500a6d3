package com.questrail.transferd.protocol.codec.impl;

import com.questrail.transferd.protocol.codec.ProtocolException;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib (deflate) compression of envelope payloads.
 *
 * <p>Inflation is bounded: a payload that expands beyond {@code maxLength}
 * is rejected before it is fully materialized.</p>
 */
final class PayloadCompression
{
    private static final int CHUNK = 8192;

    private PayloadCompression() {}

    static byte[] deflate(byte[] plain)
    {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(plain);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, plain.length / 2));
            byte[] buffer = new byte[CHUNK];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }
        finally {
            deflater.end();
        }
    }

    static byte[] inflate(byte[] compressed, int maxLength)
    {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxLength, compressed.length * 4 + 64));
            byte[] buffer = new byte[CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && !inflater.finished()) {
                    throw new ProtocolException("Truncated compressed payload");
                }
                if (out.size() + n > maxLength) {
                    throw new ProtocolException("Decompressed payload exceeds " + maxLength + " bytes");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }
        catch (DataFormatException e) {
            throw new ProtocolException("Corrupt compressed payload", e);
        }
        finally {
            inflater.end();
        }
    }
}
