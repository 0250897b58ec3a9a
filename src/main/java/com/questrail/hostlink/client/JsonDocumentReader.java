package com.questrail.hostlink.client;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;
import com.questrail.hostlink.codec.Jsons;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reads complete JSON documents from a byte stream, one chunk at a time.
 *
 * <p>A response may span any number of reads. Chunks are fed to Jackson's
 * non-blocking parser, which tracks nesting until the top-level value is
 * closed. Bytes read past the end of a document are kept for the next call.</p>
 *
 * <p>Not thread-safe; owned by one connection.</p>
 */
final class JsonDocumentReader
{
    private static final byte[] EMPTY = new byte[0];

    private final JsonFactory factory;
    private final InputStream in;
    private final byte[] chunk;
    private byte[] leftover = EMPTY;

    JsonDocumentReader(InputStream in, int chunkSize) {
        this.in = Objects.requireNonNull(in, "in");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        this.chunk = new byte[chunkSize];
        this.factory = Jsons.mapper().getFactory();
    }

    /**
     * Blocks until one complete JSON document has been read.
     *
     * @throws EOFException if the stream ends before the document is complete
     * @throws IOException on read failure, read timeout or malformed JSON
     */
    byte[] readDocument() throws IOException {
        ByteArrayOutputStream document = new ByteArrayOutputStream();

        byte[] buf;
        int len;
        if (leftover.length > 0) {
            buf = leftover;
            len = leftover.length;
            leftover = EMPTY;
        }
        else {
            buf = chunk;
            len = fill();
        }

        try (JsonParser parser = factory.createNonBlockingByteArrayParser()) {
            ByteArrayFeeder feeder = (ByteArrayFeeder) parser.getNonBlockingInputFeeder();
            long fedBefore = 0;
            int depth = 0;

            while (true) {
                feeder.feedInput(buf, 0, len);

                JsonToken token;
                while ((token = parser.nextToken()) != JsonToken.NOT_AVAILABLE && token != null) {
                    if (token.isStructStart()) {
                        depth++;
                    }
                    else if (token.isStructEnd()) {
                        depth--;
                    }

                    if (depth == 0) {
                        int end = (int) (parser.currentLocation().getByteOffset() - fedBefore);
                        document.write(buf, 0, end);
                        leftover = Arrays.copyOfRange(buf, end, len);
                        return document.toByteArray();
                    }
                }

                document.write(buf, 0, len);
                fedBefore += len;
                buf = chunk;
                len = fill();
            }
        }
    }

    private int fill() throws IOException {
        int n = in.read(chunk);
        if (n < 0) {
            throw new EOFException("Connection closed before a complete response was received");
        }
        return n;
    }
}
