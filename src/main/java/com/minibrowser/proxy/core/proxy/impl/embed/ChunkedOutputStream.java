package com.minibrowser.proxy.core.proxy.impl.embed;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes {@code Transfer-Encoding: chunked} framing. {@link #finish()} writes
 * the terminating chunk; {@link #close()} finishes without closing the
 * underlying connection stream.
 */
class ChunkedOutputStream extends FilterOutputStream {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    private boolean finished;

    ChunkedOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (finished) {
            throw new IOException("Chunked stream already finished");
        }
        if (len == 0) {
            return;
        }
        out.write(Integer.toHexString(len).getBytes(StandardCharsets.US_ASCII));
        out.write(CRLF);
        out.write(b, off, len);
        out.write(CRLF);
    }

    /**
     * Writes the last chunk and flushes.
     *
     * @throws IOException If writing fails.
     */
    void finish() throws IOException {
        if (!finished) {
            finished = true;
            out.write(LAST_CHUNK);
            out.flush();
        }
    }

    @Override
    public void close() throws IOException {
        finish();
    }
}
