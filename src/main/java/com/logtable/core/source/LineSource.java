package com.logtable.core.source;

import com.logtable.core.model.FailureReason;
import com.logtable.core.model.LineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-producer sequence of lines over a list of files, in file-then-line order.
 * <p>
 * Only one file is open at a time and the next file is not opened until the current one is
 * exhausted. Bytes are decoded through a strict streaming decoder and split on {@code '\n'}
 * after decoding, so multi-byte charsets such as UTF-16 split correctly. Memory use is
 * bounded by the longest line rather than by file size.
 * <p>
 * Byte sequences that are not valid in the configured charset are replaced with
 * {@code U+FFFD} and the line containing them is returned with a
 * {@link FailureReason#DECODE_ERROR} defect. A file that cannot be opened, or fails mid-read,
 * yields one {@link FailureReason#UNREADABLE_FILE} record at the line where reading stopped;
 * the source then continues with the next file.
 * <p>
 * Not thread-safe: one coordinating thread reads it.
 */
public class LineSource implements Iterator<LineRecord>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LineSource.class);

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final char REPLACEMENT = '\uFFFD';

    private final List<Path> files;
    private final CharsetDecoder decoder;
    private final ByteBuffer bytes = ByteBuffer.allocate(BUFFER_SIZE);
    private final CharBuffer chars = CharBuffer.allocate(BUFFER_SIZE);
    private final StringBuilder line = new StringBuilder(256);

    private int fileIndex;
    private InputStream current;
    private long lineIndex;
    private LineRecord next;
    private boolean closed;

    // decoder state of the current file
    private boolean endOfInput;
    private boolean flushed;
    private int malformedLength;
    private boolean lineMalformed;

    public LineSource(List<Path> files, Charset charset) {
        this.files = List.copyOf(files);
        this.decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !closed) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public LineRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        LineRecord record = next;
        next = null;
        return record;
    }

    /** Index of the file currently being read, or {@code files.size()} once exhausted. */
    public int currentFileIndex() {
        return fileIndex;
    }

    @Override
    public void close() {
        closed = true;
        next = null;
        closeCurrent();
    }

    private LineRecord advance() {
        while (fileIndex < files.size()) {
            Path file = files.get(fileIndex);
            if (current == null) {
                try {
                    current = Files.newInputStream(file);
                    startFile();
                    log.debug("Opened {} ({} of {})", file, fileIndex + 1, files.size());
                } catch (IOException e) {
                    return unreadable(file, 0, e);
                }
            }

            String text;
            try {
                text = readLine();
            } catch (IOException e) {
                return unreadable(file, lineIndex, e);
            }

            if (text == null) {
                log.debug("Finished {} after {} line(s)", file, lineIndex);
                closeCurrent();
                fileIndex++;
                continue;
            }
            long index = lineIndex++;
            return lineMalformed
                    ? new LineRecord(fileIndex, index, file, text, FailureReason.DECODE_ERROR)
                    : LineRecord.of(fileIndex, index, file, text);
        }
        return null;
    }

    private void startFile() {
        lineIndex = 0;
        decoder.reset();
        bytes.clear().flip();
        chars.clear().flip();
        endOfInput = false;
        flushed = false;
        malformedLength = 0;
    }

    private LineRecord unreadable(Path file, long atLine, IOException e) {
        log.warn("Cannot read {} at line {}: {}", file, atLine + 1, e.toString());
        int index = fileIndex;
        closeCurrent();
        fileIndex++;
        return new LineRecord(index, atLine, file, e.toString(), FailureReason.UNREADABLE_FILE);
    }

    /**
     * Reads up to the next {@code '\n'}, dropping the terminator and one preceding
     * {@code '\r'}. Returns {@code null} at end of input when no characters remain.
     */
    private String readLine() throws IOException {
        line.setLength(0);
        lineMalformed = false;
        boolean sawAny = false;
        while (true) {
            while (chars.hasRemaining()) {
                char c = chars.get();
                sawAny = true;
                if (c == '\n') {
                    return finishLine();
                }
                line.append(c);
            }
            if (malformedLength > 0) {
                bytes.position(bytes.position() + malformedLength);
                malformedLength = 0;
                line.append(REPLACEMENT);
                lineMalformed = true;
                sawAny = true;
                continue;
            }
            if (!decodeMore()) {
                return sawAny ? finishLine() : null;
            }
        }
    }

    private String finishLine() {
        int length = line.length();
        if (length > 0 && line.charAt(length - 1) == '\r') {
            line.setLength(length - 1);
        }
        return line.toString();
    }

    /**
     * Refills {@link #chars}. A malformed input sequence stops decoding and is left for
     * {@link #readLine()} to replace once the characters before it are consumed.
     *
     * @return {@code false} once the file is fully decoded
     */
    private boolean decodeMore() throws IOException {
        if (flushed) {
            return false;
        }
        chars.clear();
        while (true) {
            CoderResult result = decoder.decode(bytes, chars, endOfInput);
            if (result.isError()) {
                malformedLength = result.length();
                break;
            }
            if (chars.position() > 0 || result.isOverflow()) {
                break;
            }
            if (endOfInput) {
                decoder.flush(chars);
                flushed = true;
                break;
            }
            readBytes();
        }
        chars.flip();
        return chars.hasRemaining() || malformedLength > 0;
    }

    private void readBytes() throws IOException {
        bytes.compact();
        int n = current.read(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
        if (n < 0) {
            endOfInput = true;
        } else {
            bytes.position(bytes.position() + n);
        }
        bytes.flip();
    }

    private void closeCurrent() {
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.debug("Ignoring close failure on {}: {}", files.get(fileIndex), e.getMessage());
            }
            current = null;
        }
    }
}
