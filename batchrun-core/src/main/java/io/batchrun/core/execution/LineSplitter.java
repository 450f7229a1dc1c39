package io.batchrun.core.execution;

import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Turns the byte chunks of one output stream into numbered log entries.
///
/// Bytes are decoded as UTF-8, replacing malformed input; a multi-byte sequence cut
/// by a chunk boundary is completed from the next chunk. Decoded text is split after
/// every line terminator (see {@link LogEntry#LINE_TERMINATORS}, with `CR LF` kept
/// together). A piece that ends a line moves to the next line number; any other piece
/// advances the number within the line.
///
/// {@snippet :
/// LineSplitter splitter = new LineSplitter(runId, LogEntryKind.STDOUT);
/// splitter.accept(bytes("a\nb"), now);   // (1,1,"a\n"), (2,1,"b")
/// splitter.accept(bytes("c\n"), now);    // (2,2,"c\n")
/// }
///
/// @implNote Not thread-safe; one instance per stream.
public final class LineSplitter {

    private final long runId;
    private final LogEntryKind kind;
    private final CharsetDecoder decoder =
            StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private byte[] carry = new byte[0];
    private int lineNumber = 1;
    private int numberWithinLine = 1;

    public LineSplitter(long runId, LogEntryKind kind) {
        this.runId = runId;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Splits one chunk.
    ///
    /// @param chunk the bytes read, not null
    /// @param time the read time shared by all resulting entries, not null
    /// @return the entries, possibly empty, never null
    public List<LogEntry> accept(byte[] chunk, Instant time) {
        return accept(chunk, chunk.length, time);
    }

    /// Splits the first `length` bytes of `buffer`.
    public List<LogEntry> accept(byte[] buffer, int length, Instant time) {
        return toEntries(decode(buffer, length, false), time);
    }

    /// Flushes bytes of an incomplete trailing sequence at end of stream.
    ///
    /// @return a final entry holding a replacement character, or nothing
    public List<LogEntry> finish(Instant time) {
        return toEntries(decode(new byte[0], 0, true), time);
    }

    private String decode(byte[] buffer, int length, boolean endOfInput) {
        ByteBuffer in = ByteBuffer.allocate(carry.length + length);
        in.put(carry).put(buffer, 0, length).flip();
        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, endOfInput);
        if (endOfInput) {
            decoder.flush(out);
        }
        carry = new byte[in.remaining()];
        in.get(carry);
        out.flip();
        return out.toString();
    }

    private List<LogEntry> toEntries(String text, Instant time) {
        List<LogEntry> entries = new ArrayList<>();
        for (String piece : split(text)) {
            entries.add(new LogEntry(runId, kind, lineNumber, numberWithinLine, time, piece));
            if (LogEntry.endsWithLineTerminator(piece)) {
                lineNumber++;
                numberWithinLine = 1;
            } else {
                numberWithinLine++;
            }
        }
        return entries;
    }

    /// Splits text after each line terminator, keeping the terminators.
    ///
    /// @param text the text, not null
    /// @return the pieces, whose concatenation is `text`, never null
    static List<String> split(String text) {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!LogEntry.isLineTerminator(c)) {
                continue;
            }
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            }
            pieces.add(text.substring(start, i + 1));
            start = i + 1;
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }
}
