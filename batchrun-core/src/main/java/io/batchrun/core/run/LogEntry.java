package io.batchrun.core.run;

import java.time.Instant;
import java.util.Objects;

/// One piece of captured output of a run.
///
/// A piece is at most one line: either a whole line including its terminator or a
/// fragment of a line that was still being written when the chunk was read.
///
/// ### Contracts
/// - **Invariant**: `lineNumber >= 1` and `number >= 1`
/// - **Invariant**: within one run and kind, `(lineNumber, number)` strictly increases
///
/// @param runId owning run, positive
/// @param kind the stream the text came from, not null
/// @param lineNumber 1-based line within the stream
/// @param number 1-based position of this piece within its line
/// @param time when the chunk containing the piece was read, not null
/// @param text the decoded text including any line terminator, not null
public record LogEntry(
        long runId, LogEntryKind kind, int lineNumber, int number, Instant time, String text) {

    /// Characters that end a line: LF, VT, FF, CR, FS, GS, RS, NEL, LS and PS.
    public static final String LINE_TERMINATORS =
            "\n\u000B\u000C\r\u001C\u001D\u001E\u0085\u2028\u2029";

    public LogEntry {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (lineNumber < 1 || number < 1) {
            throw new IllegalArgumentException(
                    "lineNumber and number must be positive: " + lineNumber + "/" + number);
        }
    }

    /// Returns whether this piece completes its line.
    public boolean endsLine() {
        return endsWithLineTerminator(text);
    }

    /// Returns whether the text ends with one of {@link #LINE_TERMINATORS}.
    ///
    /// @param text the text to inspect, not null
    /// @return `true` if the last character terminates a line
    public static boolean endsWithLineTerminator(String text) {
        return !text.isEmpty() && isLineTerminator(text.charAt(text.length() - 1));
    }

    /// Returns whether the character is one of {@link #LINE_TERMINATORS}.
    public static boolean isLineTerminator(char c) {
        return LINE_TERMINATORS.indexOf(c) >= 0;
    }
}
