package com.linlay.agentstream.stream.marker;

import java.util.Optional;

/**
 * Separates a chunked character stream into visible text and the interior of an
 * open/close marker pair (e.g. {@code <thinking>...</thinking>}).
 * <p>
 * The first {@code lookahead} characters are held back until it is known whether the
 * stream opens with a marker. Without one the splitter switches to pass-through for the
 * rest of the stream; with one, everything up to the closing tag is withheld and the
 * interior becomes {@link #hiddenText()}. Text returned from {@link #feed(String)} is
 * never revised later.
 * <p>
 * Not thread-safe; one instance per stream, reused through {@link #reset()}.
 */
public class MarkerSplitter {

    public static final String DEFAULT_OPEN_TAG = "<thinking>";
    public static final String DEFAULT_CLOSE_TAG = "</thinking>";
    public static final int DEFAULT_LOOKAHEAD = 20;

    private enum Mode {
        BUFFERING,
        INSIDE,
        PASS_THROUGH,
        FINISHED
    }

    private final String openTag;
    private final String closeTag;
    private final int lookahead;

    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder inside = new StringBuilder();
    private Mode mode = Mode.BUFFERING;
    private String hiddenText;

    public MarkerSplitter() {
        this(DEFAULT_OPEN_TAG, DEFAULT_CLOSE_TAG, DEFAULT_LOOKAHEAD);
    }

    public MarkerSplitter(String openTag, String closeTag, int lookahead) {
        if (openTag == null || openTag.isBlank() || closeTag == null || closeTag.isBlank()) {
            throw new IllegalArgumentException("openTag and closeTag must not be blank");
        }
        if (lookahead <= openTag.length()) {
            throw new IllegalArgumentException(
                    "lookahead must exceed the open tag length: lookahead=" + lookahead + ", openTag=" + openTag
            );
        }
        this.openTag = openTag;
        this.closeTag = closeTag;
        this.lookahead = lookahead;
    }

    /**
     * Splits a complete text in one pass.
     */
    public static Split split(String text, String openTag, String closeTag) {
        MarkerSplitter splitter = new MarkerSplitter(openTag, closeTag, Integer.MAX_VALUE);
        String visible = splitter.feed(text) + splitter.finish();
        return new Split(visible, splitter.hiddenText().orElse(null));
    }

    /**
     * Feeds the next chunk and returns the visible text that became available.
     */
    public String feed(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return "";
        }
        return switch (mode) {
            case PASS_THROUGH -> chunk;
            case INSIDE -> {
                inside.append(chunk);
                yield resolveInside();
            }
            case BUFFERING -> {
                pending.append(chunk);
                yield pending.length() < lookahead ? "" : decide(false);
            }
            case FINISHED -> throw new IllegalStateException("Splitter already finished; reset() before reuse");
        };
    }

    /**
     * Marks end of stream. Flushes text still held for the marker decision and drops an
     * unclosed marker interior. Safe to call more than once.
     */
    public String finish() {
        String visible = "";
        if (mode == Mode.BUFFERING) {
            visible = decide(true);
        }
        if (mode == Mode.INSIDE) {
            inside.setLength(0);
        }
        mode = Mode.FINISHED;
        return visible;
    }

    public Optional<String> hiddenText() {
        return Optional.ofNullable(hiddenText);
    }

    public boolean isInsideMarker() {
        return mode == Mode.INSIDE;
    }

    public boolean isPassThrough() {
        return mode == Mode.PASS_THROUGH;
    }

    public void reset() {
        pending.setLength(0);
        inside.setLength(0);
        mode = Mode.BUFFERING;
        hiddenText = null;
    }

    private String decide(boolean endOfStream) {
        String buffered = pending.toString();
        int openAt = buffered.indexOf(openTag);
        if (openAt < 0) {
            if (!endOfStream && endsWithPartialOpenTag(buffered)) {
                return "";
            }
            pending.setLength(0);
            mode = Mode.PASS_THROUGH;
            return buffered;
        }
        pending.setLength(0);
        inside.append(buffered, openAt, buffered.length());
        mode = Mode.INSIDE;
        return buffered.substring(0, openAt) + resolveInside();
    }

    private String resolveInside() {
        int closeAt = inside.indexOf(closeTag, openTag.length());
        if (closeAt < 0) {
            return "";
        }
        String segment = inside.toString();
        // a repeated open tag before the first close starts a new interior
        int openAt = segment.lastIndexOf(openTag, closeAt - openTag.length());
        hiddenText = segment.substring(openAt + openTag.length(), closeAt);
        inside.setLength(0);
        mode = Mode.PASS_THROUGH;
        return segment.substring(closeAt + closeTag.length());
    }

    private boolean endsWithPartialOpenTag(String buffered) {
        int max = Math.min(openTag.length() - 1, buffered.length());
        for (int length = max; length > 0; length--) {
            if (buffered.endsWith(openTag.substring(0, length))) {
                return true;
            }
        }
        return false;
    }

    public record Split(String visible, String hidden) {
    }
}
