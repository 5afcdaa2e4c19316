package com.questrail.matchsync.peer.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Splits serialized snapshots into fixed-size fragments and joins them back.
 *
 * <p>Sizes are counted in UTF-16 chars, the unit the serialized string is
 * measured in. A fragment never ends between the two halves of a surrogate
 * pair: a lone surrogate cannot be encoded as UTF-8 and would reach the peer
 * as {@code '?'}. Such a fragment is one char shorter than the chunk size.
 * Reassembly only requires every index to be present; arrival order is
 * irrelevant.</p>
 */
public final class PayloadChunks
{
    /** 100 KiB: payloads shorter than this travel as a single {@code DATA} message. */
    public static final int DEFAULT_CHUNK_SIZE = 100 * 1024;

    private PayloadChunks() {}

    /**
     * Whether {@code text} must be chunked at {@code chunkSize}.
     */
    public static boolean requiresChunking(String text, int chunkSize) {
        return text.length() >= chunkSize;
    }

    public static List<String> split(String text, int chunkSize) {
        Objects.requireNonNull(text, "text");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (text.isEmpty()) {
            return List.of("");
        }
        List<String> chunks = new ArrayList<>((text.length() + chunkSize - 1) / chunkSize);
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + chunkSize);
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))
                    && Character.isLowSurrogate(text.charAt(end))) {
                // never split a surrogate pair; a one-char chunk takes the whole pair
                end = end - 1 > start ? end - 1 : end + 1;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return Collections.unmodifiableList(chunks);
    }

    /**
     * Concatenate chunks {@code 0..totalChunks-1}.
     *
     * @throws MissingChunkException for the first absent index
     */
    public static String reassemble(Map<Integer, String> chunks, int totalChunks) {
        Objects.requireNonNull(chunks, "chunks");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < totalChunks; i++) {
            String chunk = chunks.get(i);
            if (chunk == null) {
                throw new MissingChunkException(i);
            }
            sb.append(chunk);
        }
        return sb.toString();
    }

    /**
     * Human-readable size: bytes, KB or MB with one decimal.
     */
    public static String formatSize(long length) {
        if (length < 1024) {
            return length + " bytes";
        }
        if (length < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", length / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", length / (1024.0 * 1024.0));
    }
}
