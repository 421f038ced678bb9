package io.errordispatch.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw body bytes plus their {@link MediaType}. Used for both request and response bodies.
 *
 * <p>{@code equals}/{@code hashCode} compare byte content, not array identity.
 */
public record MessageBody(byte[] content, MediaType mediaType) {

    private static final MessageBody EMPTY = new MessageBody(new byte[0], MediaType.NONE);

    public MessageBody {
        if (content == null) {
            content = new byte[0];
        }
        Objects.requireNonNull(mediaType, "mediaType must not be null; use MediaType.NONE for absent types");
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    /** Returns content as a UTF-8 string. */
    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int size() {
        return content.length;
    }

    /** Creates a JSON body from raw bytes. */
    public static MessageBody json(byte[] content) {
        return new MessageBody(content, MediaType.JSON);
    }

    /** Creates a plain-text body (UTF-8). */
    public static MessageBody text(String content) {
        return new MessageBody(
                content != null ? content.getBytes(StandardCharsets.UTF_8) : new byte[0], MediaType.TEXT);
    }

    public static MessageBody empty() {
        return EMPTY;
    }

    public static MessageBody of(byte[] content, MediaType mediaType) {
        return new MessageBody(content, mediaType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageBody that)) return false;
        return mediaType == that.mediaType && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(content) + mediaType.hashCode();
    }

    @Override
    public String toString() {
        return "MessageBody[" + mediaType + ", " + content.length + " bytes]";
    }
}
