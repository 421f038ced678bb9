package io.errordispatch.core.model;

/** Tags of the errors the default handler set knows how to answer. */
public final class Tags {

    private static final String NAMESPACE = "errordispatch";

    /** Error embedding a ready-made {@link Response}. */
    public static final Tag RESPONSE = Tag.of(NAMESPACE, "response");

    /** Request body could not be decoded in its declared format. */
    public static final Tag DECODE_FAILURE = Tag.of(NAMESPACE, "decode-failure");

    /** Request failed structural validation. */
    public static final Tag REQUEST_VALIDATION = Tag.of(NAMESPACE, "request-validation-failure");

    /** Handler produced a response that failed structural validation. */
    public static final Tag RESPONSE_VALIDATION = Tag.of(NAMESPACE, "response-validation-failure");

    private Tags() {
        // constants
    }
}
