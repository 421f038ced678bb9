package io.errordispatch.standalone.config;

import java.util.Objects;

/**
 * Maps a tag to a fixed problem-details answer.
 *
 * @param tag tag text, e.g. {@code app/not-found}
 * @param status HTTP status, 100..599
 * @param title problem title; defaults to {@code HTTP <status>}
 */
public record StatusMapping(String tag, int status, String title) {

    public StatusMapping {
        Objects.requireNonNull(tag, "tag must not be null");
        title = title != null ? title : "HTTP " + status;
    }
}
