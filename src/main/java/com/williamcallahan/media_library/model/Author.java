package com.williamcallahan.media_library.model;

import java.util.Objects;

/**
 * One credited contributor of a book, e.g. {@code ("Jane Doe", "writer")}.
 *
 * @param name contributor name
 * @param role free-form role (writer, penciller, translator...)
 */
public record Author(String name, String role) {

    public Author {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
    }
}
