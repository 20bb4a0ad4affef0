package com.tau.backend.modules.auth.domain;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Absolute URL of a profile picture. The last path segment must be a file name with a
 * non-empty stem and a png, jpg, jpeg or webp extension.
 */
public final class PhotoUrl {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");

    private final URI url;

    private PhotoUrl(URI url) {
        this.url = url;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PhotoUrl of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid URL: value is empty");
        }
        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + ex.getMessage(), ex);
        }
        if (!uri.isAbsolute() || uri.getPath() == null) {
            throw new IllegalArgumentException("Invalid URL: " + value);
        }
        if (!hasImageExtension(uri.getPath())) {
            throw new IllegalArgumentException("URL must point to a valid image file.");
        }
        return new PhotoUrl(uri);
    }

    static boolean hasImageExtension(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        String extension = fileName.substring(dot + 1);
        return IMAGE_EXTENSIONS.contains(extension);
    }

    public URI asUri() {
        return url;
    }

    @JsonValue
    public String asString() {
        return url.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof PhotoUrl that && url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url);
    }

    @Override
    public String toString() {
        return asString();
    }
}
