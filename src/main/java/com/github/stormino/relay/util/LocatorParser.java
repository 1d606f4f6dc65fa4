package com.github.stormino.relay.util;

import com.github.stormino.relay.model.ObjectLocator;
import lombok.experimental.UtilityClass;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses message-source links into object locators and derives display names.
 */
@UtilityClass
public class LocatorParser {

    public static final String DEFAULT_EXTENSION = ".mkv";

    private static final Pattern PRIVATE_LINK = Pattern.compile("^https://t\\.me/c/(\\d+)/(\\d+)/?$");
    private static final Pattern PUBLIC_LINK = Pattern.compile("^https://t\\.me/([^/]+)/(\\d+)/?$");

    /**
     * Parse a message link.
     * Supports public channels ({@code https://t.me/<name>/<id>}) and private channels
     * ({@code https://t.me/c/<numericId>/<id>}).
     *
     * @param url Message link
     * @return Locator, or empty if the link is not recognised
     */
    public static Optional<ObjectLocator> parse(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();

        Matcher privateMatch = PRIVATE_LINK.matcher(trimmed);
        if (privateMatch.matches()) {
            return Optional.of(ObjectLocator.of(privateMatch.group(1), privateMatch.group(2)));
        }

        Matcher publicMatch = PUBLIC_LINK.matcher(trimmed);
        if (publicMatch.matches()) {
            return Optional.of(ObjectLocator.of(publicMatch.group(1), publicMatch.group(2)));
        }

        return Optional.empty();
    }

    /**
     * Extract the extension (with leading dot) of an original filename, falling back to
     * {@link #DEFAULT_EXTENSION}.
     */
    public static String extensionOf(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        int lastDot = originalFilename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < originalFilename.length() - 1) {
            return originalFilename.substring(lastDot);
        }
        return DEFAULT_EXTENSION;
    }

    /**
     * Display name of a relayed object: its reference plus the original file's extension.
     */
    public static String displayName(ObjectLocator locator, String originalFilename) {
        return locator.getObjectRef() + extensionOf(originalFilename);
    }
}
