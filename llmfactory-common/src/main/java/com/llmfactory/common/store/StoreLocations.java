package com.llmfactory.common.store;

import java.util.Locale;

/**
 * Helpers for location strings shared by the object store implementations.
 */
public final class StoreLocations {

    public static final String S3_SCHEME = "s3://";

    private StoreLocations() {
    }

    public static boolean isS3(String location) {
        return location != null && location.regionMatches(true, 0, S3_SCHEME, 0, S3_SCHEME.length());
    }

    /**
     * Last path segment of a location.
     */
    public static String fileName(String location) {
        String trimmed = stripTrailingSlashes(location.replace('\\', '/'));
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    /**
     * File name without its extension: {@code /models/gpt_4o.yaml -> gpt_4o}.
     */
    public static String baseName(String location) {
        String name = fileName(location);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static boolean hasExtension(String location, Iterable<String> extensions) {
        String lower = fileName(location).toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 1 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
