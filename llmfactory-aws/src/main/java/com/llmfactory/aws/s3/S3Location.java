package com.llmfactory.aws.s3;

import com.llmfactory.common.store.StoreLocations;

/**
 * Parsed {@code s3://bucket/path} location.
 */
public record S3Location(String bucket, String path) {

    public static S3Location parse(String location) {
        if (!StoreLocations.isS3(location)) {
            throw new IllegalArgumentException("Not an S3 location: " + location);
        }
        String rest = location.substring(StoreLocations.S3_SCHEME.length());
        int slash = rest.indexOf('/');
        String bucket = slash >= 0 ? rest.substring(0, slash) : rest;
        if (bucket.isBlank()) {
            throw new IllegalArgumentException("S3 location has no bucket: " + location);
        }
        return new S3Location(bucket, slash >= 0 ? rest.substring(slash + 1) : "");
    }

    /** Object key: the path without trailing slashes. */
    public String key() {
        String k = path;
        while (k.endsWith("/")) {
            k = k.substring(0, k.length() - 1);
        }
        return k;
    }

    /** The key as a directory prefix: empty for the bucket root, otherwise slash-terminated. */
    public String directoryPrefix() {
        String k = key();
        return k.isEmpty() ? "" : k + "/";
    }

    public String uriFor(String objectKey) {
        return StoreLocations.S3_SCHEME + bucket + "/" + objectKey;
    }
}
