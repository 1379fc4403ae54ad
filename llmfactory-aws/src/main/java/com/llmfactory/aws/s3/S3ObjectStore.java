package com.llmfactory.aws.s3;

import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.StoreLocations;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link ObjectStore} over S3. A "directory" is a key prefix; only objects
 * directly under the prefix are listed.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private static final String DELIMITER = "/";

    private final Supplier<S3Client> s3;

    public S3ObjectStore(Supplier<S3Client> s3) {
        this.s3 = s3;
    }

    @Override
    public boolean supports(String location) {
        return StoreLocations.isS3(location);
    }

    @Override
    public boolean isDirectory(String location) {
        S3Location loc = parse(location);
        try {
            ListObjectsV2Response response = s3.get().listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(loc.bucket())
                    .prefix(loc.directoryPrefix())
                    .maxKeys(1)
                    .build());
            if (loc.directoryPrefix().isEmpty()) {
                return true;
            }
            return response.hasContents() && !response.contents().isEmpty()
                    || response.hasCommonPrefixes() && !response.commonPrefixes().isEmpty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw wrap("LIST", location, e);
        } catch (SdkClientException e) {
            throw wrap("LIST", location, e);
        }
    }

    @Override
    public List<String> list(String location, Set<String> extensions) {
        S3Location loc = parse(location);
        List<String> result = new ArrayList<>();
        String token = null;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                        .bucket(loc.bucket())
                        .prefix(loc.directoryPrefix())
                        .delimiter(DELIMITER);
                if (token != null) {
                    request.continuationToken(token);
                }
                ListObjectsV2Response response = s3.get().listObjectsV2(request.build());
                if (response.hasContents()) {
                    for (S3Object object : response.contents()) {
                        String key = object.key();
                        if (key.endsWith(DELIMITER) || !StoreLocations.hasExtension(key, extensions)) {
                            continue;
                        }
                        result.add(loc.uriFor(key));
                    }
                }
                token = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
            } while (token != null);
        } catch (S3Exception | SdkClientException e) {
            throw wrap("LIST", location, e);
        }
        result.sort(null);
        log.debug("Listed {} object(s) under {}", result.size(), location);
        return result;
    }

    @Override
    public byte[] read(String location) {
        S3Location loc = parse(location);
        try {
            return s3.get().getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(loc.bucket())
                    .key(loc.key())
                    .build())
                    .asByteArray();
        } catch (S3Exception | SdkClientException e) {
            throw wrap("GET", location, e);
        }
    }

    private static StoreAccessError wrap(String op, String location, RuntimeException e) {
        return new StoreAccessError("S3 " + op + " failed for " + location + ": " + e.getMessage(), e);
    }

    private static S3Location parse(String location) {
        try {
            return S3Location.parse(location);
        } catch (IllegalArgumentException e) {
            throw new StoreAccessError("Invalid S3 location '" + location + "': " + e.getMessage(), e);
        }
    }
}
