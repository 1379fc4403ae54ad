package com.llmfactory.common.store;

import com.llmfactory.common.errors.StoreAccessError;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link ObjectStore} over the local filesystem. Handles every location that
 * is not an {@code s3://} URI.
 */
public class LocalObjectStore implements ObjectStore {

    @Override
    public boolean supports(String location) {
        return location != null && !StoreLocations.isS3(location);
    }

    @Override
    public boolean isDirectory(String location) {
        return Files.isDirectory(path(location));
    }

    @Override
    public List<String> list(String location, Set<String> extensions) {
        Path dir = path(location);
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .filter(Files::isRegularFile)
                    .map(Path::toString)
                    .filter(p -> StoreLocations.hasExtension(p, extensions))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StoreAccessError("Failed to list directory " + location + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] read(String location) {
        try {
            return Files.readAllBytes(path(location));
        } catch (IOException e) {
            throw new StoreAccessError("Failed to read " + location + ": " + e.getMessage(), e);
        }
    }

    private static Path path(String location) {
        try {
            return Path.of(location);
        } catch (InvalidPathException e) {
            throw new StoreAccessError("Invalid local path '" + location + "': " + e.getMessage(), e);
        }
    }
}
