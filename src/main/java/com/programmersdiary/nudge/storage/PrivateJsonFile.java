package com.programmersdiary.nudge.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * JSON file readable only by its owner. Writes go to a temp file in the same directory that is
 * then moved over the target, so readers never see a half-written file.
 */
public final class PrivateJsonFile {

    private final Path file;
    private final ObjectMapper objectMapper;

    public PrivateJsonFile(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    public Path path() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    public <T> T read(Class<T> type) throws IOException {
        return objectMapper.readValue(file.toFile(), type);
    }

    public <T> T read(TypeReference<T> type) throws IOException {
        return objectMapper.readValue(file.toFile(), type);
    }

    public void write(Object value) throws IOException {
        var dir = file.getParent();
        createPrivateDirectories(dir);
        var tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), value);
            if (isPosix()) {
                Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rw-------"));
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void createPrivateDirectories(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        if (isPosix()) {
            Files.createDirectories(dir,
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
            Files.createDirectories(dir);
        }
    }

    private static boolean isPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
