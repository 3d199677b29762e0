package com.poc.xlstaging.service.storage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

@Service
public class LocalFileStorageService implements FileStorageService {

    private final Path root;

    public LocalFileStorageService(@Value("${xl.storage.path:./output/}") String storagePath) {
        this.root = Paths.get(storagePath).toAbsolutePath().normalize();
    }

    @Override
    public String saveFile(byte[] content, String fileName) throws IOException {
        Path path = resolve(fileName);
        createParent(path);
        Files.write(path, content);
        return path.toString();
    }

    @Override
    public byte[] loadFile(String fileName) throws IOException {
        return Files.readAllBytes(resolve(fileName));
    }

    @Override
    public boolean exists(String fileName) {
        return Files.exists(resolve(fileName));
    }

    @Override
    public boolean deleteFile(String fileName) throws IOException {
        return Files.deleteIfExists(resolve(fileName));
    }

    @Override
    public String moveFile(String fromFileName, String toFileName) throws IOException {
        Path target = resolve(toFileName);
        createParent(target);
        Files.move(resolve(fromFileName), target, StandardCopyOption.REPLACE_EXISTING);
        return target.toString();
    }

    private Path resolve(String fileName) {
        Path path = root.resolve(fileName).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("File name escapes the storage root: " + fileName);
        }
        return path;
    }

    private static void createParent(Path path) throws IOException {
        if (!Files.exists(path.getParent())) {
            Files.createDirectories(path.getParent());
        }
    }
}
