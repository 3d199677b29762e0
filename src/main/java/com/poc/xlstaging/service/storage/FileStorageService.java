package com.poc.xlstaging.service.storage;

import java.io.IOException;

public interface FileStorageService {
    /**
     * Saves byte content to the storage system, replacing any existing file.
     * @param content The file data.
     * @param fileName The desired filename, relative to the storage root.
     * @return The path where the file is stored.
     */
    String saveFile(byte[] content, String fileName) throws IOException;

    /**
     * Loads a file from storage.
     * @param fileName The name of the file to load.
     * @return The file data as a byte array.
     */
    byte[] loadFile(String fileName) throws IOException;

    boolean exists(String fileName);

    /**
     * @return true when a file was removed
     */
    boolean deleteFile(String fileName) throws IOException;

    /**
     * Moves a stored file, replacing the target if present.
     * @return The new path of the file.
     */
    String moveFile(String fromFileName, String toFileName) throws IOException;
}
