package com.poc.xlstaging.dto;

import lombok.NonNull;
import lombok.Value;

/**
 * An uploaded file as received from the caller.
 */
@Value
public class RawUpload {

    @NonNull
    String originalFilename;

    @NonNull
    byte[] content;

    public String getExtension() {
        int dotIndex = originalFilename.lastIndexOf('.');
        return dotIndex == -1 ? "" : originalFilename.substring(dotIndex).toLowerCase(java.util.Locale.ROOT);
    }
}
