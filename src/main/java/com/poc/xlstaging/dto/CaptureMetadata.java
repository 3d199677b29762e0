package com.poc.xlstaging.dto;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Audit facts recorded when an upload is staged.
 */
@Value
public class CaptureMetadata {
    LocalDateTime capturedAt;
    long sizeBytes;
    String sha256;
}
