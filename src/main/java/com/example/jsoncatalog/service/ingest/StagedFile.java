package com.example.jsoncatalog.service.ingest;

import java.nio.file.Path;

/**
 * A file already written to the staging area by the upload handler.
 *
 * @param originalFilename name sent by the client, used for the dataset name and format detection
 */
public record StagedFile(Path filePath, String originalFilename, long size) {
}
