package com.cfamily.astexport.writer;

/**
 * Wire encodings the exporter can produce.
 */
public enum OutputFormat {
    JSON("json"),
    CBOR("cbor");

    private final String fileExtension;

    OutputFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }
}
