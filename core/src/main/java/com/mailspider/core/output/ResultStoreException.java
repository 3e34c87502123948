package com.mailspider.core.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** 결과 파일 읽기/쓰기 실패 */
public class ResultStoreException extends UncheckedIOException {
    private final Path file;

    public ResultStoreException(String message, Path file, IOException cause) {
        super(message + ": " + file + " (" + cause.getMessage() + ")", cause);
        this.file = file;
    }

    public Path getFile() { return file; }
}
