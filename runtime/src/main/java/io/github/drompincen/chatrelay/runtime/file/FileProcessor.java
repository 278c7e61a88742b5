package io.github.drompincen.chatrelay.runtime.file;

public interface FileProcessor {

    ProcessedFile process(String name, byte[] content) throws FileProcessingException;
}
