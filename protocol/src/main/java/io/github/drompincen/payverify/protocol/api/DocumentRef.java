package io.github.drompincen.payverify.protocol.api;

public record DocumentRef(
        String documentId,
        String filename,
        String storageUri,
        String contentType
) {}
