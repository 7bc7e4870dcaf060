package io.github.drompincen.payverify.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Metadata of an uploaded pay document. The bytes live in object storage under
 * {@code storageUri}.
 */
@Document(collection = "uploads")
@CompoundIndex(name = "application_uploaded", def = "{'applicationId': 1, 'uploadedAt': -1}")
public class UploadDocument {

    @Id
    private String uploadId;
    private String applicationId;
    private String userId;
    private String filename;
    private String storageUri;
    private String contentType;
    private long fileSize;
    private Instant uploadedAt;

    public UploadDocument() {}

    public String getUploadId() { return uploadId; }
    public void setUploadId(String uploadId) { this.uploadId = uploadId; }

    public String getApplicationId() { return applicationId; }
    public void setApplicationId(String applicationId) { this.applicationId = applicationId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getStorageUri() { return storageUri; }
    public void setStorageUri(String storageUri) { this.storageUri = storageUri; }

    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }

    public long getFileSize() { return fileSize; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }

    public Instant getUploadedAt() { return uploadedAt; }
    public void setUploadedAt(Instant uploadedAt) { this.uploadedAt = uploadedAt; }
}
