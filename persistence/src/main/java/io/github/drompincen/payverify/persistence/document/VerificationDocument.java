package io.github.drompincen.payverify.persistence.document;

import io.github.drompincen.payverify.protocol.api.FieldVerdict;
import io.github.drompincen.payverify.protocol.api.OverallStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Document(collection = "verifications")
@CompoundIndex(name = "application_document_created",
        def = "{'applicationId': 1, 'documentId': 1, 'createdAt': 1}", unique = true)
public class VerificationDocument {

    @Id
    private String verificationId;
    @Indexed
    private String applicationId;
    @Indexed
    private String documentId;
    private Map<String, Object> extractedData;
    private List<FieldVerdict> fieldVerdicts;
    private OverallStatus overallStatus;
    private double scorePercent;
    private String summary;
    private Instant createdAt;

    public VerificationDocument() {}

    public String getVerificationId() { return verificationId; }
    public void setVerificationId(String verificationId) { this.verificationId = verificationId; }

    public String getApplicationId() { return applicationId; }
    public void setApplicationId(String applicationId) { this.applicationId = applicationId; }

    public String getDocumentId() { return documentId; }
    public void setDocumentId(String documentId) { this.documentId = documentId; }

    public Map<String, Object> getExtractedData() { return extractedData; }
    public void setExtractedData(Map<String, Object> extractedData) { this.extractedData = extractedData; }

    public List<FieldVerdict> getFieldVerdicts() { return fieldVerdicts; }
    public void setFieldVerdicts(List<FieldVerdict> fieldVerdicts) { this.fieldVerdicts = fieldVerdicts; }

    public OverallStatus getOverallStatus() { return overallStatus; }
    public void setOverallStatus(OverallStatus overallStatus) { this.overallStatus = overallStatus; }

    public double getScorePercent() { return scorePercent; }
    public void setScorePercent(double scorePercent) { this.scorePercent = scorePercent; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
