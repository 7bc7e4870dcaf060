package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.persistence.document.VerificationDocument;
import io.github.drompincen.payverify.persistence.repository.VerificationRepository;
import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import io.github.drompincen.payverify.protocol.api.VerificationDto;
import io.github.drompincen.payverify.protocol.api.VerificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

@Service
public class VerdictStore {

    private static final Logger log = LoggerFactory.getLogger(VerdictStore.class);

    private final VerificationRepository verificationRepository;

    public VerdictStore(VerificationRepository verificationRepository) {
        this.verificationRepository = verificationRepository;
    }

    public VerificationDto save(String applicationId, String documentId,
                                VerificationVerdict verdict, ExtractedRecord extracted) {
        VerificationDocument doc = new VerificationDocument();
        doc.setVerificationId(UUID.randomUUID().toString());
        doc.setApplicationId(applicationId);
        doc.setDocumentId(documentId);
        doc.setExtractedData(extracted.asMap());
        doc.setFieldVerdicts(verdict.fieldVerdicts());
        doc.setOverallStatus(verdict.overallStatus());
        doc.setScorePercent(verdict.scorePercent());
        doc.setSummary(verdict.summary());
        doc.setCreatedAt(Instant.now());
        try {
            VerificationDocument saved = verificationRepository.save(doc);
            log.info("Stored verification {} for application {} document {}: {}",
                    saved.getVerificationId(), applicationId, documentId, verdict.overallStatus().label());
            return toDto(saved);
        } catch (DataAccessException e) {
            log.error("Failed to store verification for application {} document {}", applicationId, documentId, e);
            throw new PersistenceException("Failed to store verification result: " + e.getMessage(), e);
        }
    }

    static VerificationDto toDto(VerificationDocument doc) {
        VerificationVerdict verdict = new VerificationVerdict(doc.getFieldVerdicts(), doc.getOverallStatus(),
                doc.getScorePercent(), doc.getSummary());
        return new VerificationDto(doc.getVerificationId(), doc.getApplicationId(), doc.getDocumentId(),
                doc.getExtractedData(), verdict, doc.getCreatedAt());
    }
}
