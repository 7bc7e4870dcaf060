package io.github.drompincen.payverify.persistence.repository;

import io.github.drompincen.payverify.persistence.document.VerificationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface VerificationRepository extends MongoRepository<VerificationDocument, String> {
    List<VerificationDocument> findByApplicationIdOrderByCreatedAtDesc(String applicationId);
    Optional<VerificationDocument> findTopByApplicationIdOrderByCreatedAtDesc(String applicationId);
    List<VerificationDocument> findByDocumentId(String documentId);
}
