package io.github.drompincen.payverify.persistence.repository;

import io.github.drompincen.payverify.persistence.document.UploadDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface UploadRepository extends MongoRepository<UploadDocument, String> {
    List<UploadDocument> findByApplicationIdOrderByUploadedAtDesc(String applicationId);
    Optional<UploadDocument> findTopByApplicationIdOrderByUploadedAtDesc(String applicationId);
}
