package io.github.drompincen.payverify.persistence.repository;

import io.github.drompincen.payverify.persistence.document.ApplicationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ApplicationRepository extends MongoRepository<ApplicationDocument, String> {
    List<ApplicationDocument> findByUserIdOrderByCreatedAtDesc(String userId);
}
