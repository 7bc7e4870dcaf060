package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.persistence.document.ApplicationDocument;
import io.github.drompincen.payverify.persistence.document.VerificationDocument;
import io.github.drompincen.payverify.persistence.repository.ApplicationRepository;
import io.github.drompincen.payverify.persistence.repository.VerificationRepository;
import io.github.drompincen.payverify.protocol.api.OverallStatus;
import io.github.drompincen.payverify.protocol.api.VerificationDto;
import io.github.drompincen.payverify.protocol.api.VerificationStats;
import io.github.drompincen.payverify.protocol.api.VerificationStatusResponse;
import io.github.drompincen.payverify.protocol.api.VerificationSummary;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side over stored verdicts. The latest verdict of an application decides
 * its current status.
 */
@Service
public class VerificationQueryService {

    private final ApplicationRepository applicationRepository;
    private final VerificationRepository verificationRepository;

    public VerificationQueryService(ApplicationRepository applicationRepository,
                                    VerificationRepository verificationRepository) {
        this.applicationRepository = applicationRepository;
        this.verificationRepository = verificationRepository;
    }

    public List<VerificationDto> listForApplication(String applicationId) {
        requireApplication(applicationId);
        return verificationRepository.findByApplicationIdOrderByCreatedAtDesc(applicationId).stream()
                .map(VerdictStore::toDto)
                .collect(Collectors.toList());
    }

    public Optional<VerificationSummary> latestSummary(String applicationId) {
        requireApplication(applicationId);
        return verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc(applicationId)
                .map(VerdictStore::toDto)
                .map(dto -> {
                    int matched = (int) dto.verdict().matchedCount();
                    int total = VerdictAggregator.TOTAL_FIELDS;
                    return new VerificationSummary(applicationId, dto.verdict().overallStatus(),
                            total, matched, total - matched, dto);
                });
    }

    public VerificationStatusResponse status(String applicationId) {
        requireApplication(applicationId);
        return verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc(applicationId)
                .map(doc -> new VerificationStatusResponse(doc.getOverallStatus().label(),
                        "Verification " + doc.getOverallStatus().label(), doc.getCreatedAt()))
                .orElseGet(VerificationStatusResponse::noDocuments);
    }

    public VerificationStats globalStats() {
        List<ApplicationDocument> applications = applicationRepository.findAll();
        Map<OverallStatus, Integer> counts = new EnumMap<>(OverallStatus.class);
        int noDocuments = 0;
        for (ApplicationDocument app : applications) {
            Optional<OverallStatus> latest = verificationRepository
                    .findTopByApplicationIdOrderByCreatedAtDesc(app.getApplicationId())
                    .map(VerificationDocument::getOverallStatus);
            if (latest.isPresent()) {
                counts.merge(latest.get(), 1, Integer::sum);
            } else {
                noDocuments++;
            }
        }
        int total = applications.size();
        int verified = counts.getOrDefault(OverallStatus.VERIFIED, 0);
        double rate = total == 0 ? 0.0 : Math.round(verified * 1000.0 / total) / 10.0;
        return new VerificationStats(total, verified,
                counts.getOrDefault(OverallStatus.MISMATCH, 0),
                counts.getOrDefault(OverallStatus.ERROR, 0),
                noDocuments, rate);
    }

    private void requireApplication(String applicationId) {
        if (!applicationRepository.existsById(applicationId)) {
            throw new NotFoundException("Application not found: " + applicationId);
        }
    }
}
