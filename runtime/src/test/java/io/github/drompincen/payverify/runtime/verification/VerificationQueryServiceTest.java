package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.persistence.document.ApplicationDocument;
import io.github.drompincen.payverify.persistence.document.VerificationDocument;
import io.github.drompincen.payverify.persistence.repository.ApplicationRepository;
import io.github.drompincen.payverify.persistence.repository.VerificationRepository;
import io.github.drompincen.payverify.protocol.api.FieldName;
import io.github.drompincen.payverify.protocol.api.FieldVerdict;
import io.github.drompincen.payverify.protocol.api.OverallStatus;
import io.github.drompincen.payverify.protocol.api.VerificationStats;
import io.github.drompincen.payverify.protocol.api.VerificationStatusResponse;
import io.github.drompincen.payverify.protocol.api.VerificationSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VerificationQueryServiceTest {

    @Mock private ApplicationRepository applicationRepository;
    @Mock private VerificationRepository verificationRepository;

    private VerificationQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new VerificationQueryService(applicationRepository, verificationRepository);
        when(applicationRepository.existsById("app-1")).thenReturn(true);
    }

    @Test
    void unknownApplicationIsRejected() {
        when(applicationRepository.existsById("nope")).thenReturn(false);

        assertThatThrownBy(() -> queryService.status("nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("Application not found");
    }

    @Test
    void statusWithoutVerificationsIsNoDocuments() {
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("app-1")).thenReturn(Optional.empty());

        VerificationStatusResponse status = queryService.status("app-1");

        assertThat(status.status()).isEqualTo("no_documents");
        assertThat(status.message()).isEqualTo("No documents uploaded for verification");
        assertThat(status.lastUpdated()).isNull();
    }

    @Test
    void statusReflectsLatestVerdict() {
        Instant at = Instant.parse("2024-04-01T10:00:00Z");
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("app-1"))
                .thenReturn(Optional.of(verification("app-1", OverallStatus.MISMATCH, 2, at)));

        VerificationStatusResponse status = queryService.status("app-1");

        assertThat(status.status()).isEqualTo("mismatch");
        assertThat(status.message()).isEqualTo("Verification mismatch");
        assertThat(status.lastUpdated()).isEqualTo(at);
    }

    @Test
    void latestSummaryCountsFields() {
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("app-1"))
                .thenReturn(Optional.of(verification("app-1", OverallStatus.MISMATCH, 3, Instant.now())));

        Optional<VerificationSummary> summary = queryService.latestSummary("app-1");

        assertThat(summary).hasValueSatisfying(s -> {
            assertThat(s.totalFields()).isEqualTo(4);
            assertThat(s.matchedFields()).isEqualTo(3);
            assertThat(s.mismatchedFields()).isEqualTo(1);
            assertThat(s.overallStatus()).isEqualTo(OverallStatus.MISMATCH);
        });
    }

    @Test
    void listReturnsRepositoryOrder() {
        Instant newer = Instant.parse("2024-04-02T00:00:00Z");
        Instant older = Instant.parse("2024-04-01T00:00:00Z");
        when(verificationRepository.findByApplicationIdOrderByCreatedAtDesc("app-1")).thenReturn(List.of(
                verification("app-1", OverallStatus.VERIFIED, 4, newer),
                verification("app-1", OverallStatus.MISMATCH, 1, older)));

        assertThat(queryService.listForApplication("app-1"))
                .extracting(dto -> dto.createdAt())
                .containsExactly(newer, older);
    }

    @Test
    void globalStatsUseLatestStatusPerApplication() {
        when(applicationRepository.findAll()).thenReturn(List.of(
                application("a1"), application("a2"), application("a3"), application("a4")));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("a1"))
                .thenReturn(Optional.of(verification("a1", OverallStatus.VERIFIED, 4, Instant.now())));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("a2"))
                .thenReturn(Optional.of(verification("a2", OverallStatus.MISMATCH, 2, Instant.now())));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("a3"))
                .thenReturn(Optional.of(verification("a3", OverallStatus.ERROR, 0, Instant.now())));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("a4")).thenReturn(Optional.empty());

        VerificationStats stats = queryService.globalStats();

        assertThat(stats).isEqualTo(new VerificationStats(4, 1, 1, 1, 1, 25.0));
    }

    @Test
    void verifiedRateRoundsToOneDecimal() {
        when(applicationRepository.findAll()).thenReturn(List.of(application("a1"), application("a2"), application("a3")));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc("a1"))
                .thenReturn(Optional.of(verification("a1", OverallStatus.VERIFIED, 4, Instant.now())));
        when(verificationRepository.findTopByApplicationIdOrderByCreatedAtDesc(argThat(id -> !"a1".equals(id))))
                .thenReturn(Optional.empty());

        assertThat(queryService.globalStats().verificationRate()).isEqualTo(33.3);
        when(applicationRepository.findAll()).thenReturn(List.of());
        assertThat(queryService.globalStats().verificationRate()).isZero();
    }

    private static ApplicationDocument application(String id) {
        ApplicationDocument doc = new ApplicationDocument();
        doc.setApplicationId(id);
        return doc;
    }

    private static VerificationDocument verification(String appId, OverallStatus status, int matched, Instant at) {
        VerificationDocument doc = new VerificationDocument();
        doc.setVerificationId(appId + "-" + at.toEpochMilli());
        doc.setApplicationId(appId);
        doc.setDocumentId("doc-1");
        doc.setOverallStatus(status);
        if (status != OverallStatus.ERROR) {
            FieldName[] fields = FieldName.values();
            List<FieldVerdict> verdicts = new ArrayList<>();
            for (int i = 0; i < fields.length; i++) {
                verdicts.add(new FieldVerdict(fields[i], i < matched, "r", null));
            }
            doc.setFieldVerdicts(verdicts);
        }
        doc.setScorePercent(matched * 25.0);
        doc.setSummary(status.label());
        doc.setExtractedData(Map.of());
        doc.setCreatedAt(at);
        return doc;
    }
}
