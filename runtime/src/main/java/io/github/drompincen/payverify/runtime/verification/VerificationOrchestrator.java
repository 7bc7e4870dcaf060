package io.github.drompincen.payverify.runtime.verification;

import io.github.drompincen.payverify.persistence.document.ApplicationDocument;
import io.github.drompincen.payverify.persistence.document.UploadDocument;
import io.github.drompincen.payverify.persistence.repository.ApplicationRepository;
import io.github.drompincen.payverify.persistence.repository.UploadRepository;
import io.github.drompincen.payverify.protocol.api.ApplicationRecord;
import io.github.drompincen.payverify.protocol.api.DocumentRef;
import io.github.drompincen.payverify.protocol.api.ExtractedRecord;
import io.github.drompincen.payverify.protocol.api.OverallStatus;
import io.github.drompincen.payverify.protocol.api.VerificationVerdict;
import io.github.drompincen.payverify.protocol.event.ProgressEvent;
import io.github.drompincen.payverify.protocol.event.ProgressStep;
import io.github.drompincen.payverify.protocol.event.RunState;
import io.github.drompincen.payverify.protocol.event.VerificationCompleted;
import io.github.drompincen.payverify.runtime.verification.ocr.OcrExtractionClient;
import io.github.drompincen.payverify.runtime.verification.retry.RetryingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one verification run: resolve the application and document, extract
 * the pay stub through the OCR client under the retry policy, compare, and
 * store the verdict. Runs share no state; each call builds its own pipeline.
 */
@Service
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    private final ApplicationRepository applicationRepository;
    private final UploadRepository uploadRepository;
    private final OcrExtractionClient ocrClient;
    private final RetryingExecutor retryingExecutor;
    private final RawExtractionParser parser;
    private final FieldNormalizer normalizer;
    private final VerificationEngine engine;
    private final VerdictStore verdictStore;
    private final Scheduler blockingScheduler = Schedulers.boundedElastic();

    public VerificationOrchestrator(ApplicationRepository applicationRepository,
                                    UploadRepository uploadRepository,
                                    OcrExtractionClient ocrClient,
                                    RetryingExecutor retryingExecutor,
                                    RawExtractionParser parser,
                                    FieldNormalizer normalizer,
                                    VerificationEngine engine,
                                    VerdictStore verdictStore) {
        this.applicationRepository = applicationRepository;
        this.uploadRepository = uploadRepository;
        this.ocrClient = ocrClient;
        this.retryingExecutor = retryingExecutor;
        this.parser = parser;
        this.normalizer = normalizer;
        this.engine = engine;
        this.verdictStore = verdictStore;
    }

    public VerificationVerdict evaluate(ApplicationRecord application, ExtractedRecord extracted) {
        return engine.evaluate(application, extracted);
    }

    /**
     * Runs a verification and stores its verdict. Extraction failures end in an
     * {@code ERROR} verdict; only storage failures are signalled as errors.
     */
    public Mono<VerificationVerdict> verify(String applicationId, String documentId) {
        return Mono.fromCallable(() -> resolve(applicationId, documentId))
                .subscribeOn(blockingScheduler)
                .flatMap(target -> {
                    RunTracker run = new RunTracker(target);
                    return extract(target, run)
                            .map(extracted -> new Outcome(compare(target, extracted, run), extracted))
                            .onErrorResume(ExtractionException.class, e -> {
                                run.advance(RunState.ERROR);
                                log.error("Verification of application {} document {} failed: {}",
                                        target.applicationId(), target.document().documentId(), e.getMessage());
                                return Mono.just(new Outcome(
                                        VerificationVerdict.error("OCR extraction failed: " + e.getMessage()),
                                        ExtractedRecord.unknown()));
                            })
                            .flatMap(outcome -> store(target, outcome).thenReturn(outcome.verdict()));
                });
    }

    /**
     * Same run as {@link #verify} reported as ordered progress events. A failure
     * at any step emits a single {@code error} event and completes the stream.
     * Cancelling the subscription abandons the extraction and any pending retry.
     */
    public Flux<ProgressEvent> verifyWithProgress(String applicationId, String documentId) {
        return Flux.defer(() -> {
            AtomicLong seq = new AtomicLong();
            return Mono.fromCallable(() -> resolve(applicationId, documentId))
                    .subscribeOn(blockingScheduler)
                    .flatMapMany(target -> progressFor(target, seq))
                    .onErrorResume(e -> {
                        String message;
                        if (e instanceof NotFoundException) {
                            message = e.getMessage();
                        } else if (e instanceof PersistenceException) {
                            message = "Verification completed but could not be stored: " + e.getMessage();
                        } else {
                            message = "Verification failed: " + e.getMessage();
                        }
                        log.error("Verification stream for application {} failed: {}", applicationId, e.getMessage());
                        return Mono.just(ProgressEvent.error(seq.incrementAndGet(), message));
                    });
        });
    }

    private Flux<ProgressEvent> progressFor(Target target, AtomicLong seq) {
        RunTracker run = new RunTracker(target);
        Flux<ProgressEvent> preamble = Flux.concat(
                event(seq, ProgressStep.STARTING, null),
                event(seq, ProgressStep.DOWNLOADING, null),
                event(seq, ProgressStep.EXTRACTING, null));

        Flux<ProgressEvent> rest = extract(target, run)
                .flatMapMany(extracted -> {
                    VerificationVerdict verdict = compare(target, extracted, run);
                    return Flux.concat(
                            event(seq, ProgressStep.EXTRACTED, extracted.asMap()),
                            event(seq, ProgressStep.VERIFYING_NAME, null),
                            event(seq, ProgressStep.VERIFYING_SALARY, null),
                            event(seq, ProgressStep.VERIFYING_EMPLOYER, null),
                            event(seq, ProgressStep.FINALIZING, null),
                            store(target, new Outcome(verdict, extracted))
                                    .map(id -> ProgressEvent.of(seq.incrementAndGet(), ProgressStep.COMPLETE,
                                            new VerificationCompleted(id, verdict))));
                })
                .onErrorResume(ExtractionException.class, e -> {
                    run.advance(RunState.ERROR);
                    String message = "OCR extraction failed: " + e.getMessage();
                    return store(target, new Outcome(VerificationVerdict.error(message), ExtractedRecord.unknown()))
                            .map(id -> message)
                            .onErrorResume(PersistenceException.class, pe -> {
                                log.error("Could not store error verdict for {}: {}", run.runKey, pe.getMessage());
                                return Mono.just(message + " (error verdict not stored: " + pe.getMessage() + ")");
                            })
                            .map(text -> ProgressEvent.error(seq.incrementAndGet(), text));
                });

        return Flux.concat(preamble, rest);
    }

    private static Mono<ProgressEvent> event(AtomicLong seq, ProgressStep step, Object payload) {
        return Mono.fromSupplier(() -> ProgressEvent.of(seq.incrementAndGet(), step, payload));
    }

    private Mono<ExtractedRecord> extract(Target target, RunTracker run) {
        DocumentRef document = target.document();
        return Mono.defer(() -> {
            run.advance(RunState.EXTRACTING);
            log.info("Extracting document {} for application {} with {}",
                    document.documentId(), target.applicationId(), ocrClient.modelName());
            return retryingExecutor.execute("process document", () -> {
                String reply = ocrClient.extract(document);
                if (reply == null || reply.isBlank()) {
                    throw new ExtractionException("Empty response from OCR model");
                }
                return reply;
            });
        }).map(parser::parse).map(normalizer::normalize);
    }

    private VerificationVerdict compare(Target target, ExtractedRecord extracted, RunTracker run) {
        run.advance(RunState.COMPARING);
        VerificationVerdict verdict = engine.evaluate(target.application(), extracted);
        run.advance(verdict.overallStatus() == OverallStatus.VERIFIED ? RunState.VERIFIED : RunState.MISMATCH);
        log.info("Application {} document {}: {}", target.applicationId(),
                target.document().documentId(), verdict.summary());
        return verdict;
    }

    private Mono<String> store(Target target, Outcome outcome) {
        return Mono.fromCallable(() -> verdictStore.save(target.applicationId(),
                        target.document().documentId(), outcome.verdict(), outcome.extracted()).verificationId())
                .subscribeOn(blockingScheduler);
    }

    private Target resolve(String applicationId, String documentId) {
        ApplicationDocument application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> new NotFoundException("Application not found: " + applicationId));
        UploadDocument upload;
        if (documentId == null || documentId.isBlank()) {
            upload = uploadRepository.findTopByApplicationIdOrderByUploadedAtDesc(applicationId)
                    .orElseThrow(() -> new NotFoundException("No documents found for verification"));
        } else {
            upload = uploadRepository.findById(documentId)
                    .filter(u -> applicationId.equals(u.getApplicationId()))
                    .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));
        }
        return new Target(applicationId, toRecord(application), toRef(upload));
    }

    static ApplicationRecord toRecord(ApplicationDocument doc) {
        return new ApplicationRecord(doc.getName(), doc.getAnnualSalary(), doc.getEmployerName(), doc.getSsn());
    }

    static DocumentRef toRef(UploadDocument doc) {
        return new DocumentRef(doc.getUploadId(), doc.getFilename(), doc.getStorageUri(), doc.getContentType());
    }

    private record Target(String applicationId, ApplicationRecord application, DocumentRef document) {}

    private record Outcome(VerificationVerdict verdict, ExtractedRecord extracted) {}

    /** Per-run lifecycle, logged at debug. */
    private static final class RunTracker {
        private final String runKey;
        private RunState state = RunState.PENDING;

        RunTracker(Target target) {
            this.runKey = target.applicationId() + "/" + target.document().documentId();
        }

        void advance(RunState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal run transition " + state + " -> " + next);
            }
            log.debug("Run {}: {} -> {}", runKey, state, next);
            state = next;
        }
    }
}
