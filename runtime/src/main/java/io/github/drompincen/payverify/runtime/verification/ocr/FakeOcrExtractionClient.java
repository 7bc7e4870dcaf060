package io.github.drompincen.payverify.runtime.verification.ocr;

import io.github.drompincen.payverify.protocol.api.DocumentRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Canned OCR replies for running without an API key.
 *
 * Activate with: PAYVERIFY_OCR_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "payverify.ocr.provider", havingValue = "fake")
public class FakeOcrExtractionClient implements OcrExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(FakeOcrExtractionClient.class);

    static final String CANNED_REPLY = """
            ```json
            {
              "employee_name": "Maria Garcia",
              "company_name": "Global Tech Solutions Inc.",
              "pay_period": "Monthly",
              "gross_pay": "$7,000.00",
              "net_pay": "5,210.40",
              "ssn": "XXX-XX-6789",
              "pay_date": "2024-03-31",
              "deductions": "Federal Tax, State Tax, Medicare",
              "year_to_date_gross": "21000"
            }
            ```
            """;

    @Override
    public String extract(DocumentRef document) {
        log.debug("[FAKE OCR] document={}, filename={}", document.documentId(), document.filename());
        return CANNED_REPLY;
    }

    @Override
    public String modelName() {
        return "fake";
    }
}
