package io.github.drompincen.payverify.runtime.verification.ocr;

import io.github.drompincen.payverify.protocol.api.DocumentRef;
import io.github.drompincen.payverify.runtime.verification.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeType;

import java.util.Locale;

/**
 * Sends the pay document to a multimodal chat model as a single prompt with the
 * document attached as media.
 */
@Service
@ConditionalOnProperty(name = "payverify.ocr.provider", havingValue = "spring-ai", matchIfMissing = true)
public class SpringAiOcrExtractionClient implements OcrExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiOcrExtractionClient.class);

    static final String EXTRACTION_PROMPT = """
            You are a financial document analyst specializing in pay stubs and income statements.
            Analyze this document and return the following information as a single JSON object:

            {
                "employee_name": "Full name of the employee",
                "company_name": "Name of the employer",
                "annual_salary": "Annual salary as a number, calculated if not printed",
                "ssn": "Last 4 digits of the Social Security Number only",
                "pay_period": "Pay frequency (weekly, bi-weekly, semi-monthly, monthly)",
                "gross_pay": "Gross pay for this period",
                "net_pay": "Net pay for this period",
                "deductions": "List of deductions",
                "pay_date": "Pay date in YYYY-MM-DD format",
                "hourly_rate": "Hourly rate if applicable",
                "hours_worked": "Hours worked this period if applicable",
                "year_to_date_gross": "Year-to-date gross pay if available",
                "year_to_date_net": "Year-to-date net pay if available"
            }

            Rules:
            - Amounts are plain numbers without currency symbols or thousands separators.
            - Use null for any field that is missing or unreadable.
            - If several periods are shown, use the most recent one.
            - Return ONLY the JSON object, no explanations.
            """;

    private final ChatModel chatModel;
    private final DocumentContentLoader contentLoader;
    private final String model;

    public SpringAiOcrExtractionClient(ChatModel chatModel,
                                       DocumentContentLoader contentLoader,
                                       @Value("${payverify.ocr.model:gpt-4o}") String model) {
        this.chatModel = chatModel;
        this.contentLoader = contentLoader;
        this.model = model;
    }

    @Override
    public String extract(DocumentRef document) {
        byte[] content = contentLoader.load(document.storageUri());
        MimeType mimeType = mimeTypeFor(document.filename() != null ? document.filename() : document.storageUri());
        log.info("Extracting data from document {} ({}, {} bytes) with model {}",
                document.documentId(), mimeType, content.length, model);

        UserMessage message = UserMessage.builder()
                .text(EXTRACTION_PROMPT)
                .media(Media.builder().mimeType(mimeType).data(content).build())
                .build();
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .temperature(0.0)
                .build();

        ChatResponse response = chatModel.call(new Prompt(message, options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ExtractionException("Model returned no output for document " + document.documentId());
        }
        String text = response.getResult().getOutput().getText();
        return text != null ? text.strip() : "";
    }

    @Override
    public String modelName() {
        return model;
    }

    static MimeType mimeTypeFor(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        if (query >= 0) lower = lower.substring(0, query);
        if (lower.endsWith(".pdf")) return MimeType.valueOf("application/pdf");
        if (lower.endsWith(".png")) return MimeType.valueOf("image/png");
        return MimeType.valueOf("image/jpeg");
    }
}
