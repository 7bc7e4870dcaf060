package io.github.drompincen.payverify.runtime.verification.ocr;

import io.github.drompincen.payverify.runtime.verification.ExtractionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentContentLoaderTest {

    private final DocumentContentLoader loader = new DocumentContentLoader(Duration.ofSeconds(2));

    @TempDir
    Path tempDir;

    @Test
    void readsPlainPathsAndFileUris() throws IOException {
        Path file = tempDir.resolve("stub.pdf");
        Files.write(file, new byte[]{37, 80, 68, 70});

        assertThat(loader.load(file.toString())).containsExactly(37, 80, 68, 70);
        assertThat(loader.load(file.toUri().toString())).containsExactly(37, 80, 68, 70);
    }

    @Test
    void upperCaseFileSchemeResolvesUnderTurkishLocale() throws IOException {
        Path file = tempDir.resolve("stub.pdf");
        Files.write(file, new byte[]{37, 80, 68, 70});
        String uri = "FILE:" + file.toUri().toString().substring("file:".length());
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(loader.load(uri)).containsExactly(37, 80, 68, 70);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void missingFileIsExtractionFailure() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("gone.png").toString()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Failed to load document");
        assertThatThrownBy(() -> loader.load(" "))
                .isInstanceOf(ExtractionException.class);
    }
}
