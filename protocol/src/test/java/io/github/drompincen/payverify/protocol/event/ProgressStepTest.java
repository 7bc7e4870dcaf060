package io.github.drompincen.payverify.protocol.event;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressStepTest {

    @Test
    void stepsAreDeclaredInEmissionOrderWithFixedPercentages() {
        List<String> names = Arrays.stream(ProgressStep.values())
                .filter(s -> s != ProgressStep.ERROR)
                .map(ProgressStep::stepName)
                .toList();
        List<Integer> percents = Arrays.stream(ProgressStep.values())
                .filter(s -> s != ProgressStep.ERROR)
                .map(ProgressStep::progressPercent)
                .toList();

        assertThat(names).containsExactly("starting", "downloading", "extracting", "extracted",
                "verifying_name", "verifying_salary", "verifying_employer", "finalizing", "complete");
        assertThat(percents).containsExactly(0, 20, 40, 60, 70, 80, 90, 95, 100);
    }

    @Test
    void errorEventCarriesMessageAndFlag() {
        ProgressEvent event = ProgressEvent.error(3, "OCR extraction failed: timeout");

        assertThat(event.step()).isEqualTo("error");
        assertThat(event.progressPercent()).isZero();
        assertThat(event.error()).isTrue();
        assertThat(event.message()).isEqualTo("OCR extraction failed: timeout");
        assertThat(event.seq()).isEqualTo(3);
    }

    @Test
    void regularEventUsesDefaultMessage() {
        ProgressEvent event = ProgressEvent.of(1, ProgressStep.STARTING);

        assertThat(event.step()).isEqualTo("starting");
        assertThat(event.message()).isEqualTo("Starting verification process...");
        assertThat(event.error()).isFalse();
        assertThat(event.payload()).isNull();
    }
}
