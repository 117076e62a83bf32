package com.carbondna.api.quality;

import com.carbondna.api.LedgerIntegrationTestSupport;
import com.carbondna.api.chain.ChainBuilder;
import com.carbondna.api.chain.RecordNotFoundException;
import com.carbondna.api.verification.VerificationService;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.RecordAnnotation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class RecordAnnotationServiceIntegrationTest extends LedgerIntegrationTestSupport {

    @Autowired
    private ChainBuilder chainBuilder;

    @Autowired
    private RecordAnnotationService annotationService;

    @Autowired
    private VerificationService verificationService;

    @Test
    void rescoring_replacesAnnotationWithoutTouchingTheRecord() {
        LedgerRecord record = chainBuilder.append("org-1", payload("emissions", 100, "uncertainty_pct", 10));
        assertThat(annotationService.getAnnotation(record.getId()).text("uncertainty_pct")).contains("10");

        annotationService.annotate(record.getId(), Map.of(
                "data_quality_score", 0.9,
                "quality_flags", List.of("supplier-verified")));

        var annotation = annotationService.getAnnotation(record.getId());
        assertThat(annotation.keys()).containsExactly("data_quality_score", "quality_flags.0");
        assertThat(annotationRepository.findById(record.getId()).orElseThrow().getVersion()).isEqualTo(1L);

        LedgerRecord reloaded = chainBuilder.getRecord(record.getId());
        assertThat(reloaded.getRecordHash()).isEqualTo(record.getRecordHash());
        assertThat(verificationService.verifyRecord(record.getId()).ok()).isTrue();
    }

    @Test
    void recordWithoutAnnotation_canBeAnnotated() {
        LedgerRecord record = chainBuilder.append("org-1", payload("emissions", 100));
        assertThat(annotationService.getAnnotation(record.getId()).isEmpty()).isTrue();

        annotationService.annotate(record.getId(), Map.of("verification_status", "pending"));

        assertThat(annotationService.getAnnotation(record.getId()).text("verification_status")).contains("pending");
    }

    @Test
    void nonAnnotationFields_areRejected() {
        LedgerRecord record = chainBuilder.append("org-1", payload("emissions", 100));

        assertThatThrownBy(() -> annotationService.annotate(record.getId(), Map.of("emissions", 5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("emissions");
        assertThatThrownBy(() -> annotationService.annotate(record.getId(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void oversizedAnnotation_isRejectedBeforeAnythingIsWritten() {
        List<String> flags = oversizedFlags();

        assertThatThrownBy(() -> chainBuilder.append("org-1", payload("emissions", 100, "quality_flags", flags)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(String.valueOf(RecordAnnotation.MAX_ATTRIBUTES_LENGTH));
        assertThat(recordRepository.count()).isZero();
        assertThat(chainHeadRepository.count()).isZero();

        LedgerRecord record = chainBuilder.append("org-1", payload("emissions", 100, "uncertainty_pct", 10));
        assertThatThrownBy(() -> annotationService.annotate(record.getId(), Map.of("quality_flags", flags)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(annotationService.getAnnotation(record.getId()).keys()).containsExactly("uncertainty_pct");
    }

    private static List<String> oversizedFlags() {
        List<String> flags = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            flags.add("flag-" + i + "-" + "x".repeat(100));
        }
        return flags;
    }

    @Test
    void unknownRecord_fails() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> annotationService.annotate(missing, Map.of("uncertainty_pct", 1)))
                .isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> annotationService.getAnnotation(missing))
                .isInstanceOf(RecordNotFoundException.class);
    }
}
