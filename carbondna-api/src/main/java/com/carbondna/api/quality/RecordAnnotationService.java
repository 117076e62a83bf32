package com.carbondna.api.quality;

import com.carbondna.api.canonical.Canonicalizer;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.chain.RecordNotFoundException;
import com.carbondna.api.config.LedgerProperties;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.RecordAnnotation;
import com.carbondna.core.repository.LedgerRecordRepository;
import com.carbondna.core.repository.RecordAnnotationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Quality metadata (uncertainty, data-quality score, flags, verification
 * status) stored beside a record. Rescoring replaces the annotation and never
 * touches the record or its hash.
 */
@Service
public class RecordAnnotationService {

    private static final Logger log = LoggerFactory.getLogger(RecordAnnotationService.class);

    private final RecordAnnotationRepository annotationRepository;
    private final LedgerRecordRepository recordRepository;
    private final Canonicalizer canonicalizer;
    private final LedgerProperties properties;
    private final Clock clock;

    public RecordAnnotationService(
            RecordAnnotationRepository annotationRepository,
            LedgerRecordRepository recordRepository,
            Canonicalizer canonicalizer,
            LedgerProperties properties,
            Clock clock) {
        this.annotationRepository = annotationRepository;
        this.recordRepository = recordRepository;
        this.canonicalizer = canonicalizer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Replaces the annotation of a record.
     *
     * @throws IllegalArgumentException if an attribute is not a configured annotation field
     */
    @Transactional
    public FieldMap annotate(UUID recordId, Map<String, ?> attributes) {
        LedgerRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId));
        FieldMap fields = FieldMap.of(attributes);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Annotation must contain at least one attribute");
        }

        Set<String> allowed = properties.annotationFieldSet();
        FieldMap.Split split = fields.split(allowed);
        if (!split.remaining().isEmpty()) {
            throw new IllegalArgumentException("Not annotation fields: " + split.remaining().keys()
                    + " (allowed: " + allowed + ")");
        }

        String json = canonicalizer.canonicalJson(fields);
        RecordAnnotation annotation = annotationRepository.findById(recordId)
                .map(existing -> {
                    existing.replace(json, clock.instant());
                    return existing;
                })
                .orElseGet(() -> RecordAnnotation.create(recordId, record.getPartitionId(), json, clock.instant()));
        annotationRepository.save(annotation);

        log.info("Annotation of record {} replaced: {}", recordId, fields.keys());
        return fields;
    }

    /**
     * @return the record's annotation, empty if it has none
     */
    @Transactional(readOnly = true)
    public FieldMap getAnnotation(UUID recordId) {
        if (!recordRepository.existsById(recordId)) {
            throw new RecordNotFoundException(recordId);
        }
        return annotationRepository.findById(recordId)
                .map(annotation -> canonicalizer.parse(annotation.getAttributes()))
                .orElse(FieldMap.empty());
    }
}
