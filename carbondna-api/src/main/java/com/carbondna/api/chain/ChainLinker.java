package com.carbondna.api.chain;

import com.carbondna.api.canonical.Canonicalizer;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.hashing.RecordHasher;
import com.carbondna.api.hashing.SaltGenerator;
import com.carbondna.core.domain.ChainHead;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.RecordAnnotation;
import com.carbondna.core.repository.ChainHeadRepository;
import com.carbondna.core.repository.LedgerRecordRepository;
import com.carbondna.core.repository.RecordAnnotationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Single append attempt: read head, hash, insert record, advance head, all in
 * one transaction. A concurrent writer surfaces as
 * {@link ChainHeadConflictException} and the whole attempt rolls back.
 */
@Service
public class ChainLinker {

    private static final Logger log = LoggerFactory.getLogger(ChainLinker.class);

    private final LedgerRecordRepository recordRepository;
    private final ChainHeadRepository chainHeadRepository;
    private final RecordAnnotationRepository annotationRepository;
    private final Canonicalizer canonicalizer;
    private final RecordHasher hasher;
    private final SaltGenerator saltGenerator;
    private final Clock clock;

    public ChainLinker(
            LedgerRecordRepository recordRepository,
            ChainHeadRepository chainHeadRepository,
            RecordAnnotationRepository annotationRepository,
            Canonicalizer canonicalizer,
            RecordHasher hasher,
            SaltGenerator saltGenerator,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.chainHeadRepository = chainHeadRepository;
        this.annotationRepository = annotationRepository;
        this.canonicalizer = canonicalizer;
        this.hasher = hasher;
        this.saltGenerator = saltGenerator;
        this.clock = clock;
    }

    @Transactional
    public LedgerRecord link(String partitionId, FieldMap payload, FieldMap annotation, UUID supersedesId) {
        if (supersedesId != null && recordRepository.existsBySupersedesId(supersedesId)) {
            throw new RecordAlreadySupersededException(supersedesId);
        }

        Instant now = clock.instant();
        ChainHead head = chainHeadRepository.findById(partitionId)
                .orElseGet(() -> ChainHead.genesis(partitionId, now));
        String previousHash = head.getHeadHash();

        byte[] canonical = canonicalizer.canonicalize(payload);
        String salt = saltGenerator.nextSalt();
        String recordHash = hasher.hash(canonical, salt, previousHash);

        if (recordRepository.existsByRecordHash(recordHash)) {
            log.error("Hash collision on partition {}: {} already exists", partitionId, recordHash);
            throw new HashCollisionException(partitionId, recordHash);
        }

        LedgerRecord record = LedgerRecord.create(
                partitionId,
                head.nextSequence(),
                new String(canonical, StandardCharsets.UTF_8),
                salt,
                previousHash,
                recordHash,
                now,
                supersedesId);
        String annotationJson = annotation.isEmpty()
                ? null
                : RecordAnnotation.requireAttributes(canonicalizer.canonicalJson(annotation));

        try {
            record = recordRepository.saveAndFlush(record);
            head.advance(record);
            chainHeadRepository.saveAndFlush(head);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new ChainHeadConflictException(partitionId, previousHash, e);
        }

        if (annotationJson != null) {
            annotationRepository.save(RecordAnnotation.create(record.getId(), partitionId, annotationJson, now));
        }

        log.debug("Linked record {} at {}#{}", record.getId(), partitionId, record.getSequence());
        return record;
    }
}
