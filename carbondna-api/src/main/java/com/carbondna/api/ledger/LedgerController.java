package com.carbondna.api.ledger;

import com.carbondna.api.anchor.AnchorNotFoundException;
import com.carbondna.api.anchor.AnchorPeriodAlreadyClosedException;
import com.carbondna.api.anchor.EmptyPeriodException;
import com.carbondna.api.anchor.InclusionProof;
import com.carbondna.api.anchor.InclusionVerification;
import com.carbondna.api.anchor.MerkleAnchorService;
import com.carbondna.api.anchor.PeriodNotClosedException;
import com.carbondna.api.canonical.CanonicalizationException;
import com.carbondna.api.canonical.Canonicalizer;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.chain.ChainBuilder;
import com.carbondna.api.chain.ChainHeadConflictException;
import com.carbondna.api.chain.ChainWriteFailedException;
import com.carbondna.api.chain.HashCollisionException;
import com.carbondna.api.chain.RecordAlreadySupersededException;
import com.carbondna.api.chain.RecordNotFoundException;
import com.carbondna.api.hashing.HashInputException;
import com.carbondna.api.quality.RecordAnnotationService;
import com.carbondna.api.verification.AnchorVerificationResult;
import com.carbondna.api.verification.ChainVerificationResult;
import com.carbondna.api.verification.LedgerIntegrityReport;
import com.carbondna.api.verification.RecordVerificationResult;
import com.carbondna.api.verification.TamperSimulation;
import com.carbondna.api.verification.VerificationService;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.MerkleAnchor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API of the emission ledger.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    private final ChainBuilder chainBuilder;
    private final MerkleAnchorService anchorService;
    private final VerificationService verificationService;
    private final RecordAnnotationService annotationService;
    private final Canonicalizer canonicalizer;

    public LedgerController(
            ChainBuilder chainBuilder,
            MerkleAnchorService anchorService,
            VerificationService verificationService,
            RecordAnnotationService annotationService,
            Canonicalizer canonicalizer) {
        this.chainBuilder = chainBuilder;
        this.anchorService = anchorService;
        this.verificationService = verificationService;
        this.annotationService = annotationService;
        this.canonicalizer = canonicalizer;
    }

    /**
     * Append a record. Without {@code partition} it is derived from the payload.
     * POST /api/v1/ledger/records
     */
    @PostMapping("/records")
    public ResponseEntity<RecordView> append(@RequestBody AppendRequest request) {
        FieldMap payload = FieldMap.of(request.payload());
        LedgerRecord record = request.partition() == null
                ? chainBuilder.append(payload)
                : chainBuilder.append(request.partition(), payload);
        return ResponseEntity.status(HttpStatus.CREATED).body(view(record));
    }

    @GetMapping("/records/{id}")
    public ResponseEntity<RecordView> getRecord(@PathVariable UUID id) {
        return ResponseEntity.ok(view(chainBuilder.getRecord(id)));
    }

    /**
     * Latest revision of a record after amendments.
     * GET /api/v1/ledger/records/{id}/current
     */
    @GetMapping("/records/{id}/current")
    public ResponseEntity<RecordView> getCurrentRevision(@PathVariable UUID id) {
        return ResponseEntity.ok(view(chainBuilder.currentRevision(id)));
    }

    /**
     * Correct a record by appending a superseding one.
     * POST /api/v1/ledger/records/{id}/amend
     */
    @PostMapping("/records/{id}/amend")
    public ResponseEntity<RecordView> amend(@PathVariable UUID id, @RequestBody AmendRequest request) {
        LedgerRecord amended = chainBuilder.amend(id, FieldMap.of(request.payload()));
        return ResponseEntity.status(HttpStatus.CREATED).body(view(amended));
    }

    @PutMapping("/records/{id}/annotation")
    public ResponseEntity<Map<String, Object>> annotate(
            @PathVariable UUID id,
            @RequestBody Map<String, Object> attributes) {
        return ResponseEntity.ok(annotationService.annotate(id, attributes).toJavaMap());
    }

    @PostMapping("/records/{id}/verify")
    public ResponseEntity<RecordVerificationResult> verifyRecord(@PathVariable UUID id) {
        return ResponseEntity.ok(verificationService.verifyRecord(id));
    }

    /**
     * Hash a record would need after changing one field. Read-only.
     * POST /api/v1/ledger/records/{id}/simulate-tamper
     */
    @PostMapping("/records/{id}/simulate-tamper")
    public ResponseEntity<TamperSimulation> simulateTamper(
            @PathVariable UUID id,
            @RequestBody TamperRequest request) {
        return ResponseEntity.ok(verificationService.simulateTamper(id, request.field(), request.value()));
    }

    @GetMapping("/records/{id}/inclusion-proof")
    public ResponseEntity<InclusionProof> getInclusionProof(@PathVariable UUID id) {
        return ResponseEntity.ok(anchorService.proveInclusion(id));
    }

    @PostMapping("/inclusion-proofs/verify")
    public ResponseEntity<InclusionVerification> verifyInclusionProof(@RequestBody InclusionVerifyRequest request) {
        if (request.partition() == null || request.period() == null) {
            throw new IllegalArgumentException("partition and period are required");
        }
        return ResponseEntity.ok(anchorService.verifyInclusion(request.proof(), request.partition(), request.period()));
    }

    /**
     * Records of a partition in chain order.
     * GET /api/v1/ledger/partitions/{partition}/records
     */
    @GetMapping("/partitions/{partition}/records")
    public ResponseEntity<Page<RecordView>> listRecords(
            @PathVariable String partition,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Page<RecordView> records = chainBuilder.listRecords(partition, PageRequest.of(page, size))
                .map(record -> RecordView.of(record, payloadOf(record), null));
        return ResponseEntity.ok(records);
    }

    @PostMapping("/partitions/{partition}/verify-chain")
    public ResponseEntity<ChainVerificationResult> verifyChain(
            @PathVariable String partition,
            @RequestParam(required = false) UUID from,
            @RequestParam(required = false) UUID to) {
        return ResponseEntity.ok(verificationService.verifyChain(partition, from, to));
    }

    @PostMapping("/partitions/{partition}/verify")
    public ResponseEntity<LedgerIntegrityReport> verifyLedger(@PathVariable String partition) {
        return ResponseEntity.ok(verificationService.verifyLedger(partition));
    }

    @GetMapping("/partitions/{partition}/anchors")
    public ResponseEntity<List<MerkleAnchor>> listAnchors(@PathVariable String partition) {
        return ResponseEntity.ok(anchorService.listAnchors(partition));
    }

    /**
     * Close a UTC day under a Merkle root.
     * POST /api/v1/ledger/partitions/{partition}/anchors/{date}
     */
    @PostMapping("/partitions/{partition}/anchors/{date}")
    public ResponseEntity<MerkleAnchor> anchorPeriod(
            @PathVariable String partition,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(anchorService.anchorPeriod(partition, date));
    }

    @PostMapping("/partitions/{partition}/anchors/{date}/verify")
    public ResponseEntity<AnchorVerificationResult> verifyAnchor(
            @PathVariable String partition,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(verificationService.verifyAnchor(partition, date));
    }

    private RecordView view(LedgerRecord record) {
        return RecordView.of(record, payloadOf(record), annotationService.getAnnotation(record.getId()).toJavaMap());
    }

    private Map<String, Object> payloadOf(LedgerRecord record) {
        return canonicalizer.parse(record.getPayload()).toJavaMap();
    }

    // Request DTOs
    public record AppendRequest(String partition, Map<String, Object> payload) {}

    public record AmendRequest(Map<String, Object> payload) {}

    public record TamperRequest(String field, Object value) {}

    public record InclusionVerifyRequest(String partition, LocalDate period, String proof) {}

    // Exception handlers
    @ExceptionHandler(CanonicalizationException.class)
    public ResponseEntity<ErrorResponse> handleCanonicalization(CanonicalizationException e) {
        return error(HttpStatus.BAD_REQUEST, "LEDGER_001", e);
    }

    @ExceptionHandler(HashInputException.class)
    public ResponseEntity<ErrorResponse> handleHashInput(HashInputException e) {
        log.error("Malformed hash input", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "LEDGER_002", e);
    }

    @ExceptionHandler(ChainHeadConflictException.class)
    public ResponseEntity<ErrorResponse> handleHeadConflict(ChainHeadConflictException e) {
        return error(HttpStatus.CONFLICT, "LEDGER_003", e);
    }

    @ExceptionHandler(ChainWriteFailedException.class)
    public ResponseEntity<ErrorResponse> handleWriteFailed(ChainWriteFailedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "LEDGER_004", e);
    }

    @ExceptionHandler(AnchorPeriodAlreadyClosedException.class)
    public ResponseEntity<ErrorResponse> handleAnchorClosed(AnchorPeriodAlreadyClosedException e) {
        return error(HttpStatus.CONFLICT, "LEDGER_005", e);
    }

    @ExceptionHandler({RecordNotFoundException.class, AnchorNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "LEDGER_006", e);
    }

    @ExceptionHandler(RecordAlreadySupersededException.class)
    public ResponseEntity<ErrorResponse> handleSuperseded(RecordAlreadySupersededException e) {
        return error(HttpStatus.CONFLICT, "LEDGER_007", e);
    }

    @ExceptionHandler({PeriodNotClosedException.class, EmptyPeriodException.class})
    public ResponseEntity<ErrorResponse> handlePeriod(RuntimeException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "LEDGER_008", e);
    }

    @ExceptionHandler(HashCollisionException.class)
    public ResponseEntity<ErrorResponse> handleCollision(HashCollisionException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "LEDGER_009", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "LEDGER_010", e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
