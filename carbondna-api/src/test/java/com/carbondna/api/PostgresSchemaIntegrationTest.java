package com.carbondna.api;

import com.carbondna.api.anchor.MerkleAnchorService;
import com.carbondna.api.chain.ChainBuilder;
import com.carbondna.api.config.TestcontainersConfiguration;
import com.carbondna.api.quality.RecordAnnotationService;
import com.carbondna.api.verification.VerificationService;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.MerkleAnchor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the ledger against PostgreSQL with the Flyway migration and Hibernate
 * schema validation. Skipped when no Docker daemon is reachable.
 */
@SpringBootTest(classes = CarbonDnaApiApplication.class, properties = {
        "spring.flyway.enabled=true",
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.datasource.driver-class-name=org.postgresql.Driver"
})
@Import({TestcontainersConfiguration.class, TestClockConfiguration.class})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class PostgresSchemaIntegrationTest {

    @Autowired
    private MutableClock clock;

    @Autowired
    private ChainBuilder chainBuilder;

    @Autowired
    private MerkleAnchorService anchorService;

    @Autowired
    private VerificationService verificationService;

    @Autowired
    private RecordAnnotationService annotationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void migrationIsApplied_andLedgerRunsOnIt() {
        Integer applied = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM flyway_schema_history WHERE version = '1' AND success", Integer.class);
        assertThat(applied).isEqualTo(1);

        LedgerRecord first = chainBuilder.append("pg-chain", LedgerIntegrationTestSupport.payload(
                "emissions", 100, "uncertainty_pct", 5));
        LedgerRecord amended = chainBuilder.amend(first.getId(), LedgerIntegrationTestSupport.payload(
                "emissions", 120));
        annotationService.annotate(amended.getId(), Map.of("data_quality_score", 0.8));

        assertThat(chainBuilder.currentRevision(first.getId()).getId()).isEqualTo(amended.getId());
        assertThat(verificationService.verifyRecord(first.getId()).ok()).isTrue();
        assertThat(verificationService.verifyChain("pg-chain", null, null).ok()).isTrue();
    }

    @Test
    void recordsCannotBeUpdatedOrDeleted() {
        LedgerRecord record = chainBuilder.append("pg-records", LedgerIntegrationTestSupport.payload("emissions", 1));

        assertThatThrownBy(() -> jdbcTemplate.update(
                "UPDATE ledger_records SET payload = ? WHERE id = ?", "{\"emissions\":2}", record.getId()))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("append-only");
        assertThatThrownBy(() -> jdbcTemplate.update("DELETE FROM ledger_records WHERE id = ?", record.getId()))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("append-only");

        assertThat(verificationService.verifyRecord(record.getId()).ok()).isTrue();
    }

    @Test
    void anchorsCannotBeUpdatedOrDeleted() {
        clock.set(Instant.parse("2024-03-10T09:00:00Z"));
        chainBuilder.append("pg-anchors", LedgerIntegrationTestSupport.payload("emissions", 1));
        chainBuilder.append("pg-anchors", LedgerIntegrationTestSupport.payload("emissions", 2));
        clock.set(Instant.parse("2024-03-11T09:00:00Z"));

        MerkleAnchor anchor = anchorService.anchorPeriod("pg-anchors", LocalDate.of(2024, 3, 10));

        assertThatThrownBy(() -> jdbcTemplate.update(
                "UPDATE merkle_anchors SET root_hash = ? WHERE id = ?", "0".repeat(64), anchor.getId()))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("append-only");
        assertThatThrownBy(() -> jdbcTemplate.update("DELETE FROM merkle_anchors WHERE id = ?", anchor.getId()))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("append-only");

        assertThat(verificationService.verifyAnchor("pg-anchors", LocalDate.of(2024, 3, 10)).ok()).isTrue();
    }

    @Test
    void foreignKeys_rejectDanglingReferences() {
        OffsetDateTime now = OffsetDateTime.of(2024, 3, 10, 9, 0, 0, 0, ZoneOffset.UTC);

        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO record_annotations (record_id, partition_id, attributes, updated_at, version) "
                        + "VALUES (?, ?, ?, ?, 0)",
                UUID.randomUUID(), "pg-fk", "{\"data_quality_score\":1}", now))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
