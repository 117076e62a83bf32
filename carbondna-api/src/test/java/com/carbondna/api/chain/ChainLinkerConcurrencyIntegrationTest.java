package com.carbondna.api.chain;

import com.carbondna.api.LedgerIntegrationTestSupport;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.hashing.SaltGenerator;
import com.carbondna.api.verification.VerificationService;
import com.carbondna.core.domain.LedgerRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * A second writer that bypasses the in-process partition lock (another
 * instance of the service, in production) moves the persisted head while an
 * append is between reading the head and writing its record.
 */
class ChainLinkerConcurrencyIntegrationTest extends LedgerIntegrationTestSupport {

    @SpyBean
    private SaltGenerator saltGenerator;

    @Autowired
    private ChainBuilder chainBuilder;

    @Autowired
    private ChainLinker chainLinker;

    @Autowired
    private VerificationService verificationService;

    @Test
    void headMovedByAnotherWriter_isDetectedAndRetried() throws Exception {
        LedgerRecord first = chainBuilder.append("org-1", payload("n", 1));

        AtomicBoolean raced = new AtomicBoolean();
        AtomicReference<LedgerRecord> rival = new AtomicReference<>();
        ExecutorService otherWriter = Executors.newSingleThreadExecutor();
        try {
            doAnswer(invocation -> {
                if (raced.compareAndSet(false, true)) {
                    rival.set(otherWriter.submit(() -> chainLinker.link(
                                    "org-1", payload("n", "rival"), FieldMap.empty(), null))
                            .get(30, TimeUnit.SECONDS));
                }
                return invocation.callRealMethod();
            }).when(saltGenerator).nextSalt();

            LedgerRecord appended = chainBuilder.append("org-1", payload("n", 2));

            assertThat(rival.get()).isNotNull();
            assertThat(rival.get().getSequence()).isEqualTo(2L);
            assertThat(rival.get().getPreviousHash()).isEqualTo(first.getRecordHash());

            assertThat(appended.getSequence()).isEqualTo(3L);
            assertThat(appended.getPreviousHash()).isEqualTo(rival.get().getRecordHash());
            // first append, the losing attempt, the rival and the retry
            verify(saltGenerator, times(4)).nextSalt();
        } finally {
            otherWriter.shutdownNow();
        }

        List<LedgerRecord> stored = recordRepository.findAll();
        assertThat(stored).hasSize(3);
        assertThat(chainHeadRepository.findById("org-1").orElseThrow().getSequence()).isEqualTo(3L);
        assertThat(verificationService.verifyChain("org-1", null, null).ok()).isTrue();
    }
}
