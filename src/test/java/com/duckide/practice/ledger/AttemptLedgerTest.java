package com.duckide.practice.ledger;

import com.duckide.practice.domain.DomainModels.Attempt;
import com.duckide.practice.verification.Verdict;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AttemptLedgerTest {
    @Autowired
    private AttemptLedger ledger;

    @Test
    void sequenceNumbersRunContiguouslyPerPair() {
        Attempt first = ledger.record("ledger-seq", 1, "SELECT 1", Verdict.mismatch(), 12);
        Attempt second = ledger.record("ledger-seq", 1, "SELECT 2", Verdict.correctResult(), 30);
        Attempt otherExercise = ledger.record("ledger-seq", 2, "SELECT 3", Verdict.mismatch(), null);

        assertEquals(1, first.sequenceNumber());
        assertEquals(2, second.sequenceNumber());
        assertEquals(1, otherExercise.sequenceNumber());
        assertEquals(2, ledger.countFor("ledger-seq", 1));
        assertNull(otherExercise.elapsedSeconds());
    }

    @Test
    void twoConcurrentSubmissionsGetOneAndTwo() throws Exception {
        List<Integer> sequences = submitConcurrently("ledger-pair", 3, 2);

        assertEquals(List.of(1, 2), sequences);
    }

    @Test
    void manyConcurrentSubmissionsLeaveNoGapsOrDuplicates() throws Exception {
        List<Integer> sequences = submitConcurrently("ledger-many", 4, 16);

        assertEquals(IntStream.rangeClosed(1, 16).boxed().toList(), sequences);
        assertEquals(16, ledger.countFor("ledger-many", 4));
    }

    @Test
    void correctAttemptStaysRecorded() {
        assertFalse(ledger.hasCorrectAttempt("ledger-correct", 5));

        ledger.record("ledger-correct", 5, "SELECT 1", Verdict.correctResult(), 5);
        ledger.record("ledger-correct", 5, "SELEC", Verdict.queryFailed("syntax error"), 6);

        assertTrue(ledger.hasCorrectAttempt("ledger-correct", 5));
        assertFalse(ledger.hasCorrectAttempt("ledger-correct", 6));
        assertFalse(ledger.hasCorrectAttempt("someone-else", 5));
    }

    @Test
    void listsAttemptsMostRecentFirst() {
        ledger.record("ledger-order", 1, "q1", Verdict.mismatch(), 1);
        ledger.record("ledger-order", 2, "q2", Verdict.queryFailed("boom"), 2);
        ledger.record("ledger-order", 1, "q3", Verdict.correctResult(), 3);

        List<Attempt> forPair = ledger.attemptsFor("ledger-order", 1);
        assertEquals(List.of("q3", "q1"), forPair.stream().map(Attempt::submittedQuery).toList());

        List<Attempt> recent = ledger.recentAttempts("ledger-order", 2);
        assertEquals(List.of("q3", "q2"), recent.stream().map(Attempt::submittedQuery).toList());
        assertEquals("boom", recent.get(1).queryError());

        assertTrue(ledger.recentAttempts("ledger-order", 0).isEmpty());
        assertEquals(3, ledger.history("ledger-order").size());
    }

    private List<Integer> submitConcurrently(String learnerId, int exerciseId, int writers) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Attempt>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String query = "SELECT " + i;
                futures.add(pool.submit(() -> {
                    go.await();
                    return ledger.record(learnerId, exerciseId, query, Verdict.mismatch(), 1);
                }));
            }
            go.countDown();

            List<Integer> sequences = new ArrayList<>();
            for (Future<Attempt> future : futures) {
                sequences.add(future.get(30, TimeUnit.SECONDS).sequenceNumber());
            }
            return sequences.stream().sorted().toList();
        } finally {
            pool.shutdownNow();
        }
    }
}
