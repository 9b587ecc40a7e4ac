package com.cardregistry.lifecycle;

import com.cardregistry.common.SerialTransactionRunner;
import com.cardregistry.common.exception.MaxUsesReachedException;
import com.cardregistry.common.exception.NotOwnerNorApprovedException;
import com.cardregistry.governance.Capability;
import com.cardregistry.governance.RegistryAdminService;
import com.cardregistry.ledger.CardLedger;
import com.cardregistry.ledger.CardOwnershipRepository;
import com.cardregistry.ledger.OperatorApprovalRepository;
import com.cardregistry.state.CardMetaRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that run against committed state: concurrent use accounting and
 * all-or-nothing batches. Not transactional, so every test cleans up after itself.
 */
@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class SerializedExecutionTest {

    private static final String ADMIN = "admin";
    private static final String MINTER = "serial-minter";
    private static final String OPERATOR = "serial-operator";
    private static final String HOLDER = "serial-holder";
    private static final String OTHER = "serial-other";

    @Autowired
    private CardLifecycleService lifecycleService;

    @Autowired
    private RegistryAdminService adminService;

    @Autowired
    private CardOwnershipRepository ownershipRepository;

    @Autowired
    private CardMetaRepository metaRepository;

    @Autowired
    private OperatorApprovalRepository operatorApprovalRepository;

    @Autowired
    private SerialTransactionRunner runner;

    @Autowired
    private CardLedger cardLedger;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        adminService.grantCapability(ADMIN, MINTER, Capability.MINTER);
        adminService.grantCapability(ADMIN, OPERATOR, Capability.OPERATOR);
    }

    @AfterEach
    void tearDown() {
        ownershipRepository.deleteAll();
        metaRepository.deleteAll();
        operatorApprovalRepository.deleteAll();
        adminService.revokeCapability(ADMIN, MINTER, Capability.MINTER);
        adminService.revokeCapability(ADMIN, OPERATOR, Capability.OPERATOR);
    }

    @Test
    void testConcurrentUseNeverExceedsLimit() throws Exception {
        List<Long> cardIds = lifecycleService.mintBatch(MINTER,
            List.of(HOLDER, HOLDER), List.of(BigInteger.ONE, BigInteger.ONE));

        int threads = 8;
        int attemptsPerThread = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    int succeeded = 0;
                    for (int i = 0; i < attemptsPerThread; i++) {
                        try {
                            lifecycleService.useFromHolder(OPERATOR, HOLDER, BigInteger.ONE);
                            succeeded++;
                        } catch (MaxUsesReachedException e) {
                            // expected once both cards are full
                        }
                    }
                    return succeeded;
                }));
            }
            start.countDown();

            int totalSucceeded = 0;
            for (Future<Integer> future : futures) {
                totalSucceeded += future.get(30, TimeUnit.SECONDS);
            }

            // two cards, five uses each
            assertEquals(10, totalSucceeded);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(BigInteger.valueOf(5), lifecycleService.usesOf(cardIds.get(0)));
        assertEquals(BigInteger.valueOf(5), lifecycleService.usesOf(cardIds.get(1)));
        assertEquals(BigInteger.TEN, lifecycleService.totalUsesOf(HOLDER));
    }

    @Test
    void testConcurrentMintsGetDistinctConsecutiveIds() throws Exception {
        long first = lifecycleService.nextCardId();
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Long>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> lifecycleService.mint(MINTER, HOLDER, BigInteger.ONE)));
            }
            List<Long> ids = new ArrayList<>();
            for (Future<Long> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS));
            }
            ids.sort(Long::compare);

            for (int i = 0; i < threads; i++) {
                assertEquals(first + i, ids.get(i));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(threads, lifecycleService.balanceOf(HOLDER));
    }

    @Test
    void testFailedBurnBatchRollsBackEarlierBurns() {
        List<Long> cardIds = lifecycleService.mintBatch(MINTER,
            List.of(HOLDER, HOLDER, OTHER), List.of(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE));

        assertThrows(NotOwnerNorApprovedException.class, () ->
            lifecycleService.burnBatch(HOLDER, cardIds));

        cardIds.forEach(id -> assertTrue(lifecycleService.exists(id)));
        assertEquals(2, lifecycleService.balanceOf(HOLDER));
        assertEquals(BigInteger.ONE, lifecycleService.levelOf(cardIds.get(0)));
    }

    @Test
    void testFailedTransferBatchRollsBackEarlierTransfers() {
        List<Long> cardIds = lifecycleService.mintBatch(MINTER,
            List.of(HOLDER, HOLDER, OTHER), List.of(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE));

        assertThrows(NotOwnerNorApprovedException.class, () ->
            lifecycleService.transferBatch(HOLDER, HOLDER, "serial-recipient", cardIds));

        assertEquals(HOLDER, lifecycleService.ownerOf(cardIds.get(0)));
        assertEquals(HOLDER, lifecycleService.ownerOf(cardIds.get(1)));
        assertEquals(0, lifecycleService.balanceOf("serial-recipient"));
    }

    @Test
    void testFailedUseLeavesCommittedUsesUntouched() {
        long cardId = lifecycleService.mint(MINTER, HOLDER, BigInteger.ONE);
        lifecycleService.use(OPERATOR, cardId, BigInteger.valueOf(4));

        assertThrows(MaxUsesReachedException.class, () ->
            lifecycleService.use(OPERATOR, cardId, BigInteger.TWO));

        assertEquals(BigInteger.valueOf(4), lifecycleService.usesOf(cardId));
    }

    @Test
    void testFailedBurnBatchNotifiesNothing(CapturedOutput output) {
        List<Long> cardIds = lifecycleService.mintBatch(MINTER,
            List.of(HOLDER, HOLDER, OTHER), List.of(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE));

        assertThrows(NotOwnerNorApprovedException.class, () ->
            lifecycleService.burnBatch(HOLDER, cardIds));

        assertFalse(output.getOut().contains("Burned: card=" + cardIds.get(0) + ","));
        assertFalse(output.getOut().contains("Burned: card=" + cardIds.get(1) + ","));

        lifecycleService.burnBatch(HOLDER, cardIds.subList(0, 2));

        assertTrue(output.getOut().contains("Burned: card=" + cardIds.get(0) + ","));
        assertTrue(output.getOut().contains("Burned: card=" + cardIds.get(1) + ","));
    }

    @Test
    void testApprovalWaitsForInFlightTransfer() throws Exception {
        long cardId = lifecycleService.mint(MINTER, HOLDER, BigInteger.ONE);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<?> approval = runner.call(() -> {
                cardLedger.transferOwnership(HOLDER, OTHER, cardId);
                Future<?> pending = executor.submit(() ->
                    lifecycleService.approve(HOLDER, "serial-spender", cardId));
                // blocked until the transfer commits
                assertThrows(TimeoutException.class, () -> pending.get(300, TimeUnit.MILLISECONDS));
                return pending;
            });

            ExecutionException e = assertThrows(ExecutionException.class, () ->
                approval.get(30, TimeUnit.SECONDS));
            assertInstanceOf(NotOwnerNorApprovedException.class, e.getCause());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(OTHER, lifecycleService.ownerOf(cardId));
        assertNull(lifecycleService.getApproved(cardId));
    }

    @Test
    void testRolledBackMintDoesNotConsumeIdentifier() {
        long before = lifecycleService.nextCardId();

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            assertEquals(before, lifecycleService.mint(MINTER, HOLDER, BigInteger.ONE));
            status.setRollbackOnly();
        });

        assertEquals(before, lifecycleService.nextCardId());
        assertEquals(0, lifecycleService.balanceOf(HOLDER));
        assertEquals(before, lifecycleService.mint(MINTER, HOLDER, BigInteger.ONE));
    }
}
