package com.bit.vault.exitqueue;

import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ExitQueueTest {

    private static final long CLAIM_DELAY = 86_400;
    private static final Address ALICE = Address.fromHex("0x00000000000000000000000000000000000a11ce");
    private static final Address BOB = Address.fromHex("0x0000000000000000000000000000000000000b0b");

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }

    private static ExchangeRate rate(long assets, long shares) {
        return new ExchangeRate(big(assets), big(shares));
    }

    @Test
    void partialSettlementExample() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        ExitTicket ticket = queue.enter(ALICE, big(500), 1_000);
        assertEquals(BigInteger.ZERO, ticket.getOffset());

        AdvanceResult advance = queue.advance(big(300), rate(1100, 1009), 1_000);
        assertEquals(big(275), advance.getSharesBurned());
        // floor(275 * 1100 / 1009) = 299，向下取整有利于金库
        assertEquals(big(299), advance.getAssetsReleased());
        assertEquals(new Checkpoint(big(275), big(299)), queue.getCheckpoints().get(0));
        assertEquals(big(225), queue.getQueuedShares().getAmount());

        assertEquals(Optional.of(0), queue.findCheckpoint(BigInteger.ZERO));

        VaultException early = assertThrows(VaultException.class,
                () -> queue.settle(ALICE, BigInteger.ZERO, 0, 1_000 + CLAIM_DELAY - 1));
        assertEquals(ErrorType.TOO_EARLY, early.getErrorType());

        SettlementResult result = queue.settle(ALICE, BigInteger.ZERO, 0, 1_000 + CLAIM_DELAY);
        assertEquals(big(275), result.getExitedShares());
        assertEquals(big(299), result.getExitedAssets());
        assertEquals(new ExitTicket(big(275), big(225), 1_000, ALICE), result.getRemainingTicket());
        assertEquals(BigInteger.ZERO, queue.getUnclaimedAssets());

        // 剩余部分尚未被任何检查点覆盖
        assertEquals(Optional.empty(), queue.findCheckpoint(big(275)));
        assertFalse(queue.findTicket(BigInteger.ZERO).isPresent());
        assertTrue(queue.findTicket(big(275)).isPresent());
    }

    @Test
    void settlementSpansCheckpointsAtTheirOwnRates() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        queue.enter(ALICE, big(100), 0);
        queue.enter(BOB, big(200), 0);

        queue.advance(big(50), rate(1000, 1000), 10);
        // 汇率翻倍后的检查点：50 份额释放 100 资产
        queue.advance(big(100), rate(2000, 1000), 20);
        queue.advance(big(400), rate(1000, 1000), 30);
        assertEquals(3, queue.getCheckpoints().size());
        assertEquals(new Checkpoint(big(300), big(350)), queue.getCheckpoints().get(2));
        assertTrue(queue.getQueuedShares().isZero());

        SettlementResult alice = queue.settle(ALICE, BigInteger.ZERO, 0, CLAIM_DELAY);
        assertEquals(big(100), alice.getExitedShares());
        assertEquals(big(150), alice.getExitedAssets());
        assertTrue(alice.isFullySettled());

        assertEquals(Optional.of(2), queue.findCheckpoint(big(100)));
        assertInvalidCheckpoint(() -> queue.settle(BOB, big(100), 0, CLAIM_DELAY));
        assertInvalidCheckpoint(() -> queue.settle(BOB, big(100), 1, CLAIM_DELAY));
        SettlementResult bob = queue.settle(BOB, big(100), 2, CLAIM_DELAY);
        assertEquals(big(200), bob.getExitedShares());
        assertEquals(big(200), bob.getExitedAssets());
        assertEquals(BigInteger.ZERO, queue.getUnclaimedAssets());
        assertTrue(queue.getTickets().isEmpty());
    }

    @Test
    void laterCheckpointIndexForEarlyTicketIsInvalid() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        queue.enter(ALICE, big(100), 0);
        queue.advance(big(40), rate(1, 1), 0);
        queue.advance(big(40), rate(1, 1), 0);
        assertInvalidCheckpoint(() -> queue.settle(ALICE, BigInteger.ZERO, 1, CLAIM_DELAY));
        assertInvalidCheckpoint(() -> queue.previewSettle(BigInteger.ZERO, -1, CLAIM_DELAY));
    }

    @Test
    void checkpointIndexBeyondListReturnsUnchangedTicket() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        ExitTicket ticket = queue.enter(ALICE, big(100), 0);
        SettlementResult result = queue.settle(ALICE, BigInteger.ZERO, 5, CLAIM_DELAY);
        assertEquals(BigInteger.ZERO, result.getExitedShares());
        assertEquals(BigInteger.ZERO, result.getExitedAssets());
        assertEquals(ticket, result.getRemainingTicket());
        assertEquals(ticket, queue.findTicket(BigInteger.ZERO).orElseThrow());
    }

    @Test
    void onlyOwnerSettlesAndUnknownTicketRejected() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        queue.enter(ALICE, big(100), 0);
        queue.advance(big(100), rate(1, 1), 0);
        VaultException denied = assertThrows(VaultException.class,
                () -> queue.settle(BOB, BigInteger.ZERO, 0, CLAIM_DELAY));
        assertEquals(ErrorType.ACCESS_DENIED, denied.getErrorType());
        VaultException missing = assertThrows(VaultException.class,
                () -> queue.settle(ALICE, big(7), 0, CLAIM_DELAY));
        assertEquals(ErrorType.INVALID_TICKET, missing.getErrorType());
    }

    @Test
    void advanceIsNoopWithoutQueueOrLiquidity() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        assertTrue(queue.advance(big(100), rate(1, 1), 0).isEmpty());
        queue.enter(ALICE, big(100), 0);
        assertTrue(queue.advance(BigInteger.ZERO, rate(1, 1), 0).isEmpty());
        // 不足一份的流动性不生成检查点
        assertTrue(queue.advance(big(1), rate(3, 1), 0).isEmpty());
        assertTrue(queue.getCheckpoints().isEmpty());

        VaultException zero = assertThrows(VaultException.class, () -> queue.enter(ALICE, BigInteger.ZERO, 0));
        assertEquals(ErrorType.INVALID_SHARES, zero.getErrorType());
    }

    @Test
    void checkpointsThrottledByUpdateDelay() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 3_600);
        queue.enter(ALICE, big(100), 0);
        assertFalse(queue.advance(big(10), rate(1, 1), 100).isEmpty());
        assertTrue(queue.advance(big(10), rate(1, 1), 100 + 3_599).isEmpty());
        assertFalse(queue.advance(big(10), rate(1, 1), 100 + 3_600).isEmpty());
        assertEquals(2, queue.getCheckpoints().size());
    }

    @Test
    void copyIsIndependent() {
        ExitQueue queue = new ExitQueue(CLAIM_DELAY, 0);
        queue.enter(ALICE, big(100), 0);
        ExitQueue copy = queue.copy();
        copy.enter(BOB, big(50), 0);
        copy.advance(big(100), rate(1, 1), 0);
        assertEquals(big(100), queue.getTotalTicketsIssued());
        assertTrue(queue.getCheckpoints().isEmpty());
        assertEquals(1, queue.getTickets().size());
        assertEquals(big(150), copy.getTotalTicketsIssued());
    }

    @Test
    void randomSequencesConserveSharesAndNeverOverClaim() {
        Random random = new Random(20240501L);
        for (int round = 0; round < 50; round++) {
            ExitQueue queue = new ExitQueue(10, 0);
            List<Address> owners = List.of(ALICE, BOB);
            BigInteger settled = BigInteger.ZERO;
            BigInteger paid = BigInteger.ZERO;
            BigInteger released = BigInteger.ZERO;
            long now = 0;
            for (int step = 0; step < 40; step++) {
                now += random.nextInt(5);
                int op = random.nextInt(3);
                if (op == 0) {
                    queue.enter(owners.get(random.nextInt(2)), big(1 + random.nextInt(500)), now);
                } else if (op == 1) {
                    long assets = 1 + random.nextInt(2_000);
                    long shares = 1 + random.nextInt(2_000);
                    AdvanceResult r = queue.advance(big(random.nextInt(400)), rate(assets, shares), now);
                    released = released.add(r.getAssetsReleased());
                } else if (!queue.getTickets().isEmpty()) {
                    List<ExitTicket> open = new ArrayList<>(queue.getTickets().values());
                    ExitTicket ticket = open.get(random.nextInt(open.size()));
                    Optional<Integer> index = queue.findCheckpoint(ticket.getOffset());
                    if (index.isPresent() && now >= ticket.getRequestedAt() + 10) {
                        BigInteger unclaimedBefore = queue.getUnclaimedAssets();
                        SettlementResult r = queue.settle(ticket.getOwner(), ticket.getOffset(), index.get(), now);
                        assertTrue(r.getExitedAssets().compareTo(unclaimedBefore) <= 0);
                        assertTrue(r.getExitedShares().signum() > 0);
                        settled = settled.add(r.getExitedShares());
                        paid = paid.add(r.getExitedAssets());
                    }
                }
                assertMonotone(queue.getCheckpoints());

                BigInteger remainders = BigInteger.ZERO;
                for (ExitTicket t : queue.getTickets().values()) {
                    remainders = remainders.add(t.getShares());
                }
                assertEquals(queue.getTotalTicketsIssued(), settled.add(remainders));
                BigInteger burned = queue.getCheckpoints().isEmpty()
                        ? BigInteger.ZERO
                        : queue.getCheckpoints().get(queue.getCheckpoints().size() - 1).getCumulativeSharesBurned();
                assertEquals(queue.getTotalTicketsIssued(), queue.getQueuedShares().getAmount().add(burned));
                assertEquals(released.subtract(paid), queue.getUnclaimedAssets());
                assertTrue(queue.getUnclaimedAssets().signum() >= 0);
            }
        }
    }

    private static void assertMonotone(List<Checkpoint> checkpoints) {
        for (int i = 1; i < checkpoints.size(); i++) {
            assertTrue(checkpoints.get(i).getCumulativeSharesBurned()
                    .compareTo(checkpoints.get(i - 1).getCumulativeSharesBurned()) > 0);
            assertTrue(checkpoints.get(i).getCumulativeAssetsReleased()
                    .compareTo(checkpoints.get(i - 1).getCumulativeAssetsReleased()) > 0);
        }
    }

    private static void assertInvalidCheckpoint(Runnable action) {
        VaultException e = assertThrows(VaultException.class, action::run);
        assertEquals(ErrorType.INVALID_CHECKPOINT, e.getErrorType());
    }
}
