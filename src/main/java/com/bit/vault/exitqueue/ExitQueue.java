package com.bit.vault.exitqueue;

import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.common.Shares;
import com.bit.vault.common.VaultMath;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 先进先出的退出队列
 * 检查点列表只追加，两个累计字段单调不减，按下标即可二分查找
 * 非线程安全，由所属金库的锁串行化
 */
@Slf4j
public class ExitQueue {

    private final long claimDelay;
    private final long updateDelay;

    private final List<Checkpoint> checkpoints;
    // offset -> 凭证
    private final TreeMap<BigInteger, ExitTicket> tickets;

    private Shares queuedShares;
    private BigInteger totalTicketsIssued;
    private BigInteger unclaimedAssets;
    private long lastCheckpointTimestamp;

    public ExitQueue(long claimDelay, long updateDelay) {
        this.claimDelay = claimDelay;
        this.updateDelay = updateDelay;
        this.checkpoints = new ArrayList<>();
        this.tickets = new TreeMap<>();
        this.queuedShares = Shares.zero(Shares.Kind.QUEUED);
        this.totalTicketsIssued = BigInteger.ZERO;
        this.unclaimedAssets = BigInteger.ZERO;
    }

    private ExitQueue(ExitQueue other) {
        this.claimDelay = other.claimDelay;
        this.updateDelay = other.updateDelay;
        this.checkpoints = new ArrayList<>(other.checkpoints);
        this.tickets = new TreeMap<>(other.tickets);
        this.queuedShares = other.queuedShares;
        this.totalTicketsIssued = other.totalTicketsIssued;
        this.unclaimedAssets = other.unclaimedAssets;
        this.lastCheckpointTimestamp = other.lastCheckpointTimestamp;
    }

    public ExitQueue copy() {
        return new ExitQueue(this);
    }

    /**
     * 申请退出，份额转入排队状态（仍计入总份额）
     */
    public ExitTicket enter(Address owner, BigInteger shares, long now) {
        if (shares == null || shares.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_SHARES, "退出份额必须大于0");
        }
        VaultMath.checkUint128(shares, "exit shares");
        BigInteger offset = totalTicketsIssued;
        totalTicketsIssued = VaultMath.checkUint256(totalTicketsIssued.add(shares), "totalTicketsIssued");
        queuedShares = queuedShares.plus(shares);
        ExitTicket ticket = new ExitTicket(offset, shares, now, owner);
        tickets.put(offset, ticket);
        return ticket;
    }

    /**
     * 用可用流动性推进队列
     * 调用方须在同一原子步骤内从总份额/总资产中扣除返回的销毁量
     */
    public AdvanceResult advance(BigInteger availableAssets, ExchangeRate rate, long now) {
        if (queuedShares.isZero() || availableAssets.signum() <= 0 || rate.getTotalAssets().signum() == 0) {
            return AdvanceResult.EMPTY;
        }
        if (updateDelay > 0 && !checkpoints.isEmpty() && now < lastCheckpointTimestamp + updateDelay) {
            log.debug("距上个检查点不足 {} 秒，跳过推进", updateDelay);
            return AdvanceResult.EMPTY;
        }
        BigInteger sharesAtRate = rate.convertToShares(availableAssets);
        BigInteger sharesBurned = sharesAtRate.min(queuedShares.getAmount());
        BigInteger assetsReleased = rate.convertToAssets(sharesBurned);
        if (sharesBurned.signum() == 0 || assetsReleased.signum() == 0) {
            return AdvanceResult.EMPTY;
        }

        Checkpoint last = lastCheckpoint();
        Checkpoint checkpoint = new Checkpoint(
                VaultMath.checkUint128(last.getCumulativeSharesBurned().add(sharesBurned), "cumulativeSharesBurned"),
                VaultMath.checkUint128(last.getCumulativeAssetsReleased().add(assetsReleased), "cumulativeAssetsReleased"));
        queuedShares = queuedShares.minus(sharesBurned);
        checkpoints.add(checkpoint);
        unclaimedAssets = unclaimedAssets.add(assetsReleased);
        lastCheckpointTimestamp = now;
        return new AdvanceResult(sharesBurned, assetsReleased, checkpoints.size() - 1);
    }

    /**
     * 二分查找 cumulativeSharesBurned > offset 的最小下标
     */
    public Optional<Integer> findCheckpoint(BigInteger ticketOffset) {
        int lo = 0;
        int hi = checkpoints.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (checkpoints.get(mid).getCumulativeSharesBurned().compareTo(ticketOffset) > 0) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo < checkpoints.size() ? Optional.of(lo) : Optional.empty();
    }

    /**
     * 结算凭证，已覆盖部分立即兑付，剩余部分以新 offset 留作下次结算
     */
    public SettlementResult settle(Address caller, BigInteger ticketOffset, int checkpointIndex, long now) {
        ExitTicket ticket = getTicket(ticketOffset);
        if (!ticket.getOwner().equals(caller)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "只有凭证持有人可以结算");
        }
        SettlementResult result = previewSettle(ticket, checkpointIndex, now);
        if (result.getExitedShares().signum() == 0) {
            return result;
        }
        tickets.remove(ticketOffset);
        if (result.getRemainingTicket() != null) {
            tickets.put(result.getRemainingTicket().getOffset(), result.getRemainingTicket());
        }
        unclaimedAssets = unclaimedAssets.subtract(result.getExitedAssets());
        return result;
    }

    public SettlementResult previewSettle(BigInteger ticketOffset, int checkpointIndex, long now) {
        return previewSettle(getTicket(ticketOffset), checkpointIndex, now);
    }

    private SettlementResult previewSettle(ExitTicket ticket, int checkpointIndex, long now) {
        if (now < ticket.getRequestedAt() + claimDelay) {
            throw new VaultException(ErrorType.TOO_EARLY, "申请后需等待 " + claimDelay + " 秒才能结算");
        }
        if (checkpointIndex < 0) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT, "checkpointIndex = " + checkpointIndex);
        }
        if (checkpointIndex >= checkpoints.size()) {
            return new SettlementResult(BigInteger.ZERO, BigInteger.ZERO, ticket);
        }
        BigInteger offset = ticket.getOffset();
        if (checkpointIndex > 0
                && checkpoints.get(checkpointIndex - 1).getCumulativeSharesBurned().compareTo(offset) > 0) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT, "检查点 " + checkpointIndex + " 之前已覆盖 offset " + offset);
        }
        if (checkpoints.get(checkpointIndex).getCumulativeSharesBurned().compareTo(offset) <= 0) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT, "检查点 " + checkpointIndex + " 未覆盖 offset " + offset);
        }

        BigInteger ticketEnd = ticket.end();
        BigInteger cursor = offset;
        BigInteger exitedShares = BigInteger.ZERO;
        BigInteger exitedAssets = BigInteger.ZERO;
        for (int i = checkpointIndex; i < checkpoints.size() && cursor.compareTo(ticketEnd) < 0; i++) {
            Checkpoint prev = i == 0 ? null : checkpoints.get(i - 1);
            Checkpoint current = checkpoints.get(i);
            BigInteger prevShares = prev == null ? BigInteger.ZERO : prev.getCumulativeSharesBurned();
            BigInteger prevAssets = prev == null ? BigInteger.ZERO : prev.getCumulativeAssetsReleased();
            BigInteger checkpointShares = current.getCumulativeSharesBurned().subtract(prevShares);
            BigInteger checkpointAssets = current.getCumulativeAssetsReleased().subtract(prevAssets);

            BigInteger end = current.getCumulativeSharesBurned().min(ticketEnd);
            BigInteger portion = end.subtract(cursor);
            // 按该检查点自身的兑换比例折算
            exitedAssets = exitedAssets.add(VaultMath.mulDivDown(portion, checkpointAssets, checkpointShares));
            exitedShares = exitedShares.add(portion);
            cursor = end;
        }
        if (exitedAssets.compareTo(unclaimedAssets) > 0) {
            throw new VaultException(ErrorType.OVER_CLAIM,
                    "结算资产 " + exitedAssets + " 超过待领取资产 " + unclaimedAssets);
        }
        ExitTicket remaining = cursor.compareTo(ticketEnd) < 0
                ? new ExitTicket(cursor, ticketEnd.subtract(cursor), ticket.getRequestedAt(), ticket.getOwner())
                : null;
        return new SettlementResult(exitedShares, exitedAssets, remaining);
    }

    private ExitTicket getTicket(BigInteger ticketOffset) {
        ExitTicket ticket = ticketOffset == null ? null : tickets.get(ticketOffset);
        if (ticket == null) {
            throw new VaultException(ErrorType.INVALID_TICKET, "凭证不存在: " + ticketOffset);
        }
        return ticket;
    }

    private Checkpoint lastCheckpoint() {
        return checkpoints.isEmpty()
                ? new Checkpoint(BigInteger.ZERO, BigInteger.ZERO)
                : checkpoints.get(checkpoints.size() - 1);
    }

    public Optional<ExitTicket> findTicket(BigInteger offset) {
        return Optional.ofNullable(tickets.get(offset));
    }

    public Map<BigInteger, ExitTicket> getTickets() {
        return Collections.unmodifiableMap(tickets);
    }

    public List<Checkpoint> getCheckpoints() {
        return Collections.unmodifiableList(checkpoints);
    }

    public Shares getQueuedShares() {
        return queuedShares;
    }

    public BigInteger getTotalTicketsIssued() {
        return totalTicketsIssued;
    }

    public BigInteger getUnclaimedAssets() {
        return unclaimedAssets;
    }
}
