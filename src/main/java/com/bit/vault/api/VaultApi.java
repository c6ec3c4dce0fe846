package com.bit.vault.api;

import com.bit.vault.api.dto.CreateVaultRequest;
import com.bit.vault.api.dto.DepositRequest;
import com.bit.vault.api.dto.EnterExitQueueRequest;
import com.bit.vault.api.dto.HarvestRequest;
import com.bit.vault.api.dto.PrincipalMovedRequest;
import com.bit.vault.api.dto.RedeemRequest;
import com.bit.vault.api.dto.SettleRequest;
import com.bit.vault.api.dto.SideIncomeRequest;
import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.common.RewardsRootHash;
import com.bit.vault.config.VaultProperties;
import com.bit.vault.exitqueue.Checkpoint;
import com.bit.vault.exitqueue.ExitTicket;
import com.bit.vault.exitqueue.SettlementResult;
import com.bit.vault.keeper.HarvestParams;
import com.bit.vault.result.Result;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.CallerSignatures;
import com.bit.vault.vault.HarvestSettlement;
import com.bit.vault.vault.VaultService;
import com.bit.vault.vault.VaultSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/vault")
public class VaultApi {

    @Autowired
    private VaultService vaultService;

    @Autowired
    private VaultProperties properties;

    @Autowired
    private Clock clock;

    // 创建金库
    @PostMapping("/create")
    public Result<VaultSnapshot> createVault(@RequestBody CreateVaultRequest request) {
        return Result.OK(vaultService.createVault(Address.fromHex(request.getVault()),
                Address.fromHex(request.getFeeRecipient()), request.getFeePercent(), request.isOwnSideIncomeEscrow()));
    }

    // 存入资产，返回铸造的份额
    @PostMapping("/deposit")
    public Result<BigInteger> deposit(@RequestBody DepositRequest request) {
        return Result.OK(vaultService.deposit(Address.fromHex(request.getVault()),
                Address.fromHex(request.getReceiver()), request.getAssets()));
    }

    // 未抵押金库即时赎回
    @PostMapping("/redeem")
    public Result<BigInteger> redeem(@RequestBody RedeemRequest request) {
        return Result.OK(vaultService.redeem(Address.fromHex(request.getVault()),
                Address.fromHex(request.getOwner()), request.getShares()));
    }

    @PostMapping("/sideIncome")
    public Result<Void> receiveSideIncome(@RequestBody SideIncomeRequest request) {
        vaultService.receiveSideIncome(Address.fromHex(request.getVault()), request.getAmount());
        return Result.OK();
    }

    // 验证者注册表回调
    @PostMapping("/principalMoved")
    public Result<Void> principalMoved(@RequestBody PrincipalMovedRequest request) {
        vaultService.onPrincipalMoved(Address.fromHex(request.getVault()), request.getAmountDelta());
        return Result.OK();
    }

    @PostMapping("/harvest")
    public Result<HarvestSettlement> harvestAndSettle(@RequestBody HarvestRequest request) {
        List<byte[]> proof = new ArrayList<>();
        if (request.getProof() != null) {
            for (String node : request.getProof()) {
                proof.add(ByteUtils.hexToBytes(node));
            }
        }
        HarvestParams params = new HarvestParams(
                Address.fromHex(request.getVault()),
                RewardsRootHash.fromHex(request.getRewardsRoot()),
                request.getReward(),
                request.getUnlockedSideIncome(),
                proof);
        return Result.OK(vaultService.harvestAndSettle(params, now()));
    }

    @PostMapping("/exitQueue/enter")
    public Result<ExitTicket> enterExitQueue(@RequestBody EnterExitQueueRequest request) {
        return Result.OK(vaultService.enterExitQueue(Address.fromHex(request.getVault()),
                Address.fromHex(request.getOwner()), request.getShares(), now()));
    }

    @PostMapping("/exitQueue/settle")
    public Result<SettlementResult> settleExitTicket(@RequestBody SettleRequest request) {
        Address vault = Address.fromHex(request.getVault());
        if (request.getTicketOffset() == null) {
            throw new IllegalArgumentException("ticketOffset不能为空");
        }
        // 凭证结算后 offset 不再存在，签名无法重放
        byte[] digest = settleDigest(properties.getKeeper().getChainId(), vault,
                request.getTicketOffset(), request.getCheckpointIndex());
        Address caller = CallerSignatures.recover(digest,
                request.getSignature() == null ? null : ByteUtils.hexToBytes(request.getSignature()));
        return Result.OK(vaultService.settleExitTicket(vault, caller, request.getTicketOffset(),
                request.getCheckpointIndex(), now()));
    }

    public static byte[] settleDigest(long chainId, Address vault, BigInteger ticketOffset, int checkpointIndex) {
        return CallerSignatures.digest(chainId, "settleExitTicket", CallerSignatures.word(vault),
                ByteUtils.toWord(ticketOffset), ByteUtils.toWord(checkpointIndex));
    }

    // 凭证所在检查点下标，尚未覆盖时返回 -1
    @GetMapping("/exitQueue/index")
    public Result<Integer> getExitQueueIndex(@RequestParam String vault, @RequestParam BigInteger ticketOffset) {
        return Result.OK(vaultService.getExitQueueIndex(Address.fromHex(vault), ticketOffset).orElse(-1));
    }

    @GetMapping("/exitQueue/preview")
    public Result<SettlementResult> previewSettlement(@RequestParam String vault,
                                                      @RequestParam BigInteger ticketOffset,
                                                      @RequestParam int checkpointIndex) {
        return Result.OK(vaultService.previewSettlement(Address.fromHex(vault), ticketOffset, checkpointIndex, now()));
    }

    @GetMapping("/exitQueue/ticket")
    public Result<ExitTicket> getExitTicket(@RequestParam String vault, @RequestParam BigInteger ticketOffset) {
        return vaultService.getExitTicket(Address.fromHex(vault), ticketOffset)
                .map(Result::OK)
                .orElseGet(() -> Result.error(404, "凭证不存在"));
    }

    @GetMapping("/exitQueue/checkpoints")
    public Result<List<Checkpoint>> getCheckpoints(@RequestParam String vault) {
        return Result.OK(vaultService.getCheckpoints(Address.fromHex(vault)));
    }

    @GetMapping("/detail")
    public Result<VaultSnapshot> getVault(@RequestParam String vault) {
        return Result.OK(vaultService.getVault(Address.fromHex(vault)));
    }

    @GetMapping("/exchangeRate")
    public Result<ExchangeRate> getExchangeRate(@RequestParam String vault) {
        return Result.OK(vaultService.getExchangeRate(Address.fromHex(vault)));
    }

    @GetMapping("/balance")
    public Result<BigInteger> balanceOf(@RequestParam String vault, @RequestParam String holder) {
        return Result.OK(vaultService.balanceOf(Address.fromHex(vault), Address.fromHex(holder)));
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
