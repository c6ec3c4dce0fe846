package com.bit.vault.api;

import com.bit.vault.api.dto.MinOraclesRequest;
import com.bit.vault.api.dto.OracleRequest;
import com.bit.vault.api.dto.RewardsUpdateRequest;
import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRootHash;
import com.bit.vault.keeper.RewardConsensusLedger;
import com.bit.vault.keeper.RewardRecord;
import com.bit.vault.keeper.RewardsRoot;
import com.bit.vault.keeper.RewardsUpdateParams;
import com.bit.vault.oracle.OracleRegistry;
import com.bit.vault.result.Result;
import com.bit.vault.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/keeper")
public class KeeperApi {

    @Autowired
    private RewardConsensusLedger rewardLedger;

    @Autowired
    private OracleRegistry oracleRegistry;

    @Autowired
    private Clock clock;

    // 预言机法定人数提交新收益根
    @PostMapping("/updateRewards")
    public Result<RewardsRoot> updateRewards(@RequestBody RewardsUpdateRequest request) {
        RewardsUpdateParams params = new RewardsUpdateParams(
                RewardsRootHash.fromHex(request.getRewardsRoot()),
                request.getRewardsIpfsHash(),
                request.getAvgRewardPerSecond(),
                request.getUpdateTimestamp(),
                ByteUtils.hexToBytes(request.getSignatures()));
        return Result.OK(rewardLedger.updateRewards(params));
    }

    @GetMapping("/rewardsRoot")
    public Result<RewardsRoot> getRewardsRoot() {
        return Result.OK(rewardLedger.getRewardsRoot());
    }

    @GetMapping("/canUpdateRewards")
    public Result<Boolean> canUpdateRewards() {
        return Result.OK(rewardLedger.canUpdateRewards(clock.instant().getEpochSecond()));
    }

    // 金库收割状态
    @GetMapping("/vault")
    public Result<Map<String, Object>> getVaultState(@RequestParam String vault) {
        Address address = Address.fromHex(vault);
        RewardRecord rewards = rewardLedger.getRewardRecord(address);
        RewardRecord sideIncome = rewardLedger.getSideIncomeRecord(address);
        Map<String, Object> state = new HashMap<>();
        state.put("reward", rewards.getValue());
        state.put("rewardNonce", rewards.getNonce());
        state.put("unlockedSideIncome", sideIncome.getValue());
        state.put("sideIncomeNonce", sideIncome.getNonce());
        state.put("canHarvest", rewardLedger.canHarvest(address));
        state.put("harvestRequired", rewardLedger.isHarvestRequired(address));
        state.put("collateralized", rewardLedger.isCollateralized(address));
        return Result.OK(state);
    }

    @GetMapping("/oracles")
    public Result<Set<Address>> getOracles() {
        return Result.OK(oracleRegistry.getOracles());
    }

    // 管理签名需要的当前序号
    @GetMapping("/oracles/adminNonce")
    public Result<Long> getAdminNonce() {
        return Result.OK(oracleRegistry.getAdminNonce());
    }

    @PostMapping("/oracles/add")
    public Result<Void> addOracle(@RequestBody OracleRequest request) {
        oracleRegistry.addOracle(Address.fromHex(request.getOracle()), signature(request.getSignature()));
        return Result.OK();
    }

    @PostMapping("/oracles/remove")
    public Result<Void> removeOracle(@RequestBody OracleRequest request) {
        oracleRegistry.removeOracle(Address.fromHex(request.getOracle()), signature(request.getSignature()));
        return Result.OK();
    }

    @PostMapping("/oracles/min")
    public Result<Integer> setMinOracles(@RequestBody MinOraclesRequest request) {
        oracleRegistry.setMinOracles(request.getMinOracles(), signature(request.getSignature()));
        return Result.OK(request.getMinOracles());
    }

    private static byte[] signature(String hex) {
        return hex == null ? null : ByteUtils.hexToBytes(hex);
    }
}
