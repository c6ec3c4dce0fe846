package com.bit.vault.journal;

import com.bit.vault.common.Address;
import com.bit.vault.keeper.HarvestParams;
import com.bit.vault.keeper.RewardsUpdateParams;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 操作日志记录：每条对应一次成功的状态变更命令，按序重放即可重建全部状态
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JournalEntry.VaultCreated.class, name = "VAULT_CREATED"),
        @JsonSubTypes.Type(value = JournalEntry.Deposited.class, name = "DEPOSITED"),
        @JsonSubTypes.Type(value = JournalEntry.Redeemed.class, name = "REDEEMED"),
        @JsonSubTypes.Type(value = JournalEntry.PrincipalMoved.class, name = "PRINCIPAL_MOVED"),
        @JsonSubTypes.Type(value = JournalEntry.SideIncomeReceived.class, name = "SIDE_INCOME_RECEIVED"),
        @JsonSubTypes.Type(value = JournalEntry.OracleAdded.class, name = "ORACLE_ADDED"),
        @JsonSubTypes.Type(value = JournalEntry.OracleRemoved.class, name = "ORACLE_REMOVED"),
        @JsonSubTypes.Type(value = JournalEntry.MinOraclesUpdated.class, name = "MIN_ORACLES_UPDATED"),
        @JsonSubTypes.Type(value = JournalEntry.RewardsUpdated.class, name = "REWARDS_UPDATED"),
        @JsonSubTypes.Type(value = JournalEntry.Harvested.class, name = "HARVESTED"),
        @JsonSubTypes.Type(value = JournalEntry.ExitQueueEntered.class, name = "EXIT_QUEUE_ENTERED"),
        @JsonSubTypes.Type(value = JournalEntry.ExitTicketSettled.class, name = "EXIT_TICKET_SETTLED")
})
public abstract class JournalEntry {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class VaultCreated extends JournalEntry {
        private Address vault;
        private Address feeRecipient;
        private int feePercent;
        private boolean ownSideIncomeEscrow;
        private BigInteger securityDeposit;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Deposited extends JournalEntry {
        private Address vault;
        private Address receiver;
        private BigInteger assets;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Redeemed extends JournalEntry {
        private Address vault;
        private Address owner;
        private BigInteger shares;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class PrincipalMoved extends JournalEntry {
        private Address vault;
        private BigInteger amountDelta;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class SideIncomeReceived extends JournalEntry {
        private Address vault;
        private BigInteger amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class OracleAdded extends JournalEntry {
        private Address oracle;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class OracleRemoved extends JournalEntry {
        private Address oracle;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class MinOraclesUpdated extends JournalEntry {
        private int minOracles;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class RewardsUpdated extends JournalEntry {
        private RewardsUpdateParams params;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Harvested extends JournalEntry {
        private HarvestParams params;
        private long timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ExitQueueEntered extends JournalEntry {
        private Address vault;
        private Address owner;
        private BigInteger shares;
        private long timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ExitTicketSettled extends JournalEntry {
        private Address vault;
        private Address caller;
        private BigInteger ticketOffset;
        private int checkpointIndex;
        private long timestamp;
    }
}
