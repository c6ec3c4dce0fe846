package com.bit.vault.common;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 收益根哈希（32字节）：对某一时刻全部金库累计收益表的默克尔承诺
 */
public class RewardsRootHash extends ByteHash32 {
    // 初始状态（尚无任何收益根）
    public static final RewardsRootHash ZERO = new RewardsRootHash(new byte[HASH_LENGTH]);

    private RewardsRootHash(byte[] value) {
        super(value);
    }

    public static RewardsRootHash fromBytes(byte[] value) {
        return new RewardsRootHash(value);
    }

    @JsonCreator
    public static RewardsRootHash fromHex(String hex) {
        return new RewardsRootHash(parseHex(hex));
    }
}
