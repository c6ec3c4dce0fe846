package com.bit.vault.exitqueue;

import com.bit.vault.common.Address;
import lombok.Data;

import java.math.BigInteger;

/**
 * 退出凭证，占据份额流中的半开区间 [offset, offset + shares)，以 offset 作为凭证ID
 */
@Data
public class ExitTicket {
    private final BigInteger offset;
    private final BigInteger shares;
    private final long requestedAt;
    private final Address owner;

    public BigInteger end() {
        return offset.add(shares);
    }
}
