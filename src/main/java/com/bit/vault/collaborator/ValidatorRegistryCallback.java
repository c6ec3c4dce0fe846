package com.bit.vault.collaborator;

import com.bit.vault.common.Address;

import java.math.BigInteger;

/**
 * 验证者注册表回调：本金在金库与验证者之间移动时通知账本
 */
public interface ValidatorRegistryCallback {

    /**
     * @param amountDelta 为负表示从金库部署到验证者，为正表示退回金库
     */
    void onPrincipalMoved(Address vault, BigInteger amountDelta);
}
