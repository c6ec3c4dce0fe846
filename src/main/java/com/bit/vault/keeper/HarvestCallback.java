package com.bit.vault.keeper;

/**
 * 在收割结果落库之前执行；回调抛出异常则收割记录不会被更新
 *
 * @param <T> 回调产出的结果，原样作为收割调用的返回值
 */
@FunctionalInterface
public interface HarvestCallback<T> {
    T apply(HarvestResult result);
}
