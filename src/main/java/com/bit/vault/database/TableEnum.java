package com.bit.vault.database;

import lombok.Getter;

/**
 * 表枚举（每个表对应一个列族）
 */
public enum TableEnum {
    JOURNAL("journal");   // 操作日志表，键为8字节大端序号

    @Getter
    private final String columnFamilyName;

    TableEnum(String columnFamilyName) {
        this.columnFamilyName = columnFamilyName;
    }
}
