package com.bit.vault.database;

import com.bit.vault.config.VaultProperties;

//KV数据库操作 按表隔离 键按无符号字节序排列
public interface DataBase {

    /**
     * 创建数据库
     * @param config 存储配置
     * @return 是否成功
     */
    boolean createDatabase(VaultProperties.Storage config);

    /**
     * 判断是否存在
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 按键顺序遍历
     * @param table 表名
     * @param handler 处理器 返回false停止
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    void close();
}
