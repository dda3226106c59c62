package com.bit.bchpool.database.rocksDb;

import lombok.Getter;

import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyOptions;


/**
 * 表枚举（集中管理所有表的元信息）
 */
public enum TableEnum {
    // 矿工表：地址 -> 矿工
    MINER(
            "miner",
            10_000,   //缓存条数
            60 * 60   //缓存时长 秒
    ),
    // 份额表：时间序号 -> 份额，只追加
    SHARE(
            "share",
            1_000,
            10 * 60
    ),
    // 区块表：高度 -> 找到的区块
    BLOCK(
            "block",
            1_000,
            60 * 60
    );

    @Getter private final String columnFamilyName;  // 列族实际存储名称
    @Getter private final long cacheSize;  // 缓存条数
    @Getter private final long cacheTL;  // 缓存时长 单位秒

    TableEnum(String columnFamilyName, long cacheSize, long cacheTL) {
        this.columnFamilyName = columnFamilyName;
        this.cacheSize = cacheSize;
        this.cacheTL = cacheTL;
    }

    /**
     * 列族配置，每次打开数据库时新建（原生对象随数据库一起释放）
     */
    public ColumnFamilyOptions newColumnFamilyOptions() {
        ColumnFamilyOptions options = new ColumnFamilyOptions();
        if (this == MINER) {
            // 按地址点查为主，加布隆过滤器减少磁盘IO
            options.setTableFormatConfig(new BlockBasedTableConfig()
                    .setFilterPolicy(new BloomFilter(10, false))
                    .setCacheIndexAndFilterBlocks(true));
        }
        return options;
    }
}
