package com.bit.bchpool.database.rocksDb;


import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表枚举 -> 列族句柄映射，每个数据库实例一份
 */
@Slf4j
public class RTable {
    private final Map<TableEnum, ColumnFamilyHandle> tableToCfMap = new EnumMap<>(TableEnum.class);
    private final Map<TableEnum, ColumnFamilyOptions> tableOptions = new EnumMap<>(TableEnum.class);

    /**
     * 根据表枚举获取列族句柄
     */
    public ColumnFamilyHandle getColumnFamilyHandle(TableEnum tableEnum) {
        if (tableEnum == null) {
            log.warn("表枚举为空，无法获取列族句柄");
            return null;
        }
        return tableToCfMap.get(tableEnum);
    }

    /**
     * 绑定列族句柄（数据库初始化时调用）
     */
    public void setColumnFamilyHandle(TableEnum tableEnum, ColumnFamilyHandle handle) {
        if (tableEnum == null || handle == null) {
            log.warn("绑定列族句柄失败：表枚举或句柄为空");
            return;
        }
        tableToCfMap.put(tableEnum, handle);
    }

    /**
     * 所有列族描述符，按 TableEnum 定义顺序
     */
    public Map<TableEnum, ColumnFamilyDescriptor> getColumnFamilyDescriptors() {
        Map<TableEnum, ColumnFamilyDescriptor> descriptors = new LinkedHashMap<>();
        for (TableEnum table : TableEnum.values()) {
            ColumnFamilyOptions options = tableOptions.computeIfAbsent(table, TableEnum::newColumnFamilyOptions);
            descriptors.put(table, new ColumnFamilyDescriptor(
                    table.getColumnFamilyName().getBytes(StandardCharsets.UTF_8), options));
        }
        return descriptors;
    }

    /**
     * 释放列族句柄，需在关闭数据库之前调用
     */
    public void closeHandles() {
        for (Map.Entry<TableEnum, ColumnFamilyHandle> entry : tableToCfMap.entrySet()) {
            entry.getValue().close();
            log.debug("已关闭表[{}]的列族句柄", entry.getKey());
        }
        tableToCfMap.clear();
    }

    /**
     * 释放列族配置，需在关闭数据库之后调用
     */
    public void closeOptions() {
        for (ColumnFamilyOptions options : tableOptions.values()) {
            options.close();
        }
        tableOptions.clear();
    }
}
