package com.bit.bchpool.database;

import com.bit.bchpool.database.rocksDb.TableEnum;

//KV数据库操作 按表隔离 自带内存缓存
public interface DataBase {

    /**
     * 创建（或打开）数据库
     * @param path 数据目录
     * @return 是否成功
     */
    boolean createDatabase(String path);

    /**
     * 关闭数据库
     */
    boolean closeDatabase();

    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 覆盖写入
     */
    void update(TableEnum table, byte[] key, byte[] value);

    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 迭代器遍历，避免一次性加载全部数据
     * @param reverse 是否从最大键开始
     */
    void iterate(TableEnum table, boolean reverse, KeyValueHandler handler);
}
