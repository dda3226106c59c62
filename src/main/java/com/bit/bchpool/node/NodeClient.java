package com.bit.bchpool.node;

import com.bit.bchpool.block.BlockTemplate;

import java.util.Map;

/**
 * 区块链节点客户端
 * 节点不可用时抛出 PoolException(NODE_UNAVAILABLE)
 */
public interface NodeClient {

    BlockTemplate getBlockTemplate();

    SubmitResult submitBlock(String blockHex);

    MiningInfo getMiningInfo();

    Map<String, Object> getBlockchainInfo();
}
