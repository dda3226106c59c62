package com.bit.bchpool.node.impl;

import com.bit.bchpool.block.BlockTemplate;
import com.bit.bchpool.block.TemplateTransaction;
import com.bit.bchpool.config.PoolConfig;
import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.node.MiningInfo;
import com.bit.bchpool.node.NodeClient;
import com.bit.bchpool.node.SubmitResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 1.0 节点客户端
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pool.node", name = "mode", havingValue = "RPC", matchIfMissing = true)
public class RpcNodeClient implements NodeClient {

    private final PoolConfig.Node settings;
    private final ObjectMapper objectMapper;
    private final RestTemplate restTemplate;
    private final String url;
    private final AtomicLong requestId = new AtomicLong();

    @Autowired
    public RpcNodeClient(PoolConfig config, RestTemplateBuilder builder, ObjectMapper objectMapper) {
        this.settings = config.getNode();
        this.objectMapper = objectMapper;
        this.url = "http://" + settings.getHost() + ":" + settings.getPort() + "/";
        Duration timeout = Duration.ofSeconds(settings.getTimeoutSeconds());
        this.restTemplate = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
        log.info("节点RPC客户端初始化: {}, 超时{}秒", url, settings.getTimeoutSeconds());
    }

    @Override
    public BlockTemplate getBlockTemplate() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("rules", List.of());
        JsonNode result = call("getblocktemplate", List.of(request));
        return parseTemplate(result);
    }

    static BlockTemplate parseTemplate(JsonNode result) {
        if (result == null || !result.isObject()) {
            throw new PoolException(ErrorType.NODE_UNAVAILABLE, "getblocktemplate 返回的模板无效: " + result);
        }
        BlockTemplate template = new BlockTemplate();
        template.setHeight(result.path("height").asLong());
        template.setPreviousBlockHash(result.path("previousblockhash").asText());
        template.setBits(result.path("bits").asText());
        template.setCurTime(result.path("curtime").asLong());
        template.setVersion(result.path("version").asLong());

        List<TemplateTransaction> transactions = new ArrayList<>();
        long fees = 0;
        for (JsonNode tx : result.path("transactions")) {
            String txid = tx.hasNonNull("txid") ? tx.get("txid").asText() : tx.path("hash").asText();
            long fee = tx.path("fee").asLong();
            transactions.add(new TemplateTransaction(txid, fee, tx.path("data").asText()));
            fees += fee;
        }
        template.setTransactions(transactions);
        // coinbasevalue 已含手续费，模板只保存区块补贴
        template.setCoinbaseValue(result.path("coinbasevalue").asLong() - fees);
        template.setSynthetic(false);
        return template;
    }

    @Override
    public SubmitResult submitBlock(String blockHex) {
        JsonNode result = call("submitblock", List.of(blockHex));
        if (result == null || result.isNull()) {
            log.info("节点接受区块提交");
            return SubmitResult.accepted();
        }
        log.warn("节点拒绝区块: {}", result.asText());
        return SubmitResult.rejected(result.asText());
    }

    @Override
    public MiningInfo getMiningInfo() {
        JsonNode result = call("getmininginfo", List.of());
        return new MiningInfo(
                result.path("blocks").asLong(),
                result.path("difficulty").asDouble(),
                result.path("networkhashps").asDouble(),
                result.path("chain").asText());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getBlockchainInfo() {
        return objectMapper.convertValue(call("getblockchaininfo", List.of()), Map.class);
    }

    private JsonNode call(String method, List<?> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "1.0");
        body.put("id", "bch-pool-" + requestId.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String[] credentials = resolveCredentials();
        if (credentials != null) {
            headers.setBasicAuth(credentials[0], credentials[1], StandardCharsets.UTF_8);
        }

        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new PoolException(ErrorType.NODE_UNAVAILABLE, method + " 调用失败: " + e.getMessage(), e);
        }
        return extractResult(method, response);
    }

    /**
     * 取出 JSON-RPC 应答的 result；缺少 result 字段或带 error 时抛 NODE_UNAVAILABLE
     */
    static JsonNode extractResult(String method, JsonNode response) {
        if (response == null) {
            throw new PoolException(ErrorType.NODE_UNAVAILABLE, method + " 返回为空");
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new PoolException(ErrorType.NODE_UNAVAILABLE, method + " 返回错误: " + error);
        }
        if (!response.has("result")) {
            throw new PoolException(ErrorType.NODE_UNAVAILABLE, method + " 应答缺少result字段");
        }
        return response.get("result");
    }

    /**
     * 优先读取节点 .cookie 文件（user:password），否则使用配置的账号
     */
    private String[] resolveCredentials() {
        if (settings.isUseCookie() && settings.getCookiePath() != null && !settings.getCookiePath().isBlank()) {
            Path cookie = Paths.get(settings.getCookiePath());
            try {
                String content = Files.readString(cookie, StandardCharsets.UTF_8).trim();
                int split = content.indexOf(':');
                if (split > 0) {
                    return new String[]{content.substring(0, split), content.substring(split + 1)};
                }
                log.warn("cookie文件格式错误: {}", cookie);
            } catch (IOException e) {
                log.warn("读取cookie文件失败: {}, 改用配置账号", cookie, e);
            }
        }
        if (settings.getUser() != null && settings.getPassword() != null) {
            return new String[]{settings.getUser(), settings.getPassword()};
        }
        return null;
    }
}
