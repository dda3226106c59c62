package com.bit.bchpool.stratum;

import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;
import com.bit.bchpool.stratum.message.AuthorizeRequest;
import com.bit.bchpool.stratum.message.GetTransactionsRequest;
import com.bit.bchpool.stratum.message.InvalidRequest;
import com.bit.bchpool.stratum.message.StratumRequest;
import com.bit.bchpool.stratum.message.SubmitRequest;
import com.bit.bchpool.stratum.message.SubscribeRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * stratum JSON 编解码，在协议边界一次性解码成具体请求类型
 */
public final class StratumCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StratumCodec() {
    }

    /**
     * @throws PoolException 报文不是JSON对象（PROTOCOL_ERROR）
     */
    public static StratumRequest decode(String line) {
        JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new PoolException(ErrorType.PROTOCOL_ERROR, "无法解析的报文: " + abbreviate(line), e);
        }
        if (root == null || !root.isObject()) {
            throw new PoolException(ErrorType.PROTOCOL_ERROR, "报文不是JSON对象: " + abbreviate(line));
        }

        Object id = MAPPER.convertValue(root.get("id"), Object.class);
        JsonNode methodNode = root.get("method");
        JsonNode params = root.path("params");
        if (methodNode == null || !methodNode.isTextual()) {
            return invalid(id, null, "Missing method");
        }
        String methodName = methodNode.asText();
        StratumMethod method = StratumMethod.fromWireName(methodName);
        if (method == null || method == StratumMethod.NOTIFY || method == StratumMethod.SET_DIFFICULTY) {
            return invalid(id, methodName, "Unknown method " + methodName);
        }

        StratumRequest request;
        switch (method) {
            case SUBSCRIBE: {
                SubscribeRequest subscribe = new SubscribeRequest();
                subscribe.setUserAgent(textParam(params, 0));
                request = subscribe;
                break;
            }
            case AUTHORIZE: {
                String username = textParam(params, 0);
                if (username == null || username.isEmpty()) {
                    return invalid(id, methodName, "Invalid params: username required");
                }
                AuthorizeRequest authorize = new AuthorizeRequest();
                authorize.setUsername(username);
                authorize.setPassword(textParam(params, 1));
                request = authorize;
                break;
            }
            case SUBMIT: {
                if (!params.isArray() || params.size() < 5) {
                    return invalid(id, methodName, "Invalid params: expected 5 parameters");
                }
                for (int i = 0; i < 5; i++) {
                    if (!params.get(i).isTextual()) {
                        return invalid(id, methodName, "Invalid params: parameter " + i + " must be a string");
                    }
                }
                SubmitRequest submit = new SubmitRequest();
                submit.setWorkerName(params.get(0).asText());
                submit.setJobId(params.get(1).asText());
                submit.setExtraNonce2(params.get(2).asText());
                submit.setNtime(params.get(3).asText());
                submit.setNonce(params.get(4).asText());
                request = submit;
                break;
            }
            default:
                request = new GetTransactionsRequest();
                break;
        }
        request.setId(id);
        return request;
    }

    public static String encodeResponse(Object id, Object result, List<Object> error) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", id);
        response.put("result", result);
        response.put("error", error);
        return write(response);
    }

    public static String encodeNotification(StratumMethod method, List<?> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("id", null);
        notification.put("method", method.getWireName());
        notification.put("params", params);
        return write(notification);
    }

    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PoolException(ErrorType.PROTOCOL_ERROR, "无法解析的报文: " + abbreviate(json), e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PoolException(ErrorType.PROTOCOL_ERROR, "报文序列化失败", e);
        }
    }

    private static String textParam(JsonNode params, int index) {
        if (!params.isArray() || params.size() <= index) {
            return null;
        }
        JsonNode node = params.get(index);
        return node.isTextual() ? node.asText() : null;
    }

    private static InvalidRequest invalid(Object id, String methodName, String reason) {
        InvalidRequest request = new InvalidRequest();
        request.setId(id);
        request.setMethodName(methodName);
        request.setReason(reason);
        return request;
    }

    private static String abbreviate(String line) {
        if (line == null) {
            return "null";
        }
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }
}
