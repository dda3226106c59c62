package com.bit.bchpool.api;

import com.bit.bchpool.result.Result;
import com.bit.bchpool.server.StratumTcpServer;
import com.bit.bchpool.server.StratumWebSocketServer;
import com.bit.bchpool.stratum.StratumSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/stratum")
public class StratumApi {

    @Autowired
    private StratumSessionManager sessionManager;
    @Autowired
    private StratumTcpServer tcpServer;
    @Autowired
    private StratumWebSocketServer webSocketServer;

    @GetMapping("/stats")
    public Result<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>(sessionManager.getStats());
        stats.put("tcpPort", tcpServer.getBoundPort());
        stats.put("websocketPort", webSocketServer.getBoundPort());
        return Result.ok(stats);
    }
}
