package com.bit.bchpool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.bchpool")
public class BchPoolApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(BchPoolApplication.class, args);
        log.info("矿池启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //哈希显示顺序统一大端 区块内部字节序统一小端
}
