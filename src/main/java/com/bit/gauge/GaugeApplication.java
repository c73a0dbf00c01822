package com.bit.gauge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.gauge")
public class GaugeApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(GaugeApplication.class, args);
        log.info("奖励分发引擎启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //金额统一使用BigInteger，向下取整
    //时间统一使用epoch秒
}
