package org.sanchez;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SanchezResolverApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(SanchezResolverApplication.class, args);
    }

    /**
     * 提前创建日志目录（logback-spring.xml 中的文件 appender 需要目录存在）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs。
     * stdout 被 MCP stdio 协议占用，失败时只能输出到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("无法创建日志目录：" + logPath + "（" + e.getMessage() + "）");
        }
    }
}
