package org.treeforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TreeForgeApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(TreeForgeApplication.class, args);
    }

    /**
     * 提前创建日志目录，避免 RollingFileAppender 因目录不存在而初始化失败。
     * <p>
     * 与 logback-spring.xml 的规则一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs。
     * stdout 是 MCP 通道，失败时只能写 stderr。
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
            System.err.println("创建日志目录失败：" + logPath + "（" + e.getMessage() + "）");
        }
    }
}
