package org.treeforge.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.treeforge.apply.TreeForgePipeline;
import org.treeforge.session.TreeSessionStore;

/**
 * TreeForge 的 Bean 装配。
 * <p>
 * 把配置 {@link TreeForgeProperties} 注入到安全路径解析器、会话存储与处理流程中。
 * 全部基于本地文件系统，不引入数据库等外部依赖。
 */
@Configuration(proxyBeanMethods = false)
public class TreeForgeConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(TreeForgeProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public TreeSessionStore treeSessionStore(TreeForgeProperties properties) {
        return new TreeSessionStore(properties.getSessionTtl(), properties.getMaxSessions());
    }

    @Bean
    public TreeForgePipeline treeForgePipeline(
            SecurePathResolver pathResolver,
            TreeSessionStore sessionStore,
            TreeForgeProperties properties
    ) {
        return new TreeForgePipeline(pathResolver, sessionStore, properties);
    }
}
