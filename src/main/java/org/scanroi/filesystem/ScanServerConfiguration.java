package org.scanroi.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 扫描归约服务的 Bean 装配：把 {@link ScanServerProperties} 注入到路径解析器与会话存储中。
 */
@Configuration(proxyBeanMethods = false)
public class ScanServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(ScanServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public ScanSessionStore scanSessionStore(ScanServerProperties properties) {
        return new ScanSessionStore(properties.getSessionTtl(), properties.getMaxSessions());
    }
}
