package org.sanchez.source;

import org.sanchez.render.RenderOptionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * 源文件解析服务的 Bean 装配。
 * <p>
 * 这里不引入任何数据库/外部依赖，全部基于本地文件系统。
 */
@Configuration(proxyBeanMethods = false)
public class SourceResolverConfiguration {

    @Bean
    public SourceResolver sourceResolver(SourceResolverProperties properties) {
        return new SourceResolver(Path.of(properties.getWorkingDirectory()));
    }

    @Bean
    public RenderOptionFactory renderOptionFactory(SourceResolverProperties properties) {
        return new RenderOptionFactory(
                properties.getDefaultBrightness(),
                properties.getDefaultSaturation(),
                properties.getDefaultTint()
        );
    }
}
