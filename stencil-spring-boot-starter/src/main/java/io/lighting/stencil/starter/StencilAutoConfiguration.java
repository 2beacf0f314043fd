package io.lighting.stencil.starter;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.filter.FilterRegistry;
import io.lighting.stencil.filter.Filters;
import io.lighting.stencil.loader.TemplateLoader;
import io.lighting.stencil.observe.TemplateLog;
import io.lighting.stencil.observe.TemplateObserver;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;

@AutoConfiguration
@ConditionalOnClass(Stencil.class)
@EnableConfigurationProperties(StencilProperties.class)
public class StencilAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(StencilAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TemplateLoader templateLoader(ResourceLoader resourceLoader, StencilProperties properties) {
        return new ResourceTemplateLoader(
            resourceLoader,
            properties.getTemplateLocation(),
            Charset.forName(properties.getCharset())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterRegistry filterRegistry() {
        return Filters.global();
    }

    @Bean
    @ConditionalOnMissingBean
    public List<TemplateObserver> templateObservers(StencilProperties properties) {
        TemplateLog templateLog = properties.getLog().build(LOGGER::info);
        if (templateLog == null) {
            return List.of();
        }
        List<TemplateObserver> observers = new ArrayList<>();
        observers.add(templateLog);
        return observers;
    }

    @Bean
    @ConditionalOnMissingBean
    public Stencil stencil(
        TemplateLoader templateLoader,
        FilterRegistry filterRegistry,
        List<TemplateObserver> templateObservers,
        StencilProperties properties
    ) {
        return Stencil.builder()
            .loader(templateLoader)
            .filters(filterRegistry)
            .autoescape(properties.isAutoescape())
            .cleanLines(properties.isCleanLines())
            .cache(properties.isCache())
            .maxIncludeDepth(properties.getMaxIncludeDepth())
            .observers(templateObservers)
            .build();
    }
}
