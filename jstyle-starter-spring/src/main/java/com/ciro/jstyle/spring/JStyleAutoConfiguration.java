package com.ciro.jstyle.spring;

import com.ciro.jstyle.LockedStyleSheet;
import com.ciro.jstyle.StyleSheet;
import com.ciro.jstyle.StyleSheetFactory;
import com.ciro.jstyle.tree.StyleTreeReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(JStyleProperties.class)
public class JStyleAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public StyleSheetFactory styleSheetFactory() {
        return new StyleSheetFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public StyleSheet styleSheet(StyleSheetFactory factory) {
        return factory.create();
    }

    // La hoja se comparte entre peticiones: todo acceso pasa por el lock
    @Bean
    @ConditionalOnMissingBean
    public LockedStyleSheet lockedStyleSheet(StyleSheet styleSheet) {
        return new LockedStyleSheet(styleSheet);
    }

    @Bean
    @ConditionalOnMissingBean
    public StyleTreeReader styleTreeReader(ObjectProvider<ObjectMapper> mapper) {
        return new StyleTreeReader(mapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(name = "jstyle.enabled", havingValue = "true", matchIfMissing = true)
    public StyleSheetController styleSheetController(LockedStyleSheet sheet,
                                                     StyleTreeReader reader,
                                                     JStyleProperties properties) {
        return new StyleSheetController(sheet, reader, properties);
    }
}
