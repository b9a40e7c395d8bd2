package com.vedant.dataquery.config;

import com.vedant.dataquery.format.FormatReaderRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FormatConfig {

    @Bean
    public FormatReaderRegistry formatReaderRegistry() {
        return FormatReaderRegistry.withDefaults();
    }
}
