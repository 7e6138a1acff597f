package ir.ipaam.layoutservice.config;

import ir.ipaam.layoutservice.application.service.hyphenation.DictionaryHyphenator;
import ir.ipaam.layoutservice.domain.text.Hyphenator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(LayoutProperties.class)
public class LayoutConfig {

    @Bean
    @ConditionalOnProperty(prefix = "layout.hyphenation", name = "enabled", havingValue = "true")
    public Hyphenator hyphenator(LayoutProperties properties) {
        LayoutProperties.Hyphenation settings = properties.getHyphenation();
        log.info("Hyphenation enabled for {} with {} dictionary entries",
                settings.getLocale(), settings.getDictionary().size());
        return new DictionaryHyphenator(properties.hyphenationLocale(), settings.getDictionary());
    }
}
