package com.github.dimitryivaniuta.money.autoconfigure;

import com.github.dimitryivaniuta.money.currency.CurrencyCatalog;
import com.github.dimitryivaniuta.money.currency.EmbeddedCurrencyCatalog;
import com.github.dimitryivaniuta.money.format.MoneyFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes the embedded currency table and a {@link MoneyFormatter} configured from money.format.*.
 * Both beans back off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(MoneyFormatter.class)
@EnableConfigurationProperties({
        MoneyFormatProperties.class
})
public class MoneyFormatAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CurrencyCatalog currencyCatalog() {
        return EmbeddedCurrencyCatalog.defaultCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public MoneyFormatter moneyFormatter(CurrencyCatalog currencyCatalog, MoneyFormatProperties props) {
        MoneyFormatter formatter = new MoneyFormatter(currencyCatalog, props.toOptions());
        log.info("MoneyFormatter initialized currency={} currencies={}", props.getCurrency(), currencyCatalog.size());
        return formatter;
    }
}
