package com.github.dimitryivaniuta.money.autoconfigure;

import com.github.dimitryivaniuta.money.format.MoneyFormatOptions;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Application-wide default display options, e.g.
 * <pre>
 * money.format.currency=eur
 * money.format.with-symbol-space=true
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "money.format")
public class MoneyFormatProperties {

    /** Currency table key used when a call does not name one. */
    @NotBlank
    private String currency = "usd";

    private boolean withCents = true;
    private boolean withCurrency = false;
    private boolean withSymbol = true;
    private boolean withSymbolSpace = false;
    private boolean withThousandsSeparator = true;

    public MoneyFormatOptions toOptions() {
        return MoneyFormatOptions.builder()
                .currency(currency.trim())
                .withCents(withCents)
                .withCurrency(withCurrency)
                .withSymbol(withSymbol)
                .withSymbolSpace(withSymbolSpace)
                .withThousandsSeparator(withThousandsSeparator)
                .build();
    }
}
