package com.transferengine.api.controller;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import com.transferengine.providers.ExchangeRate;
import com.transferengine.providers.FXProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for currencies and exchange rates.
 */
@RestController
@RequestMapping("/api/v1/currencies")
@RequiredArgsConstructor
@Tag(name = "Currencies", description = "Supported currencies and exchange rates")
public class CurrencyController {

    private final FXProvider fxProvider;

    @GetMapping
    @Operation(summary = "List supported currencies with their minor-unit scale")
    public ResponseEntity<Map<Currency, Integer>> getSupportedCurrencies() {
        Map<Currency, Integer> currencies = new LinkedHashMap<>();
        fxProvider.getSupportedCurrencies().forEach(c -> currencies.put(c, c.getScale()));
        return ResponseEntity.ok(currencies);
    }

    @GetMapping("/source")
    @Operation(summary = "Name of the rate source that served the latest lookup")
    public ResponseEntity<Map<String, String>> getActiveSource() {
        return ResponseEntity.ok(Map.of("activeSource", fxProvider.getActiveSourceName()));
    }

    @GetMapping("/convert")
    @Operation(summary = "Convert an amount at the current exchange rate")
    public ResponseEntity<Money> convert(@RequestParam BigDecimal amount,
                                         @RequestParam String from,
                                         @RequestParam String to) {
        Money money = Money.of(amount, Currency.fromCode(from));
        return ResponseEntity.ok(fxProvider.convert(money, Currency.fromCode(to)));
    }

    @GetMapping("/rate")
    @Operation(summary = "Get the current exchange rate between two currencies")
    public ResponseEntity<ExchangeRate> getRate(@RequestParam String from, @RequestParam String to) {
        return ResponseEntity.ok(fxProvider.getRate(Currency.fromCode(from), Currency.fromCode(to)));
    }
}
