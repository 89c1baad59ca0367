package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.service.PriceService;
import com.snuffles.pricewatch.service.PriceView;
import com.snuffles.pricewatch.service.ProfitCalculator;
import com.snuffles.pricewatch.service.QueryResult;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import com.snuffles.pricewatch.web.dto.CalculateRequest;
import com.snuffles.pricewatch.web.dto.PriceDto;
import com.snuffles.pricewatch.web.dto.QuoteDto;
import com.snuffles.pricewatch.web.mapper.QuoteMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Gold Price", description = "Latest gold price, intraday history and profit targets")
public class PriceController {

    private final PriceService priceService;
    private final ProfitCalculator profitCalculator;
    private final QuoteMapper quoteMapper;

    @GetMapping("/price")
    @Operation(summary = "Get latest gold price", description = "Returns the latest buffered price with a summary of today's history. Fetches live when the buffer is empty or behind.")
    @ApiResponse(responseCode = "200", description = "Price fetched, or the reason it is unavailable", content = @Content(schema = @Schema(implementation = PriceDto.class)))
    public ApiEnvelope<PriceDto> getPrice() {
        QueryResult<PriceView> result = priceService.getPrice();
        if (!result.isSuccess()) {
            return ApiEnvelope.failure(result.error());
        }
        return ApiEnvelope.ok(quoteMapper.toDto(result.data()));
    }

    @GetMapping("/history")
    @Operation(summary = "Get price history", description = "Returns today's buffered gold prices, oldest first.")
    public ApiEnvelope<List<QuoteDto>> getHistory() {
        QueryResult<List<Quote>> result = priceService.getHistory();
        return ApiEnvelope.ok(quoteMapper.toDtos(result.data()));
    }

    @PostMapping("/calculate")
    @Operation(summary = "Calculate profit targets", description = "Sell prices for fixed profit targets after the sell fee, plus the current realized profit.")
    @ApiResponse(responseCode = "400", description = "Buy price missing or not positive", content = @Content)
    public ApiEnvelope<ProfitCalculator.Calculation> calculate(@Valid @RequestBody CalculateRequest request) {
        return ApiEnvelope.ok(profitCalculator.calculate(request.getBuyPrice(), request.getCurrentPrice()));
    }
}
