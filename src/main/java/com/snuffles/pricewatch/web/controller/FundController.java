package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.service.FundService;
import com.snuffles.pricewatch.service.QueryResult;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import com.snuffles.pricewatch.web.dto.FundAddRequest;
import com.snuffles.pricewatch.web.dto.QuoteDto;
import com.snuffles.pricewatch.web.mapper.QuoteMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/funds")
@RequiredArgsConstructor
@Tag(name = "Funds", description = "Fund watchlist with estimated NAVs and portfolio breakdowns")
public class FundController {

    private final FundService fundService;
    private final QuoteMapper quoteMapper;

    @GetMapping
    @Operation(summary = "List watched funds", description = "Quotes for every watched fund in watchlist order. In fast mode stale cached quotes are served and refreshed in the background.")
    public ApiEnvelope<List<QuoteDto>> getFunds(@RequestParam(defaultValue = "false") boolean fast) {
        return ApiEnvelope.ok(quoteMapper.toDtos(fundService.getFunds(fast).data()));
    }

    @PostMapping("/add")
    @Operation(summary = "Add a fund", description = "Validates the code with a live fetch and adds it to the watchlist.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Fund added"),
        @ApiResponse(responseCode = "400", description = "Invalid, duplicate or unknown fund code")
    })
    public ApiEnvelope<QuoteDto> addFund(@Valid @RequestBody FundAddRequest request) {
        return ApiEnvelope.ok(quoteMapper.toDto(fundService.addFund(request.getCode())));
    }

    @DeleteMapping("/{code}")
    @Operation(summary = "Remove a fund", description = "Removes the fund from the watchlist and drops its cached quote.")
    @ApiResponse(responseCode = "404", description = "Fund not in watchlist")
    public ApiEnvelope<Void> deleteFund(@PathVariable String code) {
        fundService.deleteFund(code);
        return ApiEnvelope.ok(null);
    }

    @GetMapping("/{code}/portfolio")
    @Operation(summary = "Get fund portfolio", description = "Top stock positions from the fund's latest report. Cached for a day unless refresh is set.")
    public ApiEnvelope<FundPortfolio> getFundPortfolio(
        @PathVariable String code,
        @RequestParam(defaultValue = "false") boolean refresh
    ) {
        QueryResult<FundPortfolio> result = fundService.getFundPortfolio(code, refresh);
        if (!result.isSuccess()) {
            return ApiEnvelope.failure(result.error());
        }
        return ApiEnvelope.ok(result.data());
    }
}
