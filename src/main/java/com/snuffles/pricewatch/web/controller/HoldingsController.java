package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.service.HoldingsService;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import com.snuffles.pricewatch.web.dto.HoldingRequest;
import com.snuffles.pricewatch.web.dto.HoldingsReportDto;
import com.snuffles.pricewatch.web.mapper.HoldingsMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
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

@RestController
@RequestMapping("/api/holdings")
@RequiredArgsConstructor
@Tag(name = "Holdings", description = "Fund positions valued at the latest estimated NAV")
public class HoldingsController {

    private final HoldingsService holdingsService;
    private final HoldingsMapper holdingsMapper;

    @GetMapping
    @Operation(summary = "Get holdings", description = "Per-holding and total cost, value and profit. Fast mode serves the cached report unless refresh is set.")
    @ApiResponse(responseCode = "200", description = "Holdings valued", content = @Content(schema = @Schema(implementation = HoldingsReportDto.class)))
    public ApiEnvelope<HoldingsReportDto> getHoldings(
        @RequestParam(defaultValue = "false") boolean fast,
        @RequestParam(defaultValue = "false") boolean refresh
    ) {
        return ApiEnvelope.ok(holdingsMapper.toDto(holdingsService.getHoldings(fast, refresh).data()));
    }

    @PostMapping
    @Operation(summary = "Add or update a holding", description = "Creates the holding or replaces cost, shares and note of an existing one.")
    @ApiResponse(responseCode = "400", description = "Invalid code, cost price or shares", content = @Content)
    public ApiEnvelope<FundHolding> saveHolding(@Valid @RequestBody HoldingRequest request) {
        FundHolding saved = holdingsService.saveHolding(request.getCode(), request.getCostPrice(), request.getShares(), request.getNote());
        return ApiEnvelope.ok(saved, "Holding saved");
    }

    @DeleteMapping("/{code}")
    @Operation(summary = "Delete a holding")
    @ApiResponse(responseCode = "404", description = "No such holding", content = @Content)
    public ApiEnvelope<Void> deleteHolding(@PathVariable String code) {
        holdingsService.deleteHolding(code);
        return ApiEnvelope.ok(null, "Holding deleted");
    }
}
