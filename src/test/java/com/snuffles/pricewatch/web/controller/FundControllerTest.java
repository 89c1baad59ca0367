package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.service.FundService;
import com.snuffles.pricewatch.service.QueryResult;
import com.snuffles.pricewatch.service.exception.ResourceNotFoundException;
import com.snuffles.pricewatch.service.exception.ValidationException;
import com.snuffles.pricewatch.web.mapper.QuoteMapperImpl;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FundController.class)
@Import(QuoteMapperImpl.class)
class FundControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FundService fundService;

    @Test
    void listsFundsWithFastFlag() throws Exception {
        Quote stale = Quote.builder().code("161725").name("Liquor Index").price(new BigDecimal("1.0631"))
            .source("Tiantian Fund" + Quote.STALE_MARKER).build();
        given(fundService.getFunds(true)).willReturn(QueryResult.ok(List.of(stale, Quote.failed("110011"))));

        mockMvc.perform(get("/api/funds").param("fast", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].source").value("Tiantian Fund(stale)"))
            .andExpect(jsonPath("$.data[1].name").value("Load failed"))
            .andExpect(jsonPath("$.data[1].source").value("Error"));
    }

    @Test
    void addFundReturnsQuote() throws Exception {
        given(fundService.addFund("161725")).willReturn(
            Quote.builder().code("161725").name("Liquor Index").price(new BigDecimal("1.0631")).source("Tiantian Fund").build());

        mockMvc.perform(post("/api/funds/add").contentType(MediaType.APPLICATION_JSON).content("{\"code\":\"161725\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.name").value("Liquor Index"));
    }

    @Test
    void addFundWithUnknownCodeIsBadRequest() throws Exception {
        given(fundService.addFund("999999")).willThrow(new ValidationException("Could not load data for fund 999999, check the code"));

        mockMvc.perform(post("/api/funds/add").contentType(MediaType.APPLICATION_JSON).content("{\"code\":\"999999\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Could not load data for fund 999999, check the code"));
    }

    @Test
    void addFundWithoutCodeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/funds/add").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void deleteFund() throws Exception {
        mockMvc.perform(delete("/api/funds/161725"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));

        verify(fundService).deleteFund("161725");
    }

    @Test
    void deleteUnknownFundIsNotFound() throws Exception {
        willThrow(new ResourceNotFoundException("Fund not found: 161725")).given(fundService).deleteFund("161725");

        mockMvc.perform(delete("/api/funds/161725"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Fund not found: 161725"));
    }

    @Test
    void portfolioFailureIsReportedInEnvelope() throws Exception {
        given(fundService.getFundPortfolio("161725", true)).willReturn(QueryResult.error("Failed to load fund portfolio"));

        mockMvc.perform(get("/api/funds/161725/portfolio").param("refresh", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("Failed to load fund portfolio"));
    }

    @Test
    void portfolioListsPositions() throws Exception {
        FundPortfolio portfolio = FundPortfolio.builder()
            .code("161725")
            .reportPeriod("2023年4季度")
            .positions(List.of(FundPortfolio.Position.builder()
                .stockCode("600519").stockName("Kweichow Moutai").weightPercent(new BigDecimal("15.20")).build()))
            .build();
        given(fundService.getFundPortfolio("161725", false)).willReturn(QueryResult.ok(portfolio));

        mockMvc.perform(get("/api/funds/161725/portfolio"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.positions[0].stockCode").value("600519"))
            .andExpect(jsonPath("$.data.positions[0].weightPercent").value(15.20));
    }
}
