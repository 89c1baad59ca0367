package com.snuffles.pricewatch.web.mapper;

import com.snuffles.pricewatch.service.HoldingLine;
import com.snuffles.pricewatch.service.HoldingsReport;
import com.snuffles.pricewatch.service.HoldingsSummary;
import com.snuffles.pricewatch.web.dto.HoldingsReportDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(SpringExtension.class)
@ContextConfiguration(classes = HoldingsMapperImpl.class)
class HoldingsMapperTest {

    @Autowired
    private HoldingsMapper holdingsMapper;

    @Test
    void toDtoMapsLinesAndSummary() {
        HoldingLine line = HoldingLine.builder()
            .code("161725")
            .name("Liquor Index")
            .shares(new BigDecimal("1000"))
            .marketValue(new BigDecimal("1100.00"))
            .profitRate(new BigDecimal("10.00"))
            .source("Sina Fund")
            .build();
        HoldingsSummary summary = new HoldingsSummary(new BigDecimal("1000.00"), new BigDecimal("1100.00"),
            new BigDecimal("100.00"), new BigDecimal("10.00"), 1);

        HoldingsReportDto dto = holdingsMapper.toDto(new HoldingsReport(List.of(line), summary, "2024-03-01 10:00:00", false));

        assertThat(dto.getHoldings()).hasSize(1);
        assertThat(dto.getHoldings().get(0).getName()).isEqualTo("Liquor Index");
        assertThat(dto.getHoldings().get(0).getMarketValue()).isEqualByComparingTo("1100.00");
        assertThat(dto.getSummary().getTotalProfit()).isEqualByComparingTo("100.00");
        assertThat(dto.getSummary().getCount()).isEqualTo(1);
        assertThat(dto.getLastUpdate()).isEqualTo("2024-03-01 10:00:00");
        assertThat(dto.isStale()).isFalse();
    }

    @Test
    void staleCopyIsFlagged() {
        HoldingsReportDto dto = holdingsMapper.toDto(HoldingsReport.empty("2024-03-01 10:00:00").asStale());

        assertThat(dto.isStale()).isTrue();
        assertThat(dto.getHoldings()).isEmpty();
        assertThat(dto.getSummary().getCount()).isZero();
    }
}
