package com.snuffles.pricewatch.web.mapper;

import com.snuffles.pricewatch.service.HoldingLine;
import com.snuffles.pricewatch.service.HoldingsReport;
import com.snuffles.pricewatch.service.HoldingsSummary;
import com.snuffles.pricewatch.web.dto.HoldingLineDto;
import com.snuffles.pricewatch.web.dto.HoldingsReportDto;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface HoldingsMapper {

    @Mapping(source = "lines", target = "holdings")
    HoldingsReportDto toDto(HoldingsReport report);

    HoldingLineDto toDto(HoldingLine line);

    HoldingsReportDto.SummaryDto toDto(HoldingsSummary summary);
}
