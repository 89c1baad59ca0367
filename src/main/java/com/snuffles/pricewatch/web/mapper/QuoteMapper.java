package com.snuffles.pricewatch.web.mapper;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.history.PriceSummary;
import com.snuffles.pricewatch.service.PriceView;
import com.snuffles.pricewatch.web.dto.PriceDto;
import com.snuffles.pricewatch.web.dto.PriceSummaryDto;
import com.snuffles.pricewatch.web.dto.QuoteDto;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface QuoteMapper {

    QuoteDto toDto(Quote quote);

    List<QuoteDto> toDtos(List<Quote> quotes);

    PriceSummaryDto toDto(PriceSummary summary);

    PriceDto toDto(PriceView view);
}
