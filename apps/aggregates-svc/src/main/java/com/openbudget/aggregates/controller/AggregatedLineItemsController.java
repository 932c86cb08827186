package com.openbudget.aggregates.controller;

import com.openbudget.aggregates.analytics.AggregatedLineItemsService;
import com.openbudget.aggregates.analytics.AggregationResult;
import com.openbudget.aggregates.controller.dto.AggregatedLineItemsRequestDto;
import com.openbudget.aggregates.controller.dto.AggregatedLineItemsResponseDto;
import com.openbudget.aggregates.model.AggregatedLineItemConnection;
import com.openbudget.aggregates.web.RequestContextHolder;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class AggregatedLineItemsController {

    private final AggregatedLineItemsService aggregatedLineItemsService;

    public AggregatedLineItemsController(AggregatedLineItemsService aggregatedLineItemsService) {
        this.aggregatedLineItemsService = aggregatedLineItemsService;
    }

    @PostMapping("/aggregated-line-items")
    public ResponseEntity<AggregatedLineItemsResponseDto> aggregatedLineItems(@Valid @RequestBody AggregatedLineItemsRequestDto request) {
        AggregationResult<AggregatedLineItemConnection> result = aggregatedLineItemsService.getAggregatedLineItems(
                request.toFilter(),
                request.limit(),
                request.offset()
        );
        if (!result.isOk()) {
            throw new AggregationFailureException(result.error());
        }
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(AggregatedLineItemsResponseDto.from(result.value(), traceId));
    }
}
