package com.openbudget.aggregates.model;

import java.util.List;

public record AggregatedLineItemConnection(List<AggregatedLineItem> nodes, PageInfo pageInfo) {

    public record PageInfo(long totalCount, boolean hasNextPage, boolean hasPreviousPage) {

        public static PageInfo of(long totalCount, int limit, int offset) {
            return new PageInfo(totalCount, (long) offset + limit < totalCount, offset > 0);
        }
    }

    public static AggregatedLineItemConnection empty(int offset) {
        return new AggregatedLineItemConnection(List.of(), new PageInfo(0, false, offset > 0));
    }
}
