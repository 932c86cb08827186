package com.openbudget.aggregates.controller.dto;

import com.openbudget.aggregates.model.AggregatedLineItem;
import com.openbudget.aggregates.model.AggregatedLineItemConnection;
import java.util.List;

public record AggregatedLineItemsResponseDto(List<Node> nodes, PageInfo pageInfo, String traceId) {

    public record Node(
            String functionalCode,
            String functionalName,
            String economicCode,
            String economicName,
            double amount,
            long count
    ) {
        static Node from(AggregatedLineItem item) {
            return new Node(item.functionalCode(), item.functionalName(), item.economicCode(), item.economicName(), item.amount(), item.count());
        }
    }

    public record PageInfo(long totalCount, boolean hasNextPage, boolean hasPreviousPage) {
    }

    public static AggregatedLineItemsResponseDto from(AggregatedLineItemConnection connection, String traceId) {
        AggregatedLineItemConnection.PageInfo info = connection.pageInfo();
        return new AggregatedLineItemsResponseDto(
                connection.nodes().stream().map(Node::from).toList(),
                new PageInfo(info.totalCount(), info.hasNextPage(), info.hasPreviousPage()),
                traceId
        );
    }
}
