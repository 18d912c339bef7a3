package com.rebalance.backend.model.params;

import jakarta.persistence.Converter;

@Converter
public class OrderParamsConverter extends JsonParamsConverter<OrderParams> {

    public OrderParamsConverter() {
        super(OrderParams.class);
    }

    @Override
    OrderParams empty() {
        return new OrderParams();
    }
}
