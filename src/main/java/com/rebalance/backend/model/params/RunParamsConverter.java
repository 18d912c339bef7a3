package com.rebalance.backend.model.params;

import jakarta.persistence.Converter;

@Converter
public class RunParamsConverter extends JsonParamsConverter<RunParams> {

    public RunParamsConverter() {
        super(RunParams.class);
    }

    @Override
    RunParams empty() {
        return new RunParams();
    }
}
