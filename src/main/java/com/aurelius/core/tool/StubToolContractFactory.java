package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("test")
public class StubToolContractFactory implements ToolContractFactory {

    private final ObjectMapper mapper;

    public StubToolContractFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ToolContract create(String engineCliOverride, String memoryCliOverride) {
        return new StubToolContract(mapper);
    }
}
