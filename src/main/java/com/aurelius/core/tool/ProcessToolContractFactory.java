package com.aurelius.core.tool;

import com.aurelius.config.ToolBinaryLocator;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("!test")
public class ProcessToolContractFactory implements ToolContractFactory {

    private final ProcessRunner runner;
    private final ToolBinaryLocator locator;
    private final ObjectMapper mapper;

    public ProcessToolContractFactory(ProcessRunner runner, ToolBinaryLocator locator, ObjectMapper mapper) {
        this.runner = runner;
        this.locator = locator;
        this.mapper = mapper;
    }

    @Override
    public ToolContract create(String engineCliOverride, String memoryCliOverride) {
        return new ProcessToolContract(runner, locator, mapper, engineCliOverride, memoryCliOverride);
    }
}
