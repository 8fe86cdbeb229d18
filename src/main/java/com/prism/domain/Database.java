package com.prism.domain;

import com.prism.dialect.BaseEngineSpec;
import com.prism.dialect.TimeGrain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A physical database that tables live in, together with its engine spec
 */
public class Database {

    private final String databaseName;
    private final BaseEngineSpec engineSpec;

    public Database(String databaseName, BaseEngineSpec engineSpec) {
        this.databaseName = databaseName;
        this.engineSpec = engineSpec != null ? engineSpec : new BaseEngineSpec();
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public BaseEngineSpec getEngineSpec() {
        return engineSpec;
    }

    public List<TimeGrain> getGrains() {
        return engineSpec.getTimeGrains();
    }

    public List<String> getGrainNames() {
        return getGrains().stream().map(TimeGrain::getName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return databaseName;
    }
}
