package ai.tabular.translator.cli;

import ai.tabular.translator.engine.EngineId;
import picocli.CommandLine;

public class EngineIdConverter implements CommandLine.ITypeConverter<EngineId> {

    @Override
    public EngineId convert(String value) {
        return EngineId.from(value);
    }
}
