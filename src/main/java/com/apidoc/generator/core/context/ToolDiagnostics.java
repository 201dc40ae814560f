package com.apidoc.generator.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Recoverable problems (warnings/info) accumulated during a generation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addInfo(String info) {
        infos.add(info);
    }
}
