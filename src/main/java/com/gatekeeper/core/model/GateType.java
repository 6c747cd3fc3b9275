package com.gatekeeper.core.model;

/**
 * The two gate instances. Each writes to its own decision log file.
 */
public enum GateType {
    PRE_ACTION("pre_action"),
    COMPLETION("completion");

    private final String logName;

    GateType(String logName) {
        this.logName = logName;
    }

    public String logName() {
        return logName;
    }

    public String logFileName() {
        return logName + ".jsonl";
    }
}
