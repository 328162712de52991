package io.octavecanon.core.audit;

/** Pipeline stage that produced a repair entry. */
public enum PipelineStage {
    TOKENIZE,
    PARSE,
    REPAIR
}
