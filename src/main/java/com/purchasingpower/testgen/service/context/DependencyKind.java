package com.purchasingpower.testgen.service.context;

public enum DependencyKind {
    CALLED_FUNCTION,
    DATA_STRUCTURE,
    MACRO
}
