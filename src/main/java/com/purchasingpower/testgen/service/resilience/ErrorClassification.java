package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.ErrorCategory;
import lombok.Value;

@Value
public class ErrorClassification {
    ErrorCategory category;
    boolean retryable;
    String message;
    Throwable cause;
}
