package com.openmandi.pricing.ethics;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A risk rider on a successful assessment. Only {@link EthicsGuard} creates these.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class EthicsFlag {
    FlagType type;
    Severity severity;
    String rationale;
}
