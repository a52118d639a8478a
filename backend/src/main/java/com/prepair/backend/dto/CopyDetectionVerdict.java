package com.prepair.backend.dto;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class CopyDetectionVerdict {

    private final boolean copied;
    private final String reason;
    private final Double copyRatio; // null when no rule produced a ratio

    public static CopyDetectionVerdict copied(String reason, double copyRatio) {
        return new CopyDetectionVerdict(true, reason, Math.max(0.0, Math.min(1.0, copyRatio)));
    }

    public static CopyDetectionVerdict original() {
        return new CopyDetectionVerdict(false, "No copy detected", null);
    }
}
