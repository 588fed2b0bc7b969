package com.example.fssnapshot.scan;

import java.time.Instant;

public record RetryAttempt(
        int attempt,
        Instant timestamp,
        String error
) {
}
