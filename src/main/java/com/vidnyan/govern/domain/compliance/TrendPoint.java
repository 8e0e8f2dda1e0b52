package com.vidnyan.govern.domain.compliance;

import java.time.Instant;

/**
 * One point of a score history; {@code violations} counts open violations only.
 */
public record TrendPoint(Instant date, int score, int violations) {
}
