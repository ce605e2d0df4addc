package com.topicmatch.backend.modules.constraint.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

import com.topicmatch.backend.global.error.ProblemException;

/**
 * The only place where a user-entered percentage becomes a stored ratio.
 */
public final class RatioConversion {

    private RatioConversion() {
    }

    public static Double percentToRatio(Double percent) {
        if (percent == null) {
            return null;
        }
        if (percent.isNaN() || percent < 0 || percent > 100) {
            throw new ProblemException(BAD_REQUEST, "INVALID_MIN_RATIO",
                    "minRatio must be a percentage between 0 and 100 but was %s".formatted(percent))
                    .with("minRatio", percent);
        }
        return percent / 100.0;
    }

    public static Double ratioToPercent(Double ratio) {
        return ratio == null ? null : ratio * 100.0;
    }
}
