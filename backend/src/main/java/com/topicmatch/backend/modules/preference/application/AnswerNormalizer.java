package com.topicmatch.backend.modules.preference.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.preference.domain.Question;

/**
 * Maps a raw questionnaire answer to [0, 1]: booleans to 0 or 1, scale values to {@code value / maxScale}.
 */
final class AnswerNormalizer {

    private AnswerNormalizer() {
    }

    static double rawValue(Question question, Object raw) {
        return switch (question.getKind()) {
            case BOOLEAN -> booleanValue(question, raw) ? 1.0 : 0.0;
            case SCALE -> scaleValue(question, raw);
        };
    }

    static double normalize(Question question, double rawValue) {
        return switch (question.getKind()) {
            case BOOLEAN -> rawValue;
            case SCALE -> rawValue / question.getMaxScale();
        };
    }

    private static boolean booleanValue(Question question, Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (value == 0.0 || value == 1.0) {
                return value == 1.0;
            }
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed) || "1".equals(trimmed)) {
                return true;
            }
            if ("false".equalsIgnoreCase(trimmed) || "0".equals(trimmed)) {
                return false;
            }
        }
        throw invalidAnswer(question, raw, "a boolean");
    }

    private static double scaleValue(Question question, Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw invalidAnswer(question, raw, "a number");
            }
        } else {
            throw invalidAnswer(question, raw, "a number");
        }
        Integer maxScale = question.getMaxScale();
        if (maxScale == null || maxScale <= 0) {
            throw new ProblemException(BAD_REQUEST, "QUESTION_SCALE_UNDEFINED",
                    "Question %s has no positive maxScale".formatted(question.getId()));
        }
        if (Double.isNaN(value) || value < 0 || value > maxScale) {
            throw invalidAnswer(question, raw, "a value between 0 and " + maxScale);
        }
        return value;
    }

    private static ProblemException invalidAnswer(Question question, Object raw, String expected) {
        return new ProblemException(BAD_REQUEST, "INVALID_ANSWER_VALUE",
                "Answer to question %s must be %s".formatted(question.getId(), expected))
                .with("questionId", question.getId())
                .with("value", raw);
    }
}
