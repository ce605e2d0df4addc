package com.topicmatch.backend.modules.solver.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.topicmatch.backend.modules.solver.domain.CompilationInput;

/**
 * Splits students as evenly as possible: every topic gets {@code count / topics} and the first
 * {@code count % topics} topics get one more.
 */
public final class GroupSizePlanner {

    private GroupSizePlanner() {
    }

    public static Map<UUID, Integer> evenSizes(int studentCount, List<UUID> orderedTopicIds) {
        Map<UUID, Integer> sizes = new LinkedHashMap<>();
        if (orderedTopicIds.isEmpty()) {
            return sizes;
        }
        int baseSize = studentCount / orderedTopicIds.size();
        int remainder = studentCount % orderedTopicIds.size();
        for (int i = 0; i < orderedTopicIds.size(); i++) {
            sizes.put(orderedTopicIds.get(i), baseSize + (i < remainder ? 1 : 0));
        }
        return sizes;
    }

    /**
     * Returns the input unchanged when sizes were supplied, otherwise with even sizes over the active topics.
     */
    public static CompilationInput withDefaultSizes(CompilationInput input) {
        if (!input.groupSizes().isEmpty()) {
            return input;
        }
        List<UUID> topicIds = input.orderedActiveTopics().stream()
                .map(CompilationInput.TopicInput::id)
                .toList();
        return input.withGroupSizes(evenSizes(input.orderedParticipants().size(), topicIds));
    }
}
