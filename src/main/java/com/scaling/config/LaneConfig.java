package com.scaling.config;

import com.scaling.core.Priority;

/**
 * Configuration for one priority lane.
 *
 * @param priority Lane priority (also its drain position)
 * @param capacity Maximum number of pending tasks in the lane
 */
public record LaneConfig(
        Priority priority,
        int capacity
) {
    public static LaneConfig defaults(Priority priority) {
        return new LaneConfig(priority, TaskConfig.DEFAULT_LANE_CAPACITY);
    }
}
