package com.pbsmon.exporter.metrics;

import com.pbsmon.core.metrics.MetricsNames;
import com.pbsmon.core.model.Task;

import java.util.List;
import java.util.Map;

/**
 * Projects the node task list into the task families.
 */
final class TaskProjector {
    static final String UNKNOWN = "unknown";
    static final String STATUS_RUNNING = "running";

    private TaskProjector() {
    }

    /**
     * @param tasks        tasks in fetch order; for shared label sets the last one wins
     * @param taskComments backup comments keyed by worker id ({@code "{datastore}:{type}/{id}"})
     */
    static void project(List<Task> tasks, Map<String, String> taskComments, CycleSamples samples) {
        for (Task task : tasks) {
            String workerType = task.getWorkerType() == null ? UNKNOWN : task.getWorkerType();
            String status = task.getStatus().orElse(UNKNOWN);
            String workerId = task.getWorkerId().orElse(UNKNOWN);
            String comment = CommentIndex.truncate(resolveComment(task, taskComments));

            samples.increment(MetricsNames.TASK_TOTAL, workerType, status, comment);

            if (isRunning(task)) {
                samples.increment(MetricsNames.TASK_RUNNING, workerType, comment);
                continue;
            }

            long endtime = task.getEndtime().orElseThrow();
            samples.set(MetricsNames.TASK_DURATION_SECONDS, endtime - task.getStarttime(),
                workerType, status, workerId, comment);
            samples.set(MetricsNames.TASK_LAST_RUN_TIMESTAMP, endtime, workerType);
        }
    }

    static boolean isRunning(Task task) {
        return task.getEndtime().isEmpty() || STATUS_RUNNING.equals(task.getStatus().orElse(null));
    }

    private static String resolveComment(Task task, Map<String, String> taskComments) {
        String own = task.getComment().orElse("");
        if (!own.isEmpty()) {
            return own;
        }
        return task.getWorkerId()
            .map(taskComments::get)
            .orElse("");
    }
}
