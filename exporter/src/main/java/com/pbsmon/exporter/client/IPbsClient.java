package com.pbsmon.exporter.client;

import com.pbsmon.core.model.BackupGroup;
import com.pbsmon.core.model.DatastoreUsage;
import com.pbsmon.core.model.GcStatus;
import com.pbsmon.core.model.NodeStatus;
import com.pbsmon.core.model.Snapshot;
import com.pbsmon.core.model.TapeDrive;
import com.pbsmon.core.model.Task;
import com.pbsmon.core.model.VersionInfo;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Typed access to the PBS management API.
 * <p>
 * Every operation is lazy: nothing is sent until the returned {@link Mono} is subscribed.
 * Failures are signalled as {@link PbsApiException}.
 * </p>
 */
public interface IPbsClient {

    Mono<NodeStatus> fetchNodeStatus();

    Mono<List<DatastoreUsage>> fetchDatastoreUsage();

    Mono<List<BackupGroup>> fetchBackupGroups(String datastore);

    Mono<List<Snapshot>> fetchSnapshots(String datastore);

    /**
     * Fetches the most recent tasks of the node.
     *
     * @param limit maximum number of tasks PBS should return
     */
    Mono<List<Task>> fetchTasks(int limit);

    Mono<GcStatus> fetchGcStatus(String datastore);

    Mono<List<TapeDrive>> fetchTapeDrives();

    Mono<VersionInfo> fetchVersion();
}
