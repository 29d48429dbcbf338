package org.kvplane.dao.worker;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A worker as reported by service discovery
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class WorkerInfo {

    private WorkerRef workerRef;

    private RuntimeConfig runtimeConfig;
}
