package io.agentkernel.scheduler;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Told when a task reaches COMPLETED or DEAD, inside the transaction that settles it.
 */
@FunctionalInterface
public interface TaskSettlementListener {
    void onTaskSettled(Connection connection, Task task) throws SQLException;
}
