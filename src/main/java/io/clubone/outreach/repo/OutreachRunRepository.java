package io.clubone.outreach.repo;

import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.model.OutreachRunStatus;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class OutreachRunRepository {

  private final SafeJdbc db;

  public OutreachRunRepository(SafeJdbc db) {
    this.db = db;
  }

  /**
   * @return the new run id, or null when the run row could not be written
   */
  public String createRun(RunMode mode, String triggerSource, Instant startedOn) {
    String id = UUID.randomUUID().toString();
    boolean ok = db.insert("crm_outreach_run",
      "INSERT INTO crm_outreach_run (run_id, run_mode, trigger_source, started_on, status) " +
      "VALUES (?, ?, ?, ?, ?)",
      id, mode.name(), triggerSource, SafeJdbc.timestamp(startedOn), OutreachRunStatus.RUNNING.getCode()
    );
    return ok ? id : null;
  }

  public void completeRun(String runId, OutreachRunStatus status, String summaryJson, Instant endedOn) {
    if (runId == null) {
      return;
    }
    db.update("crm_outreach_run",
      "UPDATE crm_outreach_run SET ended_on = ?, status = ?, summary_json = ? WHERE run_id = ?",
      SafeJdbc.timestamp(endedOn), status.getCode(), summaryJson, runId
    );
  }

  public Map<String, Object> findRun(String runId) {
    List<Map<String, Object>> rows = db.jdbc().queryForList(
      "SELECT run_id, run_mode, trigger_source, started_on, ended_on, status, summary_json " +
      "FROM crm_outreach_run WHERE run_id = ?",
      runId
    );
    return rows.isEmpty() ? null : rows.get(0);
  }

  public int countRunning() {
    Integer count = db.jdbc().queryForObject(
      "SELECT COUNT(1) FROM crm_outreach_run WHERE status = ?",
      Integer.class,
      OutreachRunStatus.RUNNING.getCode()
    );
    return count != null ? count : 0;
  }
}
