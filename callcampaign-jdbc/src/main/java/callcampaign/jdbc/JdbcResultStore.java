package callcampaign.jdbc;

import callcampaign.AttemptStatus;
import callcampaign.CallAttempt;
import callcampaign.CampaignResult;
import callcampaign.ErrorKind;
import callcampaign.FinalStatus;
import callcampaign.spi.ResultStore;
import callcampaign.transcript.CallOutcome;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link ResultStore} over a {@code campaign_result} table and a {@code campaign_call_attempt}
 * table holding each result's attempts.
 *
 * <p>A result and its attempts are written in one transaction. Saving a result for a contact
 * that already has one replaces it, so re-running a campaign keeps one row per contact.
 * {@link #findByCampaign} returns results in save order.
 */
public final class JdbcResultStore implements ResultStore {
  private static final Logger logger = Logger.getLogger(JdbcResultStore.class.getName());
  private static final int MAX_ERROR_LENGTH = 4000;

  private final ConnectionProvider connectionProvider;
  private final String resultTable;
  private final String attemptTable;

  public JdbcResultStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULTS);
  }

  public JdbcResultStore(ConnectionProvider connectionProvider, TableNames tables) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.resultTable = Objects.requireNonNull(tables, "tables").resultTable();
    this.attemptTable = tables.attemptTable();
  }

  @Override
  public void save(String campaignId, CampaignResult result) {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(result, "result");
    String insertResult = "INSERT INTO " + resultTable + " (campaign_id, contact_id, final_status, "
        + "error_kind, transcript, outcome, call_length_ms, attempt_count, completed_at) "
        + "VALUES (?,?,?,?,?,?,?,?,?)";
    String insertAttempt = "INSERT INTO " + attemptTable + " (campaign_id, contact_id, attempt_number, "
        + "status, error_kind, error_message, call_id, retry_after_ms, started_at, finished_at) "
        + "VALUES (?,?,?,?,?,?,?,?,?,?)";
    List<Object[]> attemptRows = new ArrayList<>(result.attempts().size());
    for (CallAttempt a : result.attempts()) {
      attemptRows.add(new Object[] {campaignId, result.contactId(), a.attemptNumber(),
          a.status().name(),
          a.errorKind().map(Enum::name).orElse(null),
          a.errorMessage().map(JdbcResultStore::truncateError).orElse(null),
          a.callId().orElse(null),
          a.retryAfter().map(Duration::toMillis).orElse(null),
          JdbcTemplate.timestamp(a.startedAt()),
          JdbcTemplate.timestamp(a.finishedAt().orElse(null))});
    }
    JdbcTemplate.inTransaction(connectionProvider, "save result of " + result.contactId(), conn -> {
      deleteExisting(conn, campaignId, result.contactId());
      JdbcTemplate.update(conn, insertResult, campaignId, result.contactId(),
          result.finalStatus().name(),
          result.errorKind() == null ? null : result.errorKind().name(),
          result.transcript(),
          result.outcome() == null ? null : result.outcome().name(),
          result.callLength().toMillis(),
          result.attempts().size(),
          JdbcTemplate.timestamp(result.completedAt()));
      JdbcTemplate.batchUpdate(conn, insertAttempt, attemptRows);
      return null;
    });
    logger.fine(() -> "Saved " + result.finalStatus() + " result for contact " + result.contactId()
        + " of campaign " + campaignId);
  }

  @Override
  public List<CampaignResult> findByCampaign(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    return JdbcTemplate.withConnection(connectionProvider, "load results of " + campaignId, conn -> {
      Map<String, List<CallAttempt>> attempts = new HashMap<>();
      JdbcTemplate.query(conn, "SELECT * FROM " + attemptTable
              + " WHERE campaign_id=? ORDER BY contact_id, attempt_number",
          JdbcResultStore::mapAttempt, campaignId)
          .forEach(a -> attempts.computeIfAbsent(a.contactId(), k -> new ArrayList<>()).add(a));
      return JdbcTemplate.query(conn, "SELECT * FROM " + resultTable
              + " WHERE campaign_id=? ORDER BY result_id",
          rs -> mapResult(rs, attempts), campaignId);
    });
  }

  private void deleteExisting(Connection conn, String campaignId, String contactId) {
    JdbcTemplate.update(conn, "DELETE FROM " + attemptTable + " WHERE campaign_id=? AND contact_id=?",
        campaignId, contactId);
    JdbcTemplate.update(conn, "DELETE FROM " + resultTable + " WHERE campaign_id=? AND contact_id=?",
        campaignId, contactId);
  }

  private static CampaignResult mapResult(ResultSet rs, Map<String, List<CallAttempt>> attempts)
      throws SQLException {
    String contactId = rs.getString("contact_id");
    String errorKind = rs.getString("error_kind");
    String outcome = rs.getString("outcome");
    return new CampaignResult(
        contactId,
        FinalStatus.valueOf(rs.getString("final_status")),
        errorKind == null ? null : ErrorKind.valueOf(errorKind),
        attempts.getOrDefault(contactId, List.of()),
        rs.getString("transcript"),
        outcome == null ? null : CallOutcome.valueOf(outcome),
        Duration.ofMillis(rs.getLong("call_length_ms")),
        JdbcTemplate.instant(rs, "completed_at"));
  }

  // Replays the stored state through the attempt's own transitions.
  private static CallAttempt mapAttempt(ResultSet rs) throws SQLException {
    CallAttempt attempt = new CallAttempt(rs.getString("contact_id"), rs.getInt("attempt_number"),
        JdbcTemplate.instant(rs, "started_at"));
    AttemptStatus status = AttemptStatus.valueOf(rs.getString("status"));
    String callId = rs.getString("call_id");
    Instant finishedAt = JdbcTemplate.instant(rs, "finished_at");
    if (callId != null) {
      attempt.markInProgress(callId);
    }
    switch (status) {
      case SUCCEEDED -> attempt.markSucceeded(finishedAt);
      case TIMED_OUT -> {
        if (callId != null) {
          attempt.markTimedOut(finishedAt);
        } else {
          attempt.markFailed(ErrorKind.TIMED_OUT, rs.getString("error_message"), finishedAt);
        }
      }
      case FAILED -> {
        long retryAfterMs = rs.getLong("retry_after_ms");
        Duration retryAfter = rs.wasNull() ? null : Duration.ofMillis(retryAfterMs);
        attempt.markFailed(ErrorKind.valueOf(rs.getString("error_kind")), rs.getString("error_message"),
            retryAfter, finishedAt);
      }
      default -> {
      }
    }
    return attempt;
  }

  private static String truncateError(String error) {
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }
}
