package paystore.jdbc.payout;

import paystore.db.Database;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.ColumnValues;
import paystore.jdbc.RepositorySupport;
import paystore.jdbc.Table;
import paystore.payout.TransferRepository;
import paystore.payout.model.Transfer;
import paystore.payout.model.TransferCreate;
import paystore.payout.model.TransferMethodType;
import paystore.payout.model.TransferUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link TransferRepository} over the {@code transfers} table of the payout main database.
 */
public final class JdbcTransferRepository implements TransferRepository {
  static final Table TRANSFERS = Table.of("transfers",
      "id", "subtotal", "adjustments", "amount", "method", "currency", "status", "status_code",
      "payment_account_id", "recipient_id", "statement_description", "manual_transfer_reason",
      "should_retry_on_failure", "submitting_at", "submitted_at", "created_at", "deleted_at");

  private static final RowMapper<Transfer> MAPPER = row -> new Transfer(
      row.requiredLong("id"),
      row.requiredLong("subtotal"),
      row.requiredLong("adjustments"),
      row.requiredLong("amount"),
      row.requiredString("method"),
      row.string("currency"),
      row.string("status"),
      row.string("status_code"),
      row.longValue("payment_account_id"),
      row.longValue("recipient_id"),
      row.string("statement_description"),
      row.string("manual_transfer_reason"),
      row.bool("should_retry_on_failure"),
      row.instant("submitting_at"),
      row.instant("submitted_at"),
      row.instant("created_at"),
      row.instant("deleted_at"));

  private final RepositorySupport support;

  public JdbcTransferRepository(Database payoutMainDb) {
    this(new RepositorySupport(payoutMainDb));
  }

  public JdbcTransferRepository(RepositorySupport support) {
    this.support = Objects.requireNonNull(support, "support");
  }

  @Override
  public Transfer createTransfer(TransferCreate create) {
    ColumnValues values = ColumnValues.create()
        .put("subtotal", create.subtotal())
        .put("adjustments", create.adjustments())
        .put("amount", create.amount())
        .put("method", create.method())
        .put("currency", create.currency())
        .put("status", create.status())
        .put("payment_account_id", create.paymentAccountId())
        .put("recipient_id", create.recipientId())
        .put("statement_description", create.statementDescription())
        .put("manual_transfer_reason", create.manualTransferReason())
        .put("should_retry_on_failure", create.shouldRetryOnFailure())
        .put("created_at", RepositorySupport.now());
    return support.insert(TRANSFERS, values, MAPPER);
  }

  @Override
  public Optional<Transfer> getTransferById(long id) {
    return support.fetchOne(Route.REPLICA, TRANSFERS.select() + " WHERE id = ?", MAPPER, id);
  }

  @Override
  public List<Transfer> getTransfersByIds(Collection<Long> ids) {
    return support.fetchAllByKeys(Route.MASTER, TRANSFERS, "id", ids, MAPPER);
  }

  @Override
  public List<Long> getTransferIdsSubmittedAfter(Instant start, TransferMethodType method) {
    return support.fetchAll(Route.REPLICA,
        "SELECT id FROM transfers WHERE submitted_at >= ? AND method = ? ORDER BY id",
        row -> row.requiredLong("id"), start, method.value());
  }

  @Override
  public Optional<Transfer> updateTransferById(long id, TransferUpdate update) {
    ColumnValues set = ColumnValues.create()
        .putIfPresent("status", update.status())
        .putIfPresent("status_code", update.statusCode())
        .putIfPresent("method", update.method())
        .putIfPresent("submitting_at", update.submittingAt())
        .putIfPresent("submitted_at", update.submittedAt())
        .putIfPresent("deleted_at", update.deletedAt())
        .putIfPresent("manual_transfer_reason", update.manualTransferReason());
    return support.update(TRANSFERS, set, "id", id, MAPPER);
  }
}
