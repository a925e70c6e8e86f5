package paystore.payout;

import paystore.payout.model.Transfer;
import paystore.payout.model.TransferCreate;
import paystore.payout.model.TransferMethodType;
import paystore.payout.model.TransferUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for transfers in the payout main database.
 *
 * @see paystore.jdbc.payout.JdbcTransferRepository
 */
public interface TransferRepository {

  /**
   * Inserts a transfer, stamping {@code created_at} with the current time.
   */
  Transfer createTransfer(TransferCreate create);

  /**
   * Reads a transfer from the replica. A transfer created moments ago may not be visible yet.
   */
  Optional<Transfer> getTransferById(long id);

  /**
   * Reads transfers from master, ordered by id. Unknown ids are skipped.
   */
  List<Transfer> getTransfersByIds(Collection<Long> ids);

  /**
   * Ids of transfers submitted at or after {@code start} through {@code method}, ascending, read
   * from the replica.
   */
  List<Long> getTransferIdsSubmittedAfter(Instant start, TransferMethodType method);

  Optional<Transfer> updateTransferById(long id, TransferUpdate update);
}
