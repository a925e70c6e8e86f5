package paystore.payin;

import paystore.payin.model.Payer;
import paystore.payin.model.PayerCreate;
import paystore.payin.model.PayerLookup;
import paystore.payin.model.PayerUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for payers in the payin payment database.
 *
 * @see paystore.jdbc.payin.JdbcPayerRepository
 */
public interface PayerRepository {

  /**
   * Inserts a payer and returns the stored row.
   *
   * @throws paystore.db.IntegrityViolationException if the id or a unique key already exists
   */
  Payer insertPayer(PayerCreate create);

  /**
   * Reads one payer from master so that a read following a write observes it.
   */
  Optional<Payer> getPayerById(PayerLookup lookup);

  /**
   * Applies the present columns of {@code update} to the payer with {@code id}.
   *
   * @return the updated row, or empty if no payer has that id
   */
  Optional<Payer> updatePayerById(String id, PayerUpdate update);

  /**
   * Reads payers from the replica, ordered by id. Unknown ids are skipped.
   */
  List<Payer> listPayersByIds(Collection<String> ids);
}
