package paystore.payin;

import paystore.payin.model.PgpCustomer;
import paystore.payin.model.PgpCustomerCreate;
import paystore.payin.model.PgpCustomerLookup;
import paystore.payin.model.PgpCustomerUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for gateway customers in the payin payment database.
 */
public interface PgpCustomerRepository {

  PgpCustomer insertPgpCustomer(PgpCustomerCreate create);

  /**
   * Reads one gateway customer from master. A payer lookup without a gateway code returns the
   * oldest customer of that payer.
   */
  Optional<PgpCustomer> getPgpCustomer(PgpCustomerLookup lookup);

  Optional<PgpCustomer> updatePgpCustomerById(String id, PgpCustomerUpdate update);

  /**
   * Reads all gateway customers of a payer from the replica, oldest first.
   */
  List<PgpCustomer> listPgpCustomersByPayerId(String payerId);
}
