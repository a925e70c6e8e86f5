package paystore.payin;

import paystore.payin.model.StripeCustomer;
import paystore.payin.model.StripeCustomerCreate;
import paystore.payin.model.StripeCustomerLookup;
import paystore.payin.model.StripeCustomerUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the legacy {@code stripe_customer} table in the payin main database.
 */
public interface StripeCustomerRepository {

  StripeCustomer insertStripeCustomer(StripeCustomerCreate create);

  Optional<StripeCustomer> getStripeCustomer(StripeCustomerLookup lookup);

  Optional<StripeCustomer> updateStripeCustomerById(long id, StripeCustomerUpdate update);

  /**
   * Reads the customers of one owner from the replica, ordered by id.
   */
  List<StripeCustomer> listStripeCustomersByOwner(String ownerType, long ownerId);
}
