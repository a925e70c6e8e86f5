package paystore.payin;

import paystore.payin.model.PaymentMethod;
import paystore.payin.model.PaymentMethodCreate;
import paystore.payin.model.PaymentMethodLookup;
import paystore.payin.model.PaymentMethodUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for payment methods in the payin payment database.
 */
public interface PaymentMethodRepository {

  PaymentMethod insertPaymentMethod(PaymentMethodCreate create);

  /**
   * Reads one payment method from master, including soft-deleted rows.
   */
  Optional<PaymentMethod> getPaymentMethod(PaymentMethodLookup lookup);

  Optional<PaymentMethod> updatePaymentMethodById(String id, PaymentMethodUpdate update);

  /**
   * Reads the payment methods attached to a payer from the replica, oldest first.
   *
   * @param includeDeleted whether rows with {@code deleted_at} set are returned
   */
  List<PaymentMethod> listPaymentMethodsByPayerId(String payerId, boolean includeDeleted);
}
