package paystore.payin.model;

/**
 * Selects one gateway customer either by id or by payer, optionally narrowed to one gateway.
 * {@code id} wins when both are given.
 */
public record PgpCustomerLookup(String id, String payerId, String pgpCode) {

  public PgpCustomerLookup {
    if (id == null && payerId == null) {
      throw new IllegalArgumentException("PgpCustomerLookup needs id or payerId");
    }
  }

  public static PgpCustomerLookup byId(String id) {
    return new PgpCustomerLookup(id, null, null);
  }

  public static PgpCustomerLookup byPayerId(String payerId) {
    return new PgpCustomerLookup(null, payerId, null);
  }

  public static PgpCustomerLookup byPayerIdAndPgpCode(String payerId, String pgpCode) {
    return new PgpCustomerLookup(null, payerId, pgpCode);
  }
}
