package paystore.jdbc.payin;

import paystore.db.Database;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.ColumnValues;
import paystore.jdbc.RepositorySupport;
import paystore.jdbc.Table;
import paystore.payin.PaymentMethodRepository;
import paystore.payin.model.PaymentMethod;
import paystore.payin.model.PaymentMethodCreate;
import paystore.payin.model.PaymentMethodLookup;
import paystore.payin.model.PaymentMethodUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link PaymentMethodRepository} over the {@code pgp_payment_methods} table of the payin
 * payment database.
 */
public final class JdbcPaymentMethodRepository implements PaymentMethodRepository {
  static final Table PGP_PAYMENT_METHODS = Table.of("pgp_payment_methods",
      "id", "payer_id", "pgp_code", "pgp_resource_id", "legacy_consumer_id",
      "legacy_stripe_card_id", "type", "object", "attached_at", "detached_at", "created_at",
      "updated_at", "deleted_at");

  private static final RowMapper<PaymentMethod> MAPPER = row -> new PaymentMethod(
      row.requiredString("id"),
      row.string("payer_id"),
      row.string("pgp_code"),
      row.string("pgp_resource_id"),
      row.longValue("legacy_consumer_id"),
      row.longValue("legacy_stripe_card_id"),
      row.string("type"),
      row.string("object"),
      row.instant("attached_at"),
      row.instant("detached_at"),
      row.instant("created_at"),
      row.instant("updated_at"),
      row.instant("deleted_at"));

  private final RepositorySupport support;

  public JdbcPaymentMethodRepository(Database payinPaymentDb) {
    this(new RepositorySupport(payinPaymentDb));
  }

  public JdbcPaymentMethodRepository(RepositorySupport support) {
    this.support = Objects.requireNonNull(support, "support");
  }

  @Override
  public PaymentMethod insertPaymentMethod(PaymentMethodCreate create) {
    Instant now = RepositorySupport.now();
    ColumnValues values = ColumnValues.create()
        .put("id", create.id())
        .put("payer_id", create.payerId())
        .put("pgp_code", create.pgpCode())
        .put("pgp_resource_id", create.pgpResourceId())
        .put("legacy_consumer_id", create.legacyConsumerId())
        .put("legacy_stripe_card_id", create.legacyStripeCardId())
        .put("type", create.type())
        .put("object", create.object())
        .put("attached_at", create.attachedAt())
        .put("created_at", now)
        .put("updated_at", now);
    return support.insert(PGP_PAYMENT_METHODS, values, MAPPER);
  }

  @Override
  public Optional<PaymentMethod> getPaymentMethod(PaymentMethodLookup lookup) {
    if (lookup.id() != null) {
      return byColumn("id", lookup.id());
    }
    if (lookup.pgpResourceId() != null) {
      return byColumn("pgp_resource_id", lookup.pgpResourceId());
    }
    return byColumn("legacy_stripe_card_id", lookup.legacyStripeCardId());
  }

  @Override
  public Optional<PaymentMethod> updatePaymentMethodById(String id, PaymentMethodUpdate update) {
    ColumnValues set = ColumnValues.create()
        .putIfPresent("payer_id", update.payerId())
        .putIfPresent("attached_at", update.attachedAt())
        .putIfPresent("detached_at", update.detachedAt())
        .putIfPresent("deleted_at", update.deletedAt())
        .putIfPresent("updated_at", update.updatedAt());
    return support.update(PGP_PAYMENT_METHODS, set, "id", id, MAPPER);
  }

  @Override
  public List<PaymentMethod> listPaymentMethodsByPayerId(String payerId, boolean includeDeleted) {
    String sql = PGP_PAYMENT_METHODS.select() + " WHERE payer_id = ?"
        + (includeDeleted ? "" : " AND deleted_at IS NULL")
        + " ORDER BY created_at, id";
    return support.fetchAll(Route.REPLICA, sql, MAPPER, payerId);
  }

  private Optional<PaymentMethod> byColumn(String column, Object value) {
    return support.fetchOne(Route.MASTER,
        PGP_PAYMENT_METHODS.select() + " WHERE " + column + " = ? ORDER BY created_at, id",
        MAPPER, value);
  }
}
