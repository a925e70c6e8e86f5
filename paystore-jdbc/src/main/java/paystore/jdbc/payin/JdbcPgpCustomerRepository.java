package paystore.jdbc.payin;

import paystore.db.Database;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.ColumnValues;
import paystore.jdbc.RepositorySupport;
import paystore.jdbc.Table;
import paystore.payin.PgpCustomerRepository;
import paystore.payin.model.PgpCustomer;
import paystore.payin.model.PgpCustomerCreate;
import paystore.payin.model.PgpCustomerLookup;
import paystore.payin.model.PgpCustomerUpdate;
import paystore.util.JsonCodec;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link PgpCustomerRepository} over the {@code pgp_customers} table of the payin payment
 * database.
 */
public final class JdbcPgpCustomerRepository implements PgpCustomerRepository {
  static final Table PGP_CUSTOMERS = Table.of("pgp_customers",
      "id", "payer_id", "pgp_resource_id", "pgp_code", "currency", "legacy_id",
      "legacy_stripe_customer_id", "account_balance", "description", "default_payment_method_id",
      "legacy_default_source_id", "legacy_default_card_id", "metadata", "created_at", "updated_at",
      "deleted_at");

  private final RepositorySupport support;
  private final JsonCodec jsonCodec;
  private final RowMapper<PgpCustomer> mapper;

  public JdbcPgpCustomerRepository(Database payinPaymentDb) {
    this(new RepositorySupport(payinPaymentDb), JsonCodec.getDefault());
  }

  public JdbcPgpCustomerRepository(RepositorySupport support, JsonCodec jsonCodec) {
    this.support = Objects.requireNonNull(support, "support");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.mapper = row -> new PgpCustomer(
        row.requiredString("id"),
        row.requiredString("payer_id"),
        row.string("pgp_resource_id"),
        row.string("pgp_code"),
        row.string("currency"),
        row.string("legacy_id"),
        row.string("legacy_stripe_customer_id"),
        row.longValue("account_balance"),
        row.string("description"),
        row.string("default_payment_method_id"),
        row.string("legacy_default_source_id"),
        row.string("legacy_default_card_id"),
        this.jsonCodec.parseObject(row.string("metadata")),
        row.instant("created_at"),
        row.instant("updated_at"),
        row.instant("deleted_at"));
  }

  @Override
  public PgpCustomer insertPgpCustomer(PgpCustomerCreate create) {
    Instant now = RepositorySupport.now();
    ColumnValues values = ColumnValues.create()
        .put("id", create.id())
        .put("payer_id", create.payerId())
        .put("pgp_resource_id", create.pgpResourceId())
        .put("pgp_code", create.pgpCode())
        .put("currency", create.currency())
        .put("legacy_id", create.legacyId())
        .put("legacy_stripe_customer_id", create.legacyStripeCustomerId())
        .put("account_balance", create.accountBalance())
        .put("description", create.description())
        .put("default_payment_method_id", create.defaultPaymentMethodId())
        .put("legacy_default_source_id", create.legacyDefaultSourceId())
        .put("legacy_default_card_id", create.legacyDefaultCardId())
        .putJson("metadata", jsonCodec.toJson(create.metadata()))
        .put("created_at", now)
        .put("updated_at", now);
    return support.insert(PGP_CUSTOMERS, values, mapper);
  }

  @Override
  public Optional<PgpCustomer> getPgpCustomer(PgpCustomerLookup lookup) {
    if (lookup.id() != null) {
      return support.fetchOne(Route.MASTER, PGP_CUSTOMERS.select() + " WHERE id = ?", mapper,
          lookup.id());
    }
    if (lookup.pgpCode() != null) {
      return support.fetchOne(Route.MASTER, PGP_CUSTOMERS.select()
              + " WHERE payer_id = ? AND pgp_code = ? ORDER BY created_at, id", mapper,
          lookup.payerId(), lookup.pgpCode());
    }
    return support.fetchOne(Route.MASTER,
        PGP_CUSTOMERS.select() + " WHERE payer_id = ? ORDER BY created_at, id", mapper,
        lookup.payerId());
  }

  @Override
  public Optional<PgpCustomer> updatePgpCustomerById(String id, PgpCustomerUpdate update) {
    ColumnValues set = ColumnValues.create()
        .putIfPresent("default_payment_method_id", update.defaultPaymentMethodId())
        .putIfPresent("legacy_default_source_id", update.legacyDefaultSourceId())
        .putIfPresent("legacy_default_card_id", update.legacyDefaultCardId())
        .putIfPresent("updated_at", update.updatedAt());
    return support.update(PGP_CUSTOMERS, set, "id", id, mapper);
  }

  @Override
  public List<PgpCustomer> listPgpCustomersByPayerId(String payerId) {
    return support.fetchAll(Route.REPLICA,
        PGP_CUSTOMERS.select() + " WHERE payer_id = ? ORDER BY created_at, id", mapper, payerId);
  }
}
