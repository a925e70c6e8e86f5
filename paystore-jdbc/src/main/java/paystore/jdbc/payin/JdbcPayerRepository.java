package paystore.jdbc.payin;

import paystore.db.Database;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.ColumnValues;
import paystore.jdbc.RepositorySupport;
import paystore.jdbc.Table;
import paystore.payin.PayerRepository;
import paystore.payin.model.Payer;
import paystore.payin.model.PayerCreate;
import paystore.payin.model.PayerLookup;
import paystore.payin.model.PayerUpdate;
import paystore.util.JsonCodec;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link PayerRepository} over the {@code payers} table of the payin payment database.
 */
public final class JdbcPayerRepository implements PayerRepository {
  static final Table PAYERS = Table.of("payers",
      "id", "payer_type", "country", "legacy_stripe_customer_id", "account_balance",
      "description", "dd_payer_id", "metadata", "created_at", "updated_at", "deleted_at");

  private final RepositorySupport support;
  private final JsonCodec jsonCodec;
  private final RowMapper<Payer> mapper;

  public JdbcPayerRepository(Database payinPaymentDb) {
    this(new RepositorySupport(payinPaymentDb), JsonCodec.getDefault());
  }

  public JdbcPayerRepository(RepositorySupport support, JsonCodec jsonCodec) {
    this.support = Objects.requireNonNull(support, "support");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.mapper = row -> new Payer(
        row.requiredString("id"),
        row.string("payer_type"),
        row.string("country"),
        row.string("legacy_stripe_customer_id"),
        row.longValue("account_balance"),
        row.string("description"),
        row.string("dd_payer_id"),
        this.jsonCodec.parseObject(row.string("metadata")),
        row.instant("created_at"),
        row.instant("updated_at"),
        row.instant("deleted_at"));
  }

  @Override
  public Payer insertPayer(PayerCreate create) {
    Instant now = RepositorySupport.now();
    ColumnValues values = ColumnValues.create()
        .put("id", create.id())
        .put("payer_type", create.payerType())
        .put("country", create.country())
        .put("legacy_stripe_customer_id", create.legacyStripeCustomerId())
        .put("account_balance", create.accountBalance())
        .put("description", create.description())
        .put("dd_payer_id", create.ddPayerId())
        .putJson("metadata", jsonCodec.toJson(create.metadata()))
        .put("created_at", now)
        .put("updated_at", now);
    return support.insert(PAYERS, values, mapper);
  }

  @Override
  public Optional<Payer> getPayerById(PayerLookup lookup) {
    if (lookup.id() != null) {
      return byColumn("id", lookup.id());
    }
    if (lookup.legacyStripeCustomerId() != null) {
      return byColumn("legacy_stripe_customer_id", lookup.legacyStripeCustomerId());
    }
    return byColumn("dd_payer_id", lookup.ddPayerId());
  }

  @Override
  public Optional<Payer> updatePayerById(String id, PayerUpdate update) {
    ColumnValues set = ColumnValues.create()
        .putIfPresent("description", update.description())
        .putIfPresent("account_balance", update.accountBalance())
        .putIfPresent("legacy_stripe_customer_id", update.legacyStripeCustomerId())
        .putJsonIfPresent("metadata", update.metadata(), jsonCodec::toJson)
        .putIfPresent("updated_at", update.updatedAt())
        .putIfPresent("deleted_at", update.deletedAt());
    return support.update(PAYERS, set, "id", id, mapper);
  }

  @Override
  public List<Payer> listPayersByIds(Collection<String> ids) {
    return support.fetchAllByKeys(Route.REPLICA, PAYERS, "id", ids, mapper);
  }

  // Legacy keys are not unique in old data; the oldest row wins.
  private Optional<Payer> byColumn(String column, String value) {
    return support.fetchOne(Route.MASTER,
        PAYERS.select() + " WHERE " + column + " = ? ORDER BY created_at, id", mapper, value);
  }
}
