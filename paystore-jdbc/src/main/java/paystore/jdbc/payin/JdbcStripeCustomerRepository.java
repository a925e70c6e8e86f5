package paystore.jdbc.payin;

import paystore.db.Database;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.ColumnValues;
import paystore.jdbc.RepositorySupport;
import paystore.jdbc.Table;
import paystore.payin.StripeCustomerRepository;
import paystore.payin.model.StripeCustomer;
import paystore.payin.model.StripeCustomerCreate;
import paystore.payin.model.StripeCustomerLookup;
import paystore.payin.model.StripeCustomerUpdate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link StripeCustomerRepository} over the legacy {@code stripe_customer} table of the payin
 * main database. Ids are database-assigned.
 */
public final class JdbcStripeCustomerRepository implements StripeCustomerRepository {
  static final Table STRIPE_CUSTOMER = Table.of("stripe_customer",
      "id", "stripe_id", "country_shortname", "owner_type", "owner_id", "default_card",
      "default_source");

  private static final RowMapper<StripeCustomer> MAPPER = row -> new StripeCustomer(
      row.requiredLong("id"),
      row.requiredString("stripe_id"),
      row.string("country_shortname"),
      row.string("owner_type"),
      row.requiredLong("owner_id"),
      row.string("default_card"),
      row.string("default_source"));

  private final RepositorySupport support;

  public JdbcStripeCustomerRepository(Database payinMainDb) {
    this(new RepositorySupport(payinMainDb));
  }

  public JdbcStripeCustomerRepository(RepositorySupport support) {
    this.support = Objects.requireNonNull(support, "support");
  }

  @Override
  public StripeCustomer insertStripeCustomer(StripeCustomerCreate create) {
    ColumnValues values = ColumnValues.create()
        .put("stripe_id", create.stripeId())
        .put("country_shortname", create.countryShortname())
        .put("owner_type", create.ownerType())
        .put("owner_id", create.ownerId())
        .put("default_card", create.defaultCard())
        .put("default_source", create.defaultSource());
    return support.insert(STRIPE_CUSTOMER, values, MAPPER);
  }

  @Override
  public Optional<StripeCustomer> getStripeCustomer(StripeCustomerLookup lookup) {
    if (lookup.id() != null) {
      return support.fetchOne(Route.MASTER, STRIPE_CUSTOMER.select() + " WHERE id = ?", MAPPER,
          lookup.id());
    }
    return support.fetchOne(Route.MASTER,
        STRIPE_CUSTOMER.select() + " WHERE stripe_id = ? ORDER BY id", MAPPER, lookup.stripeId());
  }

  @Override
  public Optional<StripeCustomer> updateStripeCustomerById(long id, StripeCustomerUpdate update) {
    ColumnValues set = ColumnValues.create()
        .putIfPresent("default_card", update.defaultCard())
        .putIfPresent("default_source", update.defaultSource());
    return support.update(STRIPE_CUSTOMER, set, "id", id, MAPPER);
  }

  @Override
  public List<StripeCustomer> listStripeCustomersByOwner(String ownerType, long ownerId) {
    return support.fetchAll(Route.REPLICA,
        STRIPE_CUSTOMER.select() + " WHERE owner_type = ? AND owner_id = ? ORDER BY id", MAPPER,
        ownerType, ownerId);
  }
}
